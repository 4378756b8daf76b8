package com.williamcallahan.gvtakeout.storage;

import com.williamcallahan.gvtakeout.config.AppProperties;
import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the conversation tables and indexes when they do not exist yet.
 *
 * <p>Skipped for JSON import runs so they leave no database file behind.</p>
 */
@Component
public class ConversationSchema {
    private static final Logger log = LoggerFactory.getLogger(ConversationSchema.class);

    static final List<String> STATEMENTS = List.of(
            """
            CREATE TABLE IF NOT EXISTS contact (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                phone_number TEXT NOT NULL DEFAULT '',
                UNIQUE (name, phone_number)
            )""",
            """
            CREATE TABLE IF NOT EXISTS conversation (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                type TEXT NOT NULL,
                timestamp TEXT,
                duration TEXT NOT NULL DEFAULT '',
                transcript TEXT NOT NULL DEFAULT '',
                source_file TEXT NOT NULL DEFAULT ''
            )""",
            """
            CREATE TABLE IF NOT EXISTS participant (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                conversation_id INTEGER NOT NULL REFERENCES conversation (id),
                contact_id INTEGER NOT NULL REFERENCES contact (id)
            )""",
            """
            CREATE TABLE IF NOT EXISTS message (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                conversation_id INTEGER NOT NULL REFERENCES conversation (id),
                timestamp TEXT,
                sender_contact_id INTEGER REFERENCES contact (id),
                content TEXT NOT NULL DEFAULT ''
            )""",
            """
            CREATE TABLE IF NOT EXISTS image (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                message_id INTEGER NOT NULL REFERENCES message (id),
                image_url TEXT NOT NULL
            )""",
            """
            CREATE TABLE IF NOT EXISTS media_file (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                image_id INTEGER NOT NULL REFERENCES image (id),
                file_name TEXT NOT NULL,
                content BLOB
            )""",
            "CREATE INDEX IF NOT EXISTS idx_participant_conversation ON participant (conversation_id)",
            "CREATE INDEX IF NOT EXISTS idx_message_conversation ON message (conversation_id)",
            "CREATE INDEX IF NOT EXISTS idx_image_message ON image (message_id)");

    private final JdbcTemplate jdbcTemplate;
    private final AppProperties appProperties;

    public ConversationSchema(JdbcTemplate jdbcTemplate, AppProperties appProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.appProperties = appProperties;
    }

    @PostConstruct
    public void createIfMissing() {
        if (!appProperties.usesStore()) {
            log.debug("JSON import run; conversation schema not created");
            return;
        }
        for (String statement : STATEMENTS) {
            jdbcTemplate.execute(statement);
        }
        log.info("Conversation schema ready ({} statements)", STATEMENTS.size());
    }
}
