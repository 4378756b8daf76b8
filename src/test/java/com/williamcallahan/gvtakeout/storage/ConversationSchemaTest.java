package com.williamcallahan.gvtakeout.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.williamcallahan.gvtakeout.config.AppProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

class ConversationSchemaTest {

    @TempDir
    Path tempDir;

    private JdbcTemplate jdbcTemplate(Path database) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + database.toAbsolutePath());
        return new JdbcTemplate(dataSource);
    }

    private static AppProperties importRun(AppProperties.OutputFormat format) {
        AppProperties properties = new AppProperties();
        properties.getImport().setEnabled(true);
        properties.getTakeout().setFormat(format);
        return properties;
    }

    @Test
    void jsonImportRunLeavesNoDatabaseFile() {
        Path database = tempDir.resolve("conversations.db");

        new ConversationSchema(jdbcTemplate(database), importRun(AppProperties.OutputFormat.JSON)).createIfMissing();

        assertFalse(Files.exists(database), "JSON runs must not open the database");
    }

    @Test
    void sqliteImportRunCreatesEveryTable() {
        JdbcTemplate jdbcTemplate = jdbcTemplate(tempDir.resolve("conversations.db"));

        new ConversationSchema(jdbcTemplate, importRun(AppProperties.OutputFormat.SQLITE)).createIfMissing();

        assertEquals(6, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM sqlite_master WHERE type = 'table' AND name IN "
                        + "('contact', 'conversation', 'participant', 'message', 'image', 'media_file')",
                Integer.class));
    }

    @Test
    void serverModeCreatesSchemaEvenWhenJsonIsTheConfiguredFormat() {
        JdbcTemplate jdbcTemplate = jdbcTemplate(tempDir.resolve("conversations.db"));
        AppProperties serverMode = new AppProperties();
        serverMode.getTakeout().setFormat(AppProperties.OutputFormat.JSON);

        ConversationSchema schema = new ConversationSchema(jdbcTemplate, serverMode);
        schema.createIfMissing();
        schema.createIfMissing();

        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM conversation", Integer.class));
    }
}
