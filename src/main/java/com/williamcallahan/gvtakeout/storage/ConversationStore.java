package com.williamcallahan.gvtakeout.storage;

import com.williamcallahan.gvtakeout.config.AppProperties;
import com.williamcallahan.gvtakeout.media.MediaFileResolver;
import com.williamcallahan.gvtakeout.model.ContactIdentity;
import com.williamcallahan.gvtakeout.model.Conversation;
import com.williamcallahan.gvtakeout.model.Message;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes conversations into the relational store.
 *
 * <p>Each {@link #save} call runs in its own transaction: contacts are upserted on their
 * (name, phone number) key, then the conversation, participant, message and image rows are
 * inserted. When media capture is enabled the resolved attachment bytes go into {@code media_file}.
 * A failure anywhere rolls the whole conversation back.</p>
 */
@Repository
public class ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(ConversationStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final MediaFileResolver mediaFileResolver;
    private final AppProperties appProperties;

    public ConversationStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                             MediaFileResolver mediaFileResolver, AppProperties appProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.mediaFileResolver = mediaFileResolver;
        this.appProperties = appProperties;
    }

    /**
     * Persists one conversation.
     *
     * @param conversation conversation to write
     * @param sourceDir directory holding the export, used to resolve attachments; may be null when
     *     media capture is off
     * @return identifier of the new conversation row
     * @throws ConversationStorageException when any statement fails; nothing is kept for this conversation
     */
    public long save(Conversation conversation, Path sourceDir) {
        Objects.requireNonNull(conversation, "conversation");
        try {
            Long conversationId = transactionTemplate.execute(status -> insertConversation(conversation, sourceDir));
            return Objects.requireNonNull(conversationId, "conversation id");
        } catch (DataAccessException | TransactionException e) {
            throw new ConversationStorageException(
                    "Failed to store " + conversation.type().wireName() + " conversation from '"
                            + conversation.sourceFile() + "'", e);
        }
    }

    private long insertConversation(Conversation conversation, Path sourceDir) {
        Map<ContactIdentity, Long> contactIds = new HashMap<>();

        jdbcTemplate.update(
                "INSERT INTO conversation (type, timestamp, duration, transcript, source_file) VALUES (?, ?, ?, ?, ?)",
                conversation.type().wireName(),
                SqlTimestamps.format(conversation.timestamp()),
                conversation.duration(),
                conversation.transcript(),
                conversation.sourceFile());
        long conversationId = lastInsertId();

        for (Map.Entry<String, String> participant : conversation.participants().entrySet()) {
            long contactId = contactId(new ContactIdentity(participant.getKey(), participant.getValue()), contactIds);
            jdbcTemplate.update("INSERT INTO participant (conversation_id, contact_id) VALUES (?, ?)",
                    conversationId, contactId);
        }

        for (Message message : conversation.messages()) {
            Long senderId = message.sender().isEmpty()
                    ? null
                    : contactId(new ContactIdentity(message.sender(), message.senderNumber()), contactIds);
            jdbcTemplate.update(
                    "INSERT INTO message (conversation_id, timestamp, sender_contact_id, content) VALUES (?, ?, ?, ?)",
                    conversationId, SqlTimestamps.format(message.timestamp()), senderId, message.content());
            long messageId = lastInsertId();

            for (String image : message.images()) {
                jdbcTemplate.update("INSERT INTO image (message_id, image_url) VALUES (?, ?)", messageId, image);
                long imageId = lastInsertId();
                if (appProperties.getTakeout().isCaptureMedia() && sourceDir != null) {
                    captureMedia(imageId, image, sourceDir);
                }
            }
        }
        return conversationId;
    }

    private long contactId(ContactIdentity identity, Map<ContactIdentity, Long> cache) {
        Long cached = cache.get(identity);
        if (cached != null) {
            return cached;
        }
        jdbcTemplate.update(
                "INSERT INTO contact (name, phone_number) VALUES (?, ?) ON CONFLICT (name, phone_number) DO NOTHING",
                identity.name(), identity.phoneNumber());
        Long id = jdbcTemplate.queryForObject(
                "SELECT id FROM contact WHERE name = ? AND phone_number = ?",
                Long.class, identity.name(), identity.phoneNumber());
        long contactId = Objects.requireNonNull(id, "contact id");
        cache.put(identity, contactId);
        return contactId;
    }

    private void captureMedia(long imageId, String reference, Path sourceDir) {
        Optional<Path> file = mediaFileResolver.resolve(reference, sourceDir);
        if (file.isEmpty()) {
            return;
        }
        Path mediaPath = file.get();
        try {
            byte[] content = Files.readAllBytes(mediaPath);
            jdbcTemplate.update("INSERT INTO media_file (image_id, file_name, content) VALUES (?, ?, ?)",
                    imageId, mediaPath.getFileName().toString(), content);
        } catch (IOException e) {
            log.warn("Skipping media {} for '{}': {}", mediaPath, reference, e.getMessage());
        }
    }

    private long lastInsertId() {
        Long id = jdbcTemplate.queryForObject("SELECT last_insert_rowid()", Long.class);
        return Objects.requireNonNull(id, "last insert rowid");
    }
}
