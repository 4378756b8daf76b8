package com.williamcallahan.gvtakeout.reconcile;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import com.williamcallahan.gvtakeout.storage.SqlTimestamps;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Builds groups from the relational store.
 *
 * <p>Both operations stream participant rows through a reducer in one pass and then fetch
 * messages for the selected conversations with a single query. They assume no concurrent writer
 * changes the participant rows between the two queries.</p>
 */
@Service
public class GroupQueryService {
    private static final Logger log = LoggerFactory.getLogger(GroupQueryService.class);

    private static final String MESSAGE_COLUMNS = """
            SELECT m.id, m.timestamp, m.content, ct.id AS contact_id, ct.name, ct.phone_number, i.image_url
            FROM message m
            LEFT JOIN image i ON m.id = i.message_id
            LEFT JOIN contact ct ON m.sender_contact_id = ct.id
            """;

    private final JdbcTemplate jdbcTemplate;

    public GroupQueryService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Lists one summary per distinct participant set, most recent first, each carrying the
     * messages of its representative conversation.
     */
    public List<GroupSummary> listGroups() {
        GroupOverviewReducer reducer = new GroupOverviewReducer();
        jdbcTemplate.query("""
                SELECT c.id, c.type, c.timestamp, ct.id AS contact_id, ct.name, ct.phone_number
                FROM conversation c
                JOIN participant p ON p.conversation_id = c.id
                JOIN contact ct ON p.contact_id = ct.id
                ORDER BY c.timestamp DESC, c.id DESC, p.id ASC
                """,
                rs -> {
                    reducer.accept(new OverviewRow(
                            rs.getLong("id"),
                            ConversationType.fromWireName(rs.getString("type")),
                            SqlTimestamps.parse(rs.getString("timestamp")),
                            contact(rs)));
                });

        List<GroupSummary> summaries = reducer.finish();
        List<GroupSummary> withMessages = new ArrayList<>(summaries.size());
        for (GroupSummary summary : summaries) {
            List<GroupMessage> messages = queryMessages(
                    List.of(summary.lastConversationId()), "m.timestamp ASC, m.id ASC");
            withMessages.add(summary.withRecentMessages(messages));
        }
        log.debug("Listed {} groups", withMessages.size());
        return withMessages;
    }

    /**
     * Loads the merged group for an exact participant set.
     *
     * @param key participant set to match exactly
     * @return the group, or empty when no conversation has exactly these participants
     */
    public Optional<Group> loadGroup(ParticipantSetKey key) {
        ExactSetConversationMatcher matcher = new ExactSetConversationMatcher(key);
        jdbcTemplate.query(
                "SELECT conversation_id, contact_id FROM participant ORDER BY conversation_id, id",
                rs -> {
                    matcher.accept(new ParticipantRow(rs.getLong("conversation_id"), rs.getLong("contact_id")));
                });
        List<Long> conversationIds = matcher.finish();
        if (conversationIds.isEmpty()) {
            log.debug("No conversations with participant set {}", key);
            return Optional.empty();
        }

        List<Contact> participants = jdbcTemplate.query(
                "SELECT id, name, phone_number FROM contact WHERE id IN (" + placeholders(key.size()) + ") ORDER BY id",
                (rs, rowNum) -> new Contact(rs.getLong("id"), rs.getString("name"), rs.getString("phone_number")),
                key.contactIds().toArray());

        Object[] ids = conversationIds.toArray();
        String inClause = placeholders(ids.length);
        List<String> sourceFiles = jdbcTemplate.queryForList(
                "SELECT source_file FROM conversation WHERE id IN (" + inClause + ") ORDER BY id",
                String.class, ids);
        String latest = jdbcTemplate.queryForObject(
                "SELECT MAX(timestamp) FROM conversation WHERE id IN (" + inClause + ")", String.class, ids);

        List<GroupMessage> messages = queryMessages(conversationIds, "m.timestamp DESC, m.id DESC");
        log.debug("Group {} merges {} conversations, {} messages", key, conversationIds.size(), messages.size());
        return Optional.of(new Group(key, participants, SqlTimestamps.parse(latest), sourceFiles, messages));
    }

    private List<GroupMessage> queryMessages(List<Long> conversationIds, String ordering) {
        Map<Long, MessageAccumulator> byMessage = new LinkedHashMap<>();
        jdbcTemplate.query(
                MESSAGE_COLUMNS + "WHERE m.conversation_id IN (" + placeholders(conversationIds.size()) + ")"
                        + " ORDER BY " + ordering + ", i.id ASC",
                rs -> {
                    long messageId = rs.getLong("id");
                    MessageAccumulator message = byMessage.get(messageId);
                    if (message == null) {
                        Contact sender = rs.getObject("contact_id") == null ? null : contact(rs);
                        message = new MessageAccumulator(
                                SqlTimestamps.parse(rs.getString("timestamp")), sender, rs.getString("content"));
                        byMessage.put(messageId, message);
                    }
                    String imageUrl = rs.getString("image_url");
                    if (imageUrl != null) {
                        message.images.add(imageUrl);
                    }
                },
                conversationIds.toArray());

        List<GroupMessage> messages = new ArrayList<>(byMessage.size());
        for (MessageAccumulator message : byMessage.values()) {
            messages.add(new GroupMessage(message.timestamp, message.sender, message.content, message.images));
        }
        return messages;
    }

    private static Contact contact(ResultSet rs) throws SQLException {
        return new Contact(rs.getLong("contact_id"), rs.getString("name"), rs.getString("phone_number"));
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    private static final class MessageAccumulator {
        private final OffsetDateTime timestamp;
        private final Contact sender;
        private final String content;
        private final List<String> images = new ArrayList<>();

        private MessageAccumulator(OffsetDateTime timestamp, Contact sender, String content) {
            this.timestamp = timestamp;
            this.sender = sender;
            this.content = content;
        }
    }
}
