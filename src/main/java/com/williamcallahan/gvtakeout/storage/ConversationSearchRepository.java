package com.williamcallahan.gvtakeout.storage;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Read queries over stored conversations: substring search, counting and lookup by id.
 */
@Repository
public class ConversationSearchRepository {

    static final int PREVIEW_LINES = 5;

    private static final String MATCH_CLAUSE = """
            FROM conversation c
            LEFT JOIN message m ON c.id = m.conversation_id
            LEFT JOIN contact ct ON m.sender_contact_id = ct.id
            WHERE c.transcript LIKE ? ESCAPE '\\'
               OR m.content LIKE ? ESCAPE '\\'
               OR ct.name LIKE ? ESCAPE '\\'
            """;

    private final JdbcTemplate jdbcTemplate;

    public ConversationSearchRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns conversations whose transcript, message text or sender name contains {@code term},
     * newest first.
     *
     * @param term substring to look for; blank matches every conversation
     * @param limit maximum rows to return
     * @param offset rows to skip
     */
    public List<StoredConversation> search(String term, int limit, int offset) {
        String pattern = likePattern(term);
        List<ConversationRow> rows = jdbcTemplate.query(
                "SELECT DISTINCT c.id, c.type, c.timestamp, c.duration, c.source_file " + MATCH_CLAUSE
                        + " ORDER BY c.timestamp DESC, c.id DESC LIMIT ? OFFSET ?",
                (rs, rowNum) -> new ConversationRow(
                        rs.getLong("id"),
                        ConversationType.fromWireName(rs.getString("type")),
                        rs.getString("timestamp"),
                        rs.getString("duration"),
                        rs.getString("source_file")),
                pattern, pattern, pattern, limit, offset);
        return rows.stream().map(this::toStoredConversation).toList();
    }

    /**
     * Counts the conversations {@link #search} would match without paging.
     */
    public int count(String term) {
        String pattern = likePattern(term);
        Integer total = jdbcTemplate.queryForObject(
                "SELECT COUNT(DISTINCT c.id) " + MATCH_CLAUSE, Integer.class, pattern, pattern, pattern);
        return total == null ? 0 : total;
    }

    public Optional<StoredConversation> findById(long id) {
        List<ConversationRow> rows = jdbcTemplate.query(
                "SELECT id, type, timestamp, duration, source_file FROM conversation WHERE id = ?",
                (rs, rowNum) -> new ConversationRow(
                        rs.getLong("id"),
                        ConversationType.fromWireName(rs.getString("type")),
                        rs.getString("timestamp"),
                        rs.getString("duration"),
                        rs.getString("source_file")),
                id);
        return rows.stream().findFirst().map(this::toStoredConversation);
    }

    /**
     * Lists the participant contacts of a conversation in insertion order.
     */
    public List<Contact> participants(long conversationId) {
        return jdbcTemplate.query("""
                SELECT ct.id, ct.name, ct.phone_number
                FROM participant p
                JOIN contact ct ON p.contact_id = ct.id
                WHERE p.conversation_id = ?
                ORDER BY p.id
                """,
                (rs, rowNum) -> new Contact(rs.getLong("id"), rs.getString("name"), rs.getString("phone_number")),
                conversationId);
    }

    /**
     * Voicemail returns its transcript; other kinds return their first chat lines, one
     * {@code name: content} line each.
     */
    String transcriptPreview(long conversationId, ConversationType type) {
        if (type == ConversationType.VOICEMAIL) {
            String transcript = jdbcTemplate.queryForObject(
                    "SELECT transcript FROM conversation WHERE id = ?", String.class, conversationId);
            return transcript == null ? "" : transcript;
        }
        List<String> lines = jdbcTemplate.query("""
                SELECT ct.name, m.content
                FROM message m
                JOIN contact ct ON m.sender_contact_id = ct.id
                WHERE m.conversation_id = ?
                ORDER BY m.timestamp ASC, m.id ASC
                LIMIT ?
                """,
                (rs, rowNum) -> rs.getString("name") + ": " + rs.getString("content") + "\n",
                conversationId, PREVIEW_LINES);
        return String.join("", lines);
    }

    private StoredConversation toStoredConversation(ConversationRow row) {
        return new StoredConversation(
                row.id(),
                row.type(),
                SqlTimestamps.parse(row.timestamp()),
                row.duration(),
                transcriptPreview(row.id(), row.type()),
                row.sourceFile(),
                participants(row.id()));
    }

    static String likePattern(String term) {
        if (term == null) {
            return "%";
        }
        String escaped = term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private record ConversationRow(long id, ConversationType type, String timestamp, String duration,
                                   String sourceFile) {}
}
