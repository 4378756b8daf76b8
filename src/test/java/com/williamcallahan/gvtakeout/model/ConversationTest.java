package com.williamcallahan.gvtakeout.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies which fields each record kind may carry.
 */
class ConversationTest {

    private static final OffsetDateTime NOON = OffsetDateTime.of(2021, 4, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    void chat_takesEarliestMessageTime() {
        Conversation chat = Conversation.chat(Map.of("Ann", "+1"), List.of(
                new Message(NOON.plusHours(1), "Ann", "+1", "later", null),
                new Message(null, "Ann", "+1", "undated", null),
                new Message(NOON, "Ann", "+1", "earlier", null)));

        assertEquals(NOON, chat.timestamp());
        assertEquals("later", chat.messages().get(0).content());
    }

    @Test
    void chat_withoutDatedMessagesHasNoTimestamp() {
        assertNull(Conversation.chat(Map.of("Ann", "+1"), List.of()).timestamp());
    }

    @Test
    void call_dropsTranscriptUnlessVoicemail() {
        Conversation placed = Conversation.call(ConversationType.PLACED_CALL, Map.of("Bob", "+2"), NOON, "00:01:00", "ignored");

        assertEquals("", placed.transcript());
        assertEquals("00:01:00", placed.duration());
    }

    @Test
    void constructor_rejectsMixedShapes() {
        List<Message> messages = List.of(new Message(NOON, "Ann", "+1", "hi", null));

        assertThrows(IllegalArgumentException.class,
                () -> new Conversation(ConversationType.MISSED_CALL, Map.of(), NOON, "", "", messages, ""));
        assertThrows(IllegalArgumentException.class,
                () -> new Conversation(ConversationType.CHAT, Map.of(), NOON, "00:00:01", "", List.of(), ""));
        assertThrows(IllegalArgumentException.class,
                () -> new Conversation(ConversationType.RECEIVED_CALL, Map.of(), NOON, "", "text", List.of(), ""));
        assertThrows(IllegalArgumentException.class,
                () -> Conversation.call(ConversationType.CHAT, Map.of(), NOON, "", ""));
    }

    @Test
    void wireNamesRoundTrip() {
        for (ConversationType type : ConversationType.values()) {
            assertEquals(type, ConversationType.fromWireName(type.wireName()));
        }
        assertTrue(ConversationType.VOICEMAIL.isCall());
        assertThrows(IllegalArgumentException.class, () -> ConversationType.fromWireName("fax"));
    }

    @Test
    void messagesCompareTimestampsByInstant() {
        Message utc = new Message(NOON, "Ann", "+1", "hi", List.of());
        Message pacific = new Message(NOON.withOffsetSameInstant(ZoneOffset.ofHours(-7)), "Ann", "+1", "hi", null);

        assertEquals(utc, pacific);
        assertEquals(utc.hashCode(), pacific.hashCode());
    }
}
