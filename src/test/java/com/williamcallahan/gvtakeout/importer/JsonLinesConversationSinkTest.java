package com.williamcallahan.gvtakeout.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.williamcallahan.gvtakeout.model.Conversation;
import com.williamcallahan.gvtakeout.model.ConversationType;
import com.williamcallahan.gvtakeout.model.Message;
import java.io.IOException;
import java.io.StringWriter;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Verifies the JSON lines output format.
 */
class JsonLinesConversationSinkTest {

    private ObjectMapper objectMapper;
    private StringWriter output;
    private JsonLinesConversationSink sink;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        output = new StringWriter();
        sink = new JsonLinesConversationSink(objectMapper, output);
    }

    @Test
    void write_emitsOneDocumentPerLine() throws IOException {
        OffsetDateTime sentAt = OffsetDateTime.of(2022, 6, 30, 18, 6, 39, 0, ZoneOffset.ofHours(-7));
        Conversation chat = Conversation.chat(Map.of("Me", "+2222"), List.of(
                new Message(sentAt, "Me", "+2222", "hello", List.of()),
                new Message(sentAt.plusSeconds(5), "Me", "+2222", "", List.of("Me - Text - x-1-1"))))
                .withSourceFile("sms.html");
        Conversation missed = Conversation.call(ConversationType.MISSED_CALL, Map.of("Ann", "+1"), null, "", "")
                .withSourceFile("missed.html");

        sink.write(chat, null);
        sink.write(missed, null);
        sink.close();

        String[] lines = output.toString().split("\n");
        assertEquals(2, lines.length);
        assertTrue(output.toString().endsWith("\n"));

        JsonNode chatJson = objectMapper.readTree(lines[0]);
        assertEquals("chat", chatJson.get("type").asText());
        assertEquals("sms.html", chatJson.get("source_file").asText());
        assertEquals("2022-06-30T18:06:39-07:00", chatJson.get("timestamp").asText());
        assertFalse(chatJson.has("duration"), "Empty duration is omitted");
        assertFalse(chatJson.has("transcript"), "Empty transcript is omitted");
        assertEquals("+2222", chatJson.get("messages").get(0).get("sender_number").asText());
        assertFalse(chatJson.get("messages").get(0).has("images"), "Empty images are omitted");
        assertFalse(chatJson.get("messages").get(0).has("blank"));
        assertEquals("Me - Text - x-1-1", chatJson.get("messages").get(1).get("images").get(0).asText());

        JsonNode missedJson = objectMapper.readTree(lines[1]);
        assertEquals("missed_call", missedJson.get("type").asText());
        assertTrue(missedJson.get("timestamp").isNull());
        assertFalse(missedJson.has("messages"));
        assertEquals("+1", missedJson.get("participants").get("Ann").asText());
    }
}
