package com.williamcallahan.gvtakeout.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized record of one takeout document: a chat thread, a voicemail, or a call.
 *
 * <p>The populated fields depend on {@link #type()}: chats carry {@link #messages()}, calls carry
 * {@link #duration()}, and voicemail also carries {@link #transcript()}. The compact constructor
 * rejects any other combination.</p>
 *
 * @param type record kind
 * @param participants display name to phone number, empty number when the markup omits it
 * @param timestamp event time for calls, earliest message time for chats; null when unknown
 * @param duration free-text call duration such as {@code 00:00:18}
 * @param transcript voicemail transcript
 * @param messages chat messages in document order
 * @param sourceFile name of the export file the record came from
 */
public record Conversation(
        ConversationType type,
        Map<String, String> participants,
        OffsetDateTime timestamp,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String duration,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String transcript,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Message> messages,
        @JsonProperty("source_file") String sourceFile) {

    public Conversation {
        Objects.requireNonNull(type, "Conversation type must not be null");
        participants = participants == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(participants));
        duration = duration == null ? "" : duration;
        transcript = transcript == null ? "" : transcript;
        messages = messages == null ? List.of() : List.copyOf(messages);
        sourceFile = sourceFile == null ? "" : sourceFile;

        if (type == ConversationType.CHAT && (!duration.isEmpty() || !transcript.isEmpty())) {
            throw new IllegalArgumentException("Chat conversations carry messages, not duration or transcript");
        }
        if (type.isCall() && !messages.isEmpty()) {
            throw new IllegalArgumentException("Call conversations (" + type.wireName() + ") cannot carry messages");
        }
        if (type != ConversationType.VOICEMAIL && !transcript.isEmpty()) {
            throw new IllegalArgumentException("Only voicemail carries a transcript, got " + type.wireName());
        }
    }

    /**
     * Builds a chat conversation anchored at its earliest message.
     *
     * @param participants display name to phone number
     * @param messages messages in document order
     * @return chat conversation without a source file
     */
    public static Conversation chat(Map<String, String> participants, List<Message> messages) {
        OffsetDateTime earliest = messages == null ? null : messages.stream()
                .map(Message::timestamp)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        return new Conversation(ConversationType.CHAT, participants, earliest, "", "", messages, "");
    }

    /**
     * Builds a call or voicemail conversation.
     *
     * @param type any call kind
     * @param participants display name to phone number
     * @param timestamp event time, null when unknown
     * @param duration free-text duration
     * @param transcript voicemail transcript, ignored for other call kinds
     * @return call conversation without a source file
     */
    public static Conversation call(ConversationType type, Map<String, String> participants,
                                    OffsetDateTime timestamp, String duration, String transcript) {
        if (!type.isCall()) {
            throw new IllegalArgumentException("Not a call type: " + type.wireName());
        }
        String keptTranscript = type == ConversationType.VOICEMAIL ? transcript : "";
        return new Conversation(type, participants, timestamp, duration, keptTranscript, List.of(), "");
    }

    /**
     * Returns a copy stamped with the export file it was read from.
     */
    public Conversation withSourceFile(String fileName) {
        return new Conversation(type, participants, timestamp, duration, transcript, messages, fileName);
    }
}
