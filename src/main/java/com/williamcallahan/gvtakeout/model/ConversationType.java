package com.williamcallahan.gvtakeout.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of record a takeout document describes.
 *
 * <p>Chats carry an ordered message list; the call kinds carry a duration, and voicemail
 * additionally carries a transcript.</p>
 */
public enum ConversationType {
    CHAT("chat"),
    VOICEMAIL("voicemail"),
    MISSED_CALL("missed_call"),
    RECEIVED_CALL("received_call"),
    PLACED_CALL("placed_call");

    private final String wireName;

    ConversationType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the lower-case name used in JSON output and in the {@code conversation.type} column.
     */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns true for every kind except {@link #CHAT}.
     */
    public boolean isCall() {
        return this != CHAT;
    }

    /**
     * Resolves a stored or serialized name back to its type.
     *
     * @param wireName name as written by {@link #wireName()}
     * @return matching type
     * @throws IllegalArgumentException when the name is unknown
     */
    @JsonCreator
    public static ConversationType fromWireName(String wireName) {
        if (wireName == null) {
            throw new IllegalArgumentException("Conversation type is required");
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        for (ConversationType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown conversation type: " + wireName);
    }
}
