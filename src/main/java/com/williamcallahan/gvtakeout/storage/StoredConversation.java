package com.williamcallahan.gvtakeout.storage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A persisted conversation as returned by search and lookup.
 *
 * @param id conversation row id
 * @param type record kind
 * @param timestamp event or earliest-message time, null when unknown
 * @param duration call duration text
 * @param transcript voicemail transcript, or the first chat lines as {@code name: content}
 * @param sourceFile export file the conversation came from
 * @param participants resolved participant contacts
 */
public record StoredConversation(
        long id,
        ConversationType type,
        OffsetDateTime timestamp,
        String duration,
        String transcript,
        @JsonProperty("source_file") String sourceFile,
        List<Contact> participants) {

    public StoredConversation {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }
}
