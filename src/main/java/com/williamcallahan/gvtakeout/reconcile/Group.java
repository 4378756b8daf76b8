package com.williamcallahan.gvtakeout.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.gvtakeout.model.Contact;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * A reconciled thread: every conversation whose participant set equals {@link #key()}.
 *
 * @param key participant set
 * @param participants contacts in the set, ordered by id
 * @param timestamp latest conversation time in the group, null when none is known
 * @param sourceFiles export files of the merged conversations
 * @param messages union of their messages, most recent first
 */
public record Group(
        ParticipantSetKey key,
        List<Contact> participants,
        OffsetDateTime timestamp,
        @JsonProperty("source_files") List<String> sourceFiles,
        List<GroupMessage> messages) {

    public Group {
        participants = List.copyOf(participants);
        sourceFiles = List.copyOf(sourceFiles);
        messages = List.copyOf(messages);
    }
}
