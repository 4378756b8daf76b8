package com.williamcallahan.gvtakeout.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.williamcallahan.gvtakeout.model.Contact;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * A message inside a reconciled group, with its sender resolved to a contact.
 *
 * @param timestamp send time, null when unknown
 * @param sender sending contact, null when the markup named no sender
 * @param content message text
 * @param images attachment references in document order
 */
public record GroupMessage(
        OffsetDateTime timestamp,
        Contact sender,
        String content,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> images) {

    /**
     * Most recent first; messages without a timestamp sort last.
     */
    public static final Comparator<GroupMessage> NEWEST_FIRST = Comparator.comparing(
            GroupMessage::timestamp, Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder()));

    public GroupMessage {
        content = content == null ? "" : content;
        images = images == null ? List.of() : List.copyOf(images);
    }
}
