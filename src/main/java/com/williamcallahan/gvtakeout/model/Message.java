package com.williamcallahan.gvtakeout.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * One chat line inside a {@link Conversation}.
 *
 * @param timestamp when the message was sent; null when the markup carried no parseable time
 * @param sender display name of the sender
 * @param senderNumber phone number of the sender, empty when the markup omits it
 * @param content message text, empty for image-only messages
 * @param images attachment references in document order
 */
public record Message(
        OffsetDateTime timestamp,
        String sender,
        @JsonProperty("sender_number") String senderNumber,
        String content,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<String> images) {

    public Message {
        sender = sender == null ? "" : sender;
        senderNumber = senderNumber == null ? "" : senderNumber;
        content = content == null ? "" : content;
        images = images == null ? List.of() : List.copyOf(images);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Message)) {
            return false;
        }
        Message that = (Message) other;
        return sameInstant(timestamp, that.timestamp)
                && sender.equals(that.sender)
                && senderNumber.equals(that.senderNumber)
                && content.equals(that.content)
                && images.equals(that.images);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp == null ? null : timestamp.toInstant(), sender, senderNumber, content, images);
    }

    private static boolean sameInstant(OffsetDateTime left, OffsetDateTime right) {
        if (left == null || right == null) {
            return left == right;
        }
        return left.isEqual(right);
    }
}
