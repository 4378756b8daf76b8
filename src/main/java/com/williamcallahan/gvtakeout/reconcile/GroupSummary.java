package com.williamcallahan.gvtakeout.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Overview entry for one participant set, represented by its most recent conversation.
 *
 * @param key participant set
 * @param type kind of the representative conversation
 * @param timestamp time of the representative conversation
 * @param lastConversationId id of the representative conversation
 * @param participants contacts in the set
 * @param conversationIds every conversation with this exact set, most recent first
 * @param recentMessages messages of the representative conversation, oldest first
 */
public record GroupSummary(
        ParticipantSetKey key,
        ConversationType type,
        OffsetDateTime timestamp,
        @JsonProperty("last_conversation_id") long lastConversationId,
        List<Contact> participants,
        @JsonProperty("conversation_ids") List<Long> conversationIds,
        @JsonProperty("recent_messages") List<GroupMessage> recentMessages) {

    public GroupSummary {
        participants = List.copyOf(participants);
        conversationIds = List.copyOf(conversationIds);
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }

    public GroupSummary withRecentMessages(List<GroupMessage> messages) {
        return new GroupSummary(key, type, timestamp, lastConversationId, participants, conversationIds, messages);
    }
}
