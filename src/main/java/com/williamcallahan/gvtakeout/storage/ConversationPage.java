package com.williamcallahan.gvtakeout.storage;

import java.util.List;

/**
 * One page of conversation search results plus the total match count.
 */
public record ConversationPage(List<StoredConversation> conversations, int total, int limit, int offset) {

    public ConversationPage {
        conversations = List.copyOf(conversations);
        if (total < 0) {
            throw new IllegalArgumentException("Total must be non-negative");
        }
    }
}
