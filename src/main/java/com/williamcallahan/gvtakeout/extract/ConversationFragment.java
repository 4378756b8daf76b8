package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.ConversationType;
import com.williamcallahan.gvtakeout.model.Message;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable pieces discovered by the top-level document walk, folded by {@link ConversationAssembler}.
 */
sealed interface ConversationFragment {

    /**
     * Sender and recipient names from a {@code "A to B"} document title.
     */
    record TitleParties(String sender, String recipient) implements ConversationFragment {}

    /**
     * Contents of one {@code div.hChatLog.hfeed} branch. Participants keep document order.
     */
    record ChatLog(Map<String, String> participants, List<Message> messages) implements ConversationFragment {
        public ChatLog {
            participants = Collections.unmodifiableMap(new LinkedHashMap<>(participants));
            messages = List.copyOf(messages);
        }
    }

    /**
     * Contents of one {@code div.haudio} branch. {@code type} is null when no marker text was found.
     */
    record CallRecord(ConversationType type, Map<String, String> participants, OffsetDateTime timestamp,
                      String duration, String transcript) implements ConversationFragment {}
}
