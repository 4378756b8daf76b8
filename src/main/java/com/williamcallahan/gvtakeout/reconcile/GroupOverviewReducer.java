package com.williamcallahan.gvtakeout.reconcile;

import com.williamcallahan.gvtakeout.model.Contact;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Streaming reducer that turns conversation/participant rows into one {@link GroupSummary} per
 * distinct participant set.
 *
 * <p>Rows must arrive with each conversation's rows contiguous, conversations ordered most recent
 * first. The first conversation seen for a set becomes its representative; later ones are only
 * recorded in {@link GroupSummary#conversationIds()}.</p>
 */
public final class GroupOverviewReducer {

    private final Map<ParticipantSetKey, GroupAccumulator> groups = new LinkedHashMap<>();
    private final Set<Long> closedConversations = new HashSet<>();

    private OverviewRow currentConversation;
    private final Map<Long, Contact> currentParticipants = new LinkedHashMap<>();

    public void accept(OverviewRow row) {
        Objects.requireNonNull(row, "row");
        if (currentConversation == null || currentConversation.conversationId() != row.conversationId()) {
            if (closedConversations.contains(row.conversationId())) {
                throw new IllegalStateException("Rows of conversation " + row.conversationId() + " are not contiguous");
            }
            closeCurrent();
            currentConversation = row;
        }
        currentParticipants.putIfAbsent(row.contact().id(), row.contact());
    }

    /**
     * Closes the last conversation and returns the groups in first-seen order.
     */
    public List<GroupSummary> finish() {
        closeCurrent();
        List<GroupSummary> summaries = new ArrayList<>(groups.size());
        for (Map.Entry<ParticipantSetKey, GroupAccumulator> entry : groups.entrySet()) {
            summaries.add(entry.getValue().toSummary(entry.getKey()));
        }
        return summaries;
    }

    private void closeCurrent() {
        if (currentConversation == null) {
            return;
        }
        ParticipantSetKey key = ParticipantSetKey.of(currentParticipants.keySet());
        GroupAccumulator group = groups.get(key);
        if (group == null) {
            groups.put(key, new GroupAccumulator(currentConversation, new ArrayList<>(currentParticipants.values())));
        } else {
            group.conversationIds.add(currentConversation.conversationId());
        }
        closedConversations.add(currentConversation.conversationId());
        currentConversation = null;
        currentParticipants.clear();
    }

    private static final class GroupAccumulator {
        private final OverviewRow representative;
        private final List<Contact> participants;
        private final List<Long> conversationIds = new ArrayList<>();

        private GroupAccumulator(OverviewRow representative, List<Contact> participants) {
            this.representative = representative;
            this.participants = participants;
            this.conversationIds.add(representative.conversationId());
        }

        private GroupSummary toSummary(ParticipantSetKey key) {
            return new GroupSummary(key, representative.type(), representative.timestamp(),
                    representative.conversationId(), participants, conversationIds, List.of());
        }
    }
}
