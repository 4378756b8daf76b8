package com.williamcallahan.gvtakeout.reconcile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Streaming reducer that finds the conversations whose participant set equals a target set exactly.
 *
 * <p>Rows must arrive grouped by conversation id in ascending order. For the conversation in
 * progress the matcher is {@link MatchState#ACCUMULATING} until it has seen every target contact
 * ({@link MatchState#CONFIRMED_VALID}); any contact outside the target moves it to
 * {@link MatchState#CONFIRMED_INVALID}, which is terminal. A conversation is matched when it is
 * closed in the valid state, either because the next conversation id arrives or because
 * {@link #finish()} is called.</p>
 *
 * <p>Not thread-safe; use one instance per query.</p>
 */
public final class ExactSetConversationMatcher {

    /**
     * Validity of the conversation currently being accumulated.
     */
    public enum MatchState {
        ACCUMULATING,
        CONFIRMED_VALID,
        CONFIRMED_INVALID
    }

    private final ParticipantSetKey target;
    private final List<Long> matched = new ArrayList<>();
    private final Set<Long> seenTargetContacts = new HashSet<>();

    private Long currentConversationId;
    private MatchState state = MatchState.ACCUMULATING;
    private boolean finished;

    public ExactSetConversationMatcher(ParticipantSetKey target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Matches every conversation in one pass over {@code rows}.
     */
    public static List<Long> matchAll(ParticipantSetKey target, Iterable<ParticipantRow> rows) {
        ExactSetConversationMatcher matcher = new ExactSetConversationMatcher(target);
        for (ParticipantRow row : rows) {
            matcher.accept(row);
        }
        return matcher.finish();
    }

    /**
     * Feeds the next participant row.
     *
     * @throws IllegalStateException when rows are out of conversation order or the matcher is finished
     */
    public void accept(ParticipantRow row) {
        if (finished) {
            throw new IllegalStateException("Matcher already finished");
        }
        if (currentConversationId == null) {
            currentConversationId = row.conversationId();
        } else if (row.conversationId() != currentConversationId) {
            if (row.conversationId() < currentConversationId) {
                throw new IllegalStateException("Participant rows must be ordered by conversation id; got "
                        + row.conversationId() + " after " + currentConversationId);
            }
            closeCurrent();
            currentConversationId = row.conversationId();
        }
        state = transition(row.contactId());
    }

    /**
     * Closes the last conversation and returns the matched conversation ids in ascending order.
     */
    public List<Long> finish() {
        if (!finished) {
            if (currentConversationId != null) {
                closeCurrent();
                currentConversationId = null;
            }
            finished = true;
        }
        return List.copyOf(matched);
    }

    MatchState state() {
        return state;
    }

    private MatchState transition(long contactId) {
        if (state == MatchState.CONFIRMED_INVALID) {
            return state;
        }
        if (!target.contains(contactId)) {
            return MatchState.CONFIRMED_INVALID;
        }
        seenTargetContacts.add(contactId);
        return seenTargetContacts.size() == target.size() ? MatchState.CONFIRMED_VALID : MatchState.ACCUMULATING;
    }

    private void closeCurrent() {
        if (state == MatchState.CONFIRMED_VALID) {
            matched.add(currentConversationId);
        }
        state = MatchState.ACCUMULATING;
        seenTargetContacts.clear();
    }
}
