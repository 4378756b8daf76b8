package com.williamcallahan.gvtakeout.reconcile;

/**
 * One {@code participant} row: a contact taking part in a conversation.
 */
public record ParticipantRow(long conversationId, long contactId) {}
