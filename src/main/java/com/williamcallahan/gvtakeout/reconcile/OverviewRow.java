package com.williamcallahan.gvtakeout.reconcile;

import com.williamcallahan.gvtakeout.model.Contact;
import com.williamcallahan.gvtakeout.model.ConversationType;
import java.time.OffsetDateTime;

/**
 * A conversation joined with one of its participant contacts.
 */
public record OverviewRow(long conversationId, ConversationType type, OffsetDateTime timestamp, Contact contact) {}
