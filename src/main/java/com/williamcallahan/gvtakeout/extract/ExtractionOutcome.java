package com.williamcallahan.gvtakeout.extract;

import com.williamcallahan.gvtakeout.model.Conversation;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of extracting a single takeout document.
 */
public sealed interface ExtractionOutcome permits ExtractionOutcome.Extracted, ExtractionOutcome.Unrecognized {

    /**
     * Returns the extracted conversation when the document carried a chat log or call record.
     */
    Optional<Conversation> conversation();

    static ExtractionOutcome extracted(Conversation conversation) {
        Objects.requireNonNull(conversation, "conversation");
        return new Extracted(conversation);
    }

    /**
     * Returns an outcome for documents with no recognizable record markup.
     */
    static ExtractionOutcome unrecognized(String reason) {
        return new Unrecognized(reason);
    }

    record Extracted(Conversation value) implements ExtractionOutcome {
        public Extracted {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Optional<Conversation> conversation() {
            return Optional.of(value);
        }
    }

    record Unrecognized(String reason) implements ExtractionOutcome {
        public Unrecognized {
            if (reason == null || reason.isBlank()) {
                throw new IllegalArgumentException("Unrecognized outcome requires a reason");
            }
        }

        @Override
        public Optional<Conversation> conversation() {
            return Optional.empty();
        }
    }
}
