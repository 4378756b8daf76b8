package com.williamcallahan.gvtakeout.importer;

import com.williamcallahan.gvtakeout.model.ConversationType;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of importing a single takeout file.
 */
public sealed interface TakeoutFileOutcome permits TakeoutFileOutcome.Imported, TakeoutFileOutcome.Failed {

    /**
     * Returns true when the file's conversation reached the sink.
     */
    boolean imported();

    /**
     * Returns a typed failure when importing failed.
     */
    Optional<ImportFailure> failure();

    static TakeoutFileOutcome importedFile(ConversationType type) {
        Objects.requireNonNull(type, "type");
        return new Imported(type);
    }

    static TakeoutFileOutcome failedFile(ImportFailure failure) {
        Objects.requireNonNull(failure, "failure");
        return new Failed(failure);
    }

    record Imported(ConversationType type) implements TakeoutFileOutcome {
        @Override
        public boolean imported() {
            return true;
        }

        @Override
        public Optional<ImportFailure> failure() {
            return Optional.empty();
        }
    }

    record Failed(ImportFailure detail) implements TakeoutFileOutcome {
        public Failed {
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean imported() {
            return false;
        }

        @Override
        public Optional<ImportFailure> failure() {
            return Optional.of(detail());
        }
    }
}
