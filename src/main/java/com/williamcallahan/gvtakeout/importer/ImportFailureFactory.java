package com.williamcallahan.gvtakeout.importer;

import com.williamcallahan.gvtakeout.storage.ConversationStorageException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.stereotype.Service;

/**
 * Turns the exceptions each import phase raises into {@link ImportFailure} records.
 *
 * <p>Details read {@code "<summary>: <exception>"}, followed by the innermost cause when it differs
 * from the exception itself.</p>
 */
@Service
public class ImportFailureFactory {

    /**
     * Failure while jsoup read the file from disk.
     */
    public ImportFailure parseFailure(Path file, IOException exception) {
        String summary;
        if (exception instanceof NoSuchFileException || exception instanceof FileNotFoundException) {
            summary = "file disappeared before it could be read";
        } else if (exception instanceof AccessDeniedException) {
            summary = "file is not readable";
        } else {
            summary = "could not read markup";
        }
        return build(file, ImportFailure.PHASE_PARSE, summary, exception);
    }

    /**
     * Failure while turning a parsed document into a conversation. An {@link IllegalArgumentException}
     * here means the markup produced values the conversation model refuses.
     */
    public ImportFailure extractFailure(Path file, RuntimeException exception) {
        String summary = exception instanceof IllegalArgumentException
                ? "markup yields an invalid conversation"
                : "extraction failed";
        return build(file, ImportFailure.PHASE_EXTRACT, summary, exception);
    }

    /**
     * Failure while handing a conversation to the sink.
     */
    public ImportFailure storeFailure(Path file, Exception exception) {
        String summary;
        if (exception instanceof ConversationStorageException) {
            summary = "database write rolled back";
        } else if (exception instanceof IOException) {
            summary = "could not write JSON line";
        } else {
            summary = "sink rejected conversation";
        }
        return build(file, ImportFailure.PHASE_STORE, summary, exception);
    }

    /**
     * A document that parsed but carried no recognizable record.
     */
    public ImportFailure unrecognized(Path file, String reason) {
        Objects.requireNonNull(file, "file");
        return new ImportFailure(file.toString(), ImportFailure.PHASE_EXTRACT, "Unrecognized document: " + reason);
    }

    private static ImportFailure build(Path file, String phase, String summary, Exception exception) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(exception, "exception");

        String details = summary + ": " + describe(exception);
        Throwable rootCause = NestedExceptionUtils.getMostSpecificCause(exception);
        if (rootCause != exception) {
            details += " (root cause " + describe(rootCause) + ")";
        }
        return new ImportFailure(file.toString(), phase, details);
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        String type = throwable.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
