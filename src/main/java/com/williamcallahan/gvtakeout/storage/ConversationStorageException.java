package com.williamcallahan.gvtakeout.storage;

/**
 * Raised when a conversation could not be written; the surrounding transaction has been rolled back.
 */
public class ConversationStorageException extends RuntimeException {

    public ConversationStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
