package com.snuffles.journal.service.exception;

/**
 * Base class of every failure the journal surfaces to its callers.
 */
public abstract class JournalException extends RuntimeException {

    protected JournalException(String message) {
        super(message);
    }

    protected JournalException(String message, Throwable cause) {
        super(message, cause);
    }
}
