package com.snuffles.journal.service.exception;

/**
 * Storage unavailable, ledger lock not acquired in time, or a write failed. Nothing was committed.
 */
public class RepositoryException extends JournalException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
