package com.snuffles.journal.service.exception;

public class ValidationException extends JournalException {
    public ValidationException(String message) {
        super(message);
    }
}
