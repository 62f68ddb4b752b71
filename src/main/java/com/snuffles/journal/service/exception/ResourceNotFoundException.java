package com.snuffles.journal.service.exception;

public class ResourceNotFoundException extends JournalException {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
