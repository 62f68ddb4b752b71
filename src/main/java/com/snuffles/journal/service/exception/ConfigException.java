package com.snuffles.journal.service.exception;

public class ConfigException extends JournalException {
    public ConfigException(String message) {
        super(message);
    }
}
