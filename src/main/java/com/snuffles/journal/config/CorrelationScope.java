package com.snuffles.journal.config;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Binds a correlation id to the current thread's MDC for one logical operation that does not
 * arrive over HTTP (scheduled snapshots, seeding). Restores the previous id on close.
 */
public final class CorrelationScope implements AutoCloseable {

    public static final String MDC_KEY = "correlationId";

    private final String previous;

    private CorrelationScope(String correlationId) {
        this.previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, correlationId);
    }

    public static CorrelationScope open() {
        return new CorrelationScope(UUID.randomUUID().toString());
    }

    public static CorrelationScope open(String correlationId) {
        return new CorrelationScope(correlationId);
    }

    /** The id bound to this thread, or a fresh one when no scope is open. */
    public static String currentOrNew() {
        String current = MDC.get(MDC_KEY);
        return current != null ? current : UUID.randomUUID().toString();
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, previous);
        }
    }
}
