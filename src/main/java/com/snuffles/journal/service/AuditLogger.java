package com.snuffles.journal.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snuffles.journal.config.CorrelationScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits audit events on the {@code journal.audit} logger as one JSON object per line.
 */
@Component
@Slf4j(topic = "journal.audit")
public class AuditLogger {

    public static final String TRADE_APPLIED = "trade.applied";
    public static final String CASH_ADJUSTED = "cash.adjusted";
    public static final String SNAPSHOT_CREATED = "snapshot.created";
    public static final String SNAPSHOT_SKIPPED = "snapshot.skipped";
    public static final String VALIDATION_FAILED = "validation.failed";
    public static final String CASH_AUDIT = "cash.audit";
    public static final String BACKFILL = "history.backfill";

    private final ObjectMapper objectMapper;

    public AuditLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void record(String eventType, Map<String, ?> fields) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", eventType);
        event.put("correlation_id", CorrelationScope.currentOrNew());
        event.putAll(fields);
        log.info(toJson(event));
    }

    private String toJson(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("Audit event {} not serializable as JSON, logging raw fields", event.get("event"), ex);
            return event.toString();
        }
    }
}
