package com.snuffles.journal.web.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ApiError {
    Instant timestamp;
    int status;
    String error;
    String message;
    String path;
    String correlationId;
    List<FieldIssue> details;

    public record FieldIssue(String field, String issue) {
    }
}
