package com.snuffles.journal.web.controller;

import com.snuffles.journal.config.CorrelationScope;
import com.snuffles.journal.service.exception.ConfigException;
import com.snuffles.journal.service.exception.PriceUnavailableException;
import com.snuffles.journal.service.exception.RepositoryException;
import com.snuffles.journal.service.exception.ResourceNotFoundException;
import com.snuffles.journal.service.exception.ValidationException;
import com.snuffles.journal.web.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> new ApiError.FieldIssue(error.getField(), error.getDefaultMessage()))
            .toList();
        return buildError(HttpStatus.BAD_REQUEST, "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = ex.getConstraintViolations().stream()
            .map(violation -> new ApiError.FieldIssue(violation.getPropertyPath().toString(), violation.getMessage()))
            .toList();
        return buildError(HttpStatus.BAD_REQUEST, "Validation failed", details, request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "Malformed request", List.of(), request, ex);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException ex, HttpServletRequest request) {
        return buildError(HttpStatus.NOT_FOUND, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(PriceUnavailableException.class)
    public ResponseEntity<ApiError> handlePriceUnavailable(PriceUnavailableException ex, HttpServletRequest request) {
        List<ApiError.FieldIssue> details = ex.getTickers().stream()
            .map(ticker -> new ApiError.FieldIssue(ticker, "no price for " + ex.getDate()))
            .toList();
        return buildError(HttpStatus.CONFLICT, ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(RepositoryException.class)
    public ResponseEntity<ApiError> handleRepository(RepositoryException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(ConfigException.class)
    public ResponseEntity<ApiError> handleConfig(ConfigException ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", List.of(), request, ex);
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String message, List<ApiError.FieldIssue> details,
                                                HttpServletRequest request, Exception ex) {
        ApiError error = ApiError.builder()
            .timestamp(Instant.now())
            .status(status.value())
            .error(status.getReasonPhrase())
            .message(message)
            .path(request.getRequestURI())
            .correlationId(MDC.get(CorrelationScope.MDC_KEY))
            .details(details)
            .build();
        log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message);
        return ResponseEntity.status(status).body(error);
    }
}
