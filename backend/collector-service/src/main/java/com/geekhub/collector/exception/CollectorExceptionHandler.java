package com.geekhub.collector.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps collector exceptions to JSON error bodies.
 */
@RestControllerAdvice(basePackages = "com.geekhub.collector.controller")
@Slf4j
public class CollectorExceptionHandler {

    @ExceptionHandler({FeedNotFoundException.class, ArticleNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(CollectorException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(ContentExtractionException.class)
    public ResponseEntity<Map<String, Object>> handleExtraction(ContentExtractionException ex) {
        log.warn("Content extraction failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(EnrichmentException.class)
    public ResponseEntity<Map<String, Object>> handleEnrichment(EnrichmentException ex) {
        HttpStatus status = "AI_SETTINGS_INVALID".equals(ex.getErrorCode())
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.BAD_GATEWAY;
        log.warn("Enrichment error: {}", ex.getMessage());
        return respond(status, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().isEmpty()
                ? ex.getMessage()
                : ex.getFieldErrors().get(0).getDefaultMessage();
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(CollectorException.class)
    public ResponseEntity<Map<String, Object>> handleCollector(CollectorException ex) {
        log.error("Collector error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
