package com.example.itinerary.assistant.api;

import com.example.itinerary.assistant.error.ContextTooLargeException;
import com.example.itinerary.assistant.error.QueryValidationException;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.assistant.trip.TripNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String code) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.value());
        if (code != null) out.put("code", code);
        if (message != null) out.put("message", message);
        return ResponseEntity.status(status).body(out);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleNotReadable(HttpMessageNotReadableException ex) {
        return body(HttpStatus.BAD_REQUEST, "Malformed JSON request", "BAD_JSON");
    }

    @ExceptionHandler(QueryValidationException.class)
    public ResponseEntity<Map<String, Object>> handleQueryValidation(QueryValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "Validation failed", "VALIDATION_ERROR");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "ILLEGAL_ARGUMENT");
    }

    @ExceptionHandler(ContextTooLargeException.class)
    public ResponseEntity<Map<String, Object>> handleContextTooLarge(ContextTooLargeException ex) {
        log.info("[GlobalExceptionHandler] Context too large: ~{} tokens (ceiling {})", ex.getEstimatedTokens(), ex.getCeiling());
        return body(HttpStatus.PAYLOAD_TOO_LARGE, ex.getMessage(), "CONTEXT_TOO_LARGE");
    }

    @ExceptionHandler(TripNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleTripNotFound(TripNotFoundException ex) {
        return body(HttpStatus.NOT_FOUND, "Trip not found", "TRIP_NOT_FOUND");
    }

    @ExceptionHandler(UpstreamCallException.class)
    public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamCallException ex) {
        log.warn("[GlobalExceptionHandler] Upstream failure: {}", ex.getMessage(), ex.getCause());
        return body(HttpStatus.BAD_GATEWAY, "Failed to process AI request", "UPSTREAM_ERROR");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("[GlobalExceptionHandler] Unhandled error: {}", ex.toString(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error", "INTERNAL_ERROR");
    }
}
