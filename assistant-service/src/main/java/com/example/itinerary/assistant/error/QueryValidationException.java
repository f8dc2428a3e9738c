package com.example.itinerary.assistant.error;

/**
 * Rejected input: empty, too long or shaped like a prompt-injection attempt.
 * Thrown before any cache or model work is done.
 */
public class QueryValidationException extends RuntimeException {

    public QueryValidationException(String message) {
        super(message);
    }
}
