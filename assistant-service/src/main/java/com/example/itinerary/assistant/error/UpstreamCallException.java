package com.example.itinerary.assistant.error;

/**
 * The language model call failed, returned nothing usable, or returned JSON that could not be parsed.
 */
public class UpstreamCallException extends RuntimeException {

    public UpstreamCallException(String message) {
        super(message);
    }

    public UpstreamCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
