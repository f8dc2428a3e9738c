package com.example.itinerary.assistant.error;

/**
 * The serialized trip context exceeds the token ceiling of the calling path.
 */
public class ContextTooLargeException extends RuntimeException {

    private final int estimatedTokens;
    private final int ceiling;

    public ContextTooLargeException(String message, int estimatedTokens, int ceiling) {
        super(message);
        this.estimatedTokens = estimatedTokens;
        this.ceiling = ceiling;
    }

    public int getEstimatedTokens() {
        return estimatedTokens;
    }

    public int getCeiling() {
        return ceiling;
    }
}
