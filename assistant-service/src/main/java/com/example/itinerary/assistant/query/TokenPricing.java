package com.example.itinerary.assistant.query;

import dev.langchain4j.model.output.TokenUsage;

/**
 * Per-million-token prices in USD.
 */
public final class TokenPricing {
    private final double inputPerMillion;
    private final double outputPerMillion;

    public TokenPricing(double inputPerMillion, double outputPerMillion) {
        this.inputPerMillion = inputPerMillion;
        this.outputPerMillion = outputPerMillion;
    }

    public double cost(int promptTokens, int completionTokens) {
        return promptTokens / 1_000_000d * inputPerMillion + completionTokens / 1_000_000d * outputPerMillion;
    }

    public static int promptTokens(TokenUsage usage) {
        return usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
    }

    public static int completionTokens(TokenUsage usage) {
        return usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
    }

    public double getInputPerMillion() { return inputPerMillion; }
    public double getOutputPerMillion() { return outputPerMillion; }
}
