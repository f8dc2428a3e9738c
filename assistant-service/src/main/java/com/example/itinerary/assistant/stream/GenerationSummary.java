package com.example.itinerary.assistant.stream;

/**
 * Final figures of a streamed generation, sent after the last event.
 */
public class GenerationSummary {
    private final String reply;
    private final int tokensUsed;
    private final int promptTokens;
    private final int completionTokens;
    private final double estimatedCostUsd;
    private final long latencyMs;
    private final int eventCount;

    public GenerationSummary(String reply, int promptTokens, int completionTokens, double estimatedCostUsd,
                             long latencyMs, int eventCount) {
        this.reply = reply;
        this.tokensUsed = promptTokens + completionTokens;
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.estimatedCostUsd = estimatedCostUsd;
        this.latencyMs = latencyMs;
        this.eventCount = eventCount;
    }

    public String getReply() { return reply; }
    public int getTokensUsed() { return tokensUsed; }
    public int getPromptTokens() { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }
    public double getEstimatedCostUsd() { return estimatedCostUsd; }
    public long getLatencyMs() { return latencyMs; }
    public int getEventCount() { return eventCount; }
}
