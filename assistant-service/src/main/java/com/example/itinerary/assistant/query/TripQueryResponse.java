package com.example.itinerary.assistant.query;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to one trip question. {@code cached} and {@code deterministic} are only present when true.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TripQueryResponse {
    private final String answer;
    private final int tokensUsed;
    private final int promptTokens;
    private final int completionTokens;
    private final double estimatedCostUsd;
    private final long latencyMs;
    private final Boolean cached;
    private final Boolean deterministic;

    public TripQueryResponse(String answer, int tokensUsed, int promptTokens, int completionTokens,
                             double estimatedCostUsd, long latencyMs, boolean cached, boolean deterministic) {
        this.answer = answer;
        this.tokensUsed = tokensUsed;
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.estimatedCostUsd = estimatedCostUsd;
        this.latencyMs = latencyMs;
        this.cached = cached ? Boolean.TRUE : null;
        this.deterministic = deterministic ? Boolean.TRUE : null;
    }

    public String getAnswer() { return answer; }
    public int getTokensUsed() { return tokensUsed; }
    public int getPromptTokens() { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }
    public double getEstimatedCostUsd() { return estimatedCostUsd; }
    public long getLatencyMs() { return latencyMs; }
    public Boolean getCached() { return cached; }
    public Boolean getDeterministic() { return deterministic; }
}
