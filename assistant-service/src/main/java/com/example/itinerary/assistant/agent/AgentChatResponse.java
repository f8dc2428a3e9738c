package com.example.itinerary.assistant.agent;

import java.util.List;

public class AgentChatResponse {
    private final String reply;
    private final List<AgentAction> actions;
    private final int tokensUsed;
    private final int promptTokens;
    private final int completionTokens;
    private final double estimatedCostUsd;
    private final long latencyMs;

    public AgentChatResponse(String reply, List<AgentAction> actions, int promptTokens, int completionTokens,
                             double estimatedCostUsd, long latencyMs) {
        this.reply = reply;
        this.actions = List.copyOf(actions);
        this.tokensUsed = promptTokens + completionTokens;
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.estimatedCostUsd = estimatedCostUsd;
        this.latencyMs = latencyMs;
    }

    public String getReply() { return reply; }
    public List<AgentAction> getActions() { return actions; }
    public int getTokensUsed() { return tokensUsed; }
    public int getPromptTokens() { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }
    public double getEstimatedCostUsd() { return estimatedCostUsd; }
    public long getLatencyMs() { return latencyMs; }
}
