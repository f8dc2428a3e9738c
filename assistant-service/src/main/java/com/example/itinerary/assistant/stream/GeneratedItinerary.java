package com.example.itinerary.assistant.stream;

import com.example.itinerary.common.model.ItineraryEvent;

import java.util.List;

public class GeneratedItinerary {
    private final List<ItineraryEvent> events;
    private final String reply;
    private final int tokensUsed;
    private final int promptTokens;
    private final int completionTokens;
    private final double estimatedCostUsd;
    private final long latencyMs;

    public GeneratedItinerary(List<ItineraryEvent> events, String reply, int promptTokens, int completionTokens,
                              double estimatedCostUsd, long latencyMs) {
        this.events = List.copyOf(events);
        this.reply = reply;
        this.tokensUsed = promptTokens + completionTokens;
        this.promptTokens = promptTokens;
        this.completionTokens = completionTokens;
        this.estimatedCostUsd = estimatedCostUsd;
        this.latencyMs = latencyMs;
    }

    public List<ItineraryEvent> getEvents() { return events; }
    public String getReply() { return reply; }
    public int getTokensUsed() { return tokensUsed; }
    public int getPromptTokens() { return promptTokens; }
    public int getCompletionTokens() { return completionTokens; }
    public double getEstimatedCostUsd() { return estimatedCostUsd; }
    public long getLatencyMs() { return latencyMs; }
}
