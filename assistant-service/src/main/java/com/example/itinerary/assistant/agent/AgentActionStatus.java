package com.example.itinerary.assistant.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentActionStatus {
    PROPOSED,
    CONFIRMED,
    REJECTED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
