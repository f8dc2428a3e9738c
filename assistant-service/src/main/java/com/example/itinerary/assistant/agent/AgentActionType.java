package com.example.itinerary.assistant.agent;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum AgentActionType {
    CREATE_EVENT("create_event"),
    EDIT_EVENT("edit_event"),
    DELETE_EVENT("delete_event");

    private final String toolName;

    AgentActionType(String toolName) {
        this.toolName = toolName;
    }

    @JsonValue
    public String getToolName() {
        return toolName;
    }

    public static Optional<AgentActionType> fromToolName(String name) {
        for (AgentActionType t : values()) {
            if (t.toolName.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
