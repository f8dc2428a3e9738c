package com.example.itinerary.assistant.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One turn of the conversation as sent by the client. Only {@code user} and {@code assistant}
 * roles are forwarded to the model.
 */
public class AgentMessage {
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";

    private final String role;
    private final String content;

    @JsonCreator
    public AgentMessage(@JsonProperty("role") String role,
                        @JsonProperty("content") String content) {
        this.role = role;
        this.content = content != null ? content : "";
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(USER, content);
    }

    public static AgentMessage assistant(String content) {
        return new AgentMessage(ASSISTANT, content);
    }

    public String getRole() { return role; }
    public String getContent() { return content; }
}
