package com.example.itinerary.assistant.agent;

import com.example.itinerary.common.model.ItineraryEvent;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A change to the itinerary suggested by the agent. It starts {@link AgentActionStatus#PROPOSED}
 * and moves to confirmed or rejected exactly once; applying it is up to whoever confirms it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonPropertyOrder({"id", "type", "event", "reason", "status"})
public class AgentAction {
    private final String id;
    private final AgentActionType type;
    private final ItineraryEvent event;
    private final EventReference target;
    private final String reason;
    private AgentActionStatus status = AgentActionStatus.PROPOSED;

    private AgentAction(String id, AgentActionType type, ItineraryEvent event, EventReference target, String reason) {
        this.id = id;
        this.type = type;
        this.event = event;
        this.target = target;
        this.reason = reason;
    }

    public static AgentAction create(String id, ItineraryEvent event) {
        return new AgentAction(id, AgentActionType.CREATE_EVENT, event, null, null);
    }

    public static AgentAction edit(String id, ItineraryEvent event) {
        return new AgentAction(id, AgentActionType.EDIT_EVENT, event, null, null);
    }

    public static AgentAction delete(String id, EventReference target, String reason) {
        return new AgentAction(id, AgentActionType.DELETE_EVENT, null, target, reason);
    }

    public void confirm() {
        transition(AgentActionStatus.CONFIRMED);
    }

    public void reject() {
        transition(AgentActionStatus.REJECTED);
    }

    private void transition(AgentActionStatus next) {
        if (status != AgentActionStatus.PROPOSED) {
            throw new IllegalStateException("Action " + id + " is already " + status.getValue());
        }
        status = next;
    }

    @JsonProperty
    public String getId() { return id; }
    @JsonProperty
    public AgentActionType getType() { return type; }
    @JsonProperty
    public String getReason() { return reason; }
    @JsonProperty
    public AgentActionStatus getStatus() { return status; }

    /** Canonical event for create and edit; null for delete. */
    public ItineraryEvent getEvent() { return event; }

    /** Deletion target; null for create and edit. */
    public EventReference getTarget() { return target; }

    @JsonProperty("event")
    Object getPayload() {
        return event != null ? event : target;
    }
}
