package com.example.itinerary.assistant.serialize;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Payload handed to the model: trip bounds plus the serialized events.
 */
@JsonPropertyOrder({"trip", "events"})
public class AiContext {

    @JsonPropertyOrder({"name", "startDate", "endDate"})
    public static class TripSummary {
        private final String name;
        private final String startDate;
        private final String endDate;

        public TripSummary(String name, String startDate, String endDate) {
            this.name = name;
            this.startDate = startDate;
            this.endDate = endDate;
        }

        public String getName() { return name; }
        public String getStartDate() { return startDate; }
        public String getEndDate() { return endDate; }
    }

    private final TripSummary trip;
    private final List<SerializedEvent> events;

    public AiContext(TripSummary trip, List<SerializedEvent> events) {
        this.trip = trip;
        this.events = List.copyOf(events);
    }

    public TripSummary getTrip() { return trip; }
    public List<SerializedEvent> getEvents() { return events; }
}
