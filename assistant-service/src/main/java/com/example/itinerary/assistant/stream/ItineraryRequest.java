package com.example.itinerary.assistant.stream;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ItineraryRequest {
    private final String tripName;
    private final String startDate;
    private final String endDate;
    private final String description;

    @JsonCreator
    public ItineraryRequest(@JsonProperty("tripName") String tripName,
                            @JsonProperty("startDate") String startDate,
                            @JsonProperty("endDate") String endDate,
                            @JsonProperty("description") String description) {
        this.tripName = tripName;
        this.startDate = startDate;
        this.endDate = endDate;
        this.description = description;
    }

    public String getTripName() { return tripName; }
    public String getStartDate() { return startDate; }
    public String getEndDate() { return endDate; }
    public String getDescription() { return description; }
}
