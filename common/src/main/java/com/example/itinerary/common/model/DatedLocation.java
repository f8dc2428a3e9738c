package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One leg endpoint: departure/arrival of a travel event, check-in/check-out of a stay.
 */
public class DatedLocation {
    private final String date;
    private final Location location;

    @JsonCreator
    public DatedLocation(@JsonProperty("date") String date,
                         @JsonProperty("location") Location location) {
        this.date = date != null ? date : "";
        this.location = location != null ? location : Location.empty();
    }

    public static DatedLocation empty() {
        return new DatedLocation("", Location.empty());
    }

    public String getDate() { return date; }
    public Location getLocation() { return location; }
}
