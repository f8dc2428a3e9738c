package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Trip metadata as stored by the trip store. Read-only to the assistant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Trip {
    private String id;
    private String name;
    private String startDate;
    private String endDate;
    private String userId;
    private Map<String, String> sharedWith; // uid -> "editor" | "viewer"

    public Trip() {}

    public Trip(String id, String name, String startDate, String endDate, String userId) {
        this.id = id;
        this.name = name;
        this.startDate = startDate;
        this.endDate = endDate;
        this.userId = userId;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate; }

    public String getEndDate() { return endDate; }
    public void setEndDate(String endDate) { this.endDate = endDate; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Map<String, String> getSharedWith() { return sharedWith; }
    public void setSharedWith(Map<String, String> sharedWith) { this.sharedWith = sharedWith; }

    @Override
    public String toString() {
        return "Trip{id='" + id + "', name='" + name + "', startDate='" + startDate + "', endDate='" + endDate + "'}";
    }
}
