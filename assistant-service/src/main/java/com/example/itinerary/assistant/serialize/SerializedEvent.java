package com.example.itinerary.assistant.serialize;

import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.EventType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;

/**
 * Flattened event as sent to the model: one level of location fields plus a small
 * category-specific metadata map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "category", "type", "title", "start", "end", "country", "city", "venue", "metadata"})
public class SerializedEvent {
    private String id;
    private EventCategory category;
    private EventType type;
    private String title;
    private String start;
    private String end;
    private String country;
    private String city;
    private String venue;
    private Map<String, String> metadata;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public EventCategory getCategory() { return category; }
    public void setCategory(EventCategory category) { this.category = category; }

    public EventType getType() { return type; }
    public void setType(EventType type) { this.type = type; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getStart() { return start; }
    public void setStart(String start) { this.start = start; }

    public String getEnd() { return end; }
    public void setEnd(String end) { this.end = end; }

    public String getCountry() { return country; }
    public void setCountry(String country) { this.country = country; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getVenue() { return venue; }
    public void setVenue(String venue) { this.venue = venue; }

    public Map<String, String> getMetadata() { return metadata; }
    public void setMetadata(Map<String, String> metadata) { this.metadata = metadata; }
}
