package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Canonical itinerary event. Instances are produced by
 * {@link com.example.itinerary.common.normalize.EventNormalizer}; {@code start} and {@code end}
 * are always derived from the category-specific dates.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "category")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TravelEvent.class, name = "travel"),
        @JsonSubTypes.Type(value = AccommodationEvent.class, name = "accommodation"),
        @JsonSubTypes.Type(value = ExperienceEvent.class, name = "experience"),
        @JsonSubTypes.Type(value = MealEvent.class, name = "meal")
})
public abstract sealed class ItineraryEvent permits TravelEvent, AccommodationEvent, ExperienceEvent, MealEvent {
    private String id;
    private EventType type = EventType.OTHER;
    private String title = "";
    private String start = "";
    private String end = "";
    private Location location = Location.empty();
    private String notes = "";

    public abstract EventCategory getCategory();

    public abstract <R> R accept(EventVisitor<R> visitor);

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public EventType getType() { return type; }
    public void setType(EventType type) { this.type = type != null ? type : EventType.OTHER; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title != null ? title : ""; }

    public String getStart() { return start; }
    public void setStart(String start) { this.start = start != null ? start : ""; }

    public String getEnd() { return end; }
    public void setEnd(String end) { this.end = end != null ? end : ""; }

    public Location getLocation() { return location; }
    public void setLocation(Location location) { this.location = location != null ? location : Location.empty(); }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes != null ? notes : ""; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id='" + id + "', type=" + type + ", title='" + title
                + "', start='" + start + "', end='" + end + "'}";
    }
}
