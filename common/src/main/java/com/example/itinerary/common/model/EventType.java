package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Event subtype. The catalogue is shared across categories; the agent tool schema
 * and the generation prompt tell the model which subtypes belong to which category.
 */
public enum EventType {
    FLIGHT("flight"),
    TRAIN("train"),
    CAR("car"),
    BOAT("boat"),
    BUS("bus"),
    HOTEL("hotel"),
    HOSTEL("hostel"),
    AIRBNB("airbnb"),
    ACTIVITY("activity"),
    TOUR("tour"),
    MUSEUM("museum"),
    CONCERT("concert"),
    RESTAURANT("restaurant"),
    OTHER("other");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<EventType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (EventType t : values()) {
            if (t.value.equals(v)) return Optional.of(t);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EventType fromJson(String raw) {
        return fromValue(raw).orElse(OTHER);
    }

    @Override
    public String toString() {
        return value;
    }
}
