package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EventCategory {
    TRAVEL("travel"),
    ACCOMMODATION("accommodation"),
    EXPERIENCE("experience"),
    MEAL("meal");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<EventCategory> fromValue(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim().toLowerCase(Locale.ROOT);
        for (EventCategory c : values()) {
            if (c.value.equals(v)) return Optional.of(c);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static EventCategory fromJson(String raw) {
        return fromValue(raw).orElseThrow(() -> new IllegalArgumentException("Unknown event category: " + raw));
    }

    @Override
    public String toString() {
        return value;
    }
}
