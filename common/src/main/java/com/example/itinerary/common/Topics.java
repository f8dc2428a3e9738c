package com.example.itinerary.common;

public final class Topics {

    private Topics() {
    }

    public static final String QUERY_TELEMETRY = "itinerary.query-telemetry";
}
