package com.example.itinerary.assistant.trip;

public class TripNotFoundException extends RuntimeException {

    private final String tripId;

    public TripNotFoundException(String tripId) {
        super("Trip not found: " + tripId);
        this.tripId = tripId;
    }

    public String getTripId() {
        return tripId;
    }
}
