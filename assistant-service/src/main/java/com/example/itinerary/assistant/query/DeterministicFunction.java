package com.example.itinerary.assistant.query;

import java.util.Optional;

/**
 * Questions that are answered by exact computation over the itinerary instead of the model.
 */
public enum DeterministicFunction {
    COUNT_COUNTRIES("countCountries"),
    LIST_COUNTRIES("listCountries"),
    COUNT_FLIGHTS("countFlights"),
    COUNT_EVENTS("countEvents"),
    CALCULATE_HOTEL_NIGHTS("calculateHotelNights"),
    CALCULATE_LONGEST_LAYOVER("calculateLongestLayover"),
    CALCULATE_TOTAL_TRAVEL_DURATION("calculateTotalTravelDuration"),
    FIND_BUSIEST_DAY("findBusiestDay"),
    FIND_FREE_DAYS("findFreeDays"),
    LIST_CITIES("listCities"),
    CALCULATE_TRIP_DURATION("calculateTripDuration");

    private final String functionName;

    DeterministicFunction(String functionName) {
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }

    public static Optional<DeterministicFunction> fromFunctionName(String name) {
        for (DeterministicFunction f : values()) {
            if (f.functionName.equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
