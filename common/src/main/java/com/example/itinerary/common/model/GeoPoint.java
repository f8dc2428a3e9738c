package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public class GeoPoint {
    private final double lat;
    private final double lng;

    @JsonCreator
    public GeoPoint(@JsonProperty("lat") double lat,
                    @JsonProperty("lng") double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    public double getLat() { return lat; }
    public double getLng() { return lng; }

    @Override
    public String toString() {
        return "GeoPoint{lat=" + lat + ", lng=" + lng + "}";
    }
}
