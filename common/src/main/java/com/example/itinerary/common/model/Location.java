package com.example.itinerary.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Named place. {@code name}, {@code city} and {@code country} are never null;
 * absent values are empty strings. {@code geolocation} is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Location {
    private final String name;
    private final String city;
    private final String country;
    private final GeoPoint geolocation;

    @JsonCreator
    public Location(@JsonProperty("name") String name,
                    @JsonProperty("city") String city,
                    @JsonProperty("country") String country,
                    @JsonProperty("geolocation") GeoPoint geolocation) {
        this.name = name != null ? name : "";
        this.city = city != null ? city : "";
        this.country = country != null ? country : "";
        this.geolocation = geolocation;
    }

    public Location(String name, String city, String country) {
        this(name, city, country, null);
    }

    public static Location empty() {
        return new Location("", "", "", null);
    }

    public String getName() { return name; }
    public String getCity() { return city; }
    public String getCountry() { return country; }
    public GeoPoint getGeolocation() { return geolocation; }

    @Override
    public String toString() {
        return "Location{name='" + name + "', city='" + city + "', country='" + country + "'}";
    }
}
