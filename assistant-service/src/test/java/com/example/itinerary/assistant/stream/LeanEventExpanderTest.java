package com.example.itinerary.assistant.stream;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LeanEventExpanderTest {

    @Test
    void travelLegsGetNestedLocations() {
        Map<String, Object> lean = new LinkedHashMap<>();
        lean.put("category", "travel");
        lean.put("type", "flight");
        lean.put("departure", Map.of("date", "2024-06-01T08:00:00Z", "name", "JFK", "city", "New York", "country", "USA"));
        lean.put("arrival", Map.of("date", "2024-06-01T20:00:00Z", "name", "CDG", "city", "Paris"));

        Map<String, Object> expanded = LeanEventExpander.expand(lean);

        assertThat(expanded.get("departure")).isEqualTo(Map.of("date", "2024-06-01T08:00:00Z",
                "location", Map.of("name", "JFK", "city", "New York", "country", "USA")));
        assertThat(expanded.get("arrival")).isEqualTo(Map.of("date", "2024-06-01T20:00:00Z",
                "location", Map.of("name", "CDG", "city", "Paris", "country", "")));
        assertThat(expanded.get("location")).isEqualTo(Map.of("name", "JFK", "city", "New York", "country", "USA"));
    }

    @Test
    void accommodationTakesLocationFromCheckIn() {
        Map<String, Object> lean = new LinkedHashMap<>();
        lean.put("category", "accommodation");
        lean.put("checkIn", Map.of("date", "2024-06-01T15:00:00Z", "name", "Hotel Lumiere", "city", "Paris", "country", "France"));
        lean.put("checkOut", Map.of("date", "2024-06-04T11:00:00Z", "name", "Hotel Lumiere", "city", "Paris", "country", "France"));

        Map<String, Object> expanded = LeanEventExpander.expand(lean);

        assertThat(expanded.get("location")).isEqualTo(Map.of("name", "Hotel Lumiere", "city", "Paris", "country", "France"));
    }

    @Test
    void flatPlaceFieldsMoveIntoLocation() {
        Map<String, Object> lean = new LinkedHashMap<>();
        lean.put("category", "meal");
        lean.put("date", "2024-06-02T19:00:00Z");
        lean.put("name", "Le Bistro");
        lean.put("city", "Paris");

        Map<String, Object> expanded = LeanEventExpander.expand(lean);

        assertThat(expanded).doesNotContainKeys("name", "city", "country");
        assertThat(expanded.get("location")).isEqualTo(Map.of("name", "Le Bistro", "city", "Paris", "country", ""));
    }

    @Test
    void existingLocationIsKept() {
        Map<String, Object> lean = new LinkedHashMap<>();
        lean.put("category", "experience");
        lean.put("name", "ignored");
        lean.put("location", Map.of("name", "Louvre"));

        Map<String, Object> expanded = LeanEventExpander.expand(lean);

        assertThat(expanded.get("location")).isEqualTo(Map.of("name", "Louvre"));
        assertThat(expanded).containsEntry("name", "ignored");
    }

    @Test
    void unknownCategoryIsUntouched() {
        Map<String, Object> lean = Map.of("category", "spa", "name", "Onsen");

        assertThat(LeanEventExpander.expand(lean)).isEqualTo(lean);
    }
}
