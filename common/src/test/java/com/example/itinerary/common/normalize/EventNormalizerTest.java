package com.example.itinerary.common.normalize;

import com.example.itinerary.common.model.AccommodationEvent;
import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.EventType;
import com.example.itinerary.common.model.ExperienceEvent;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.MealEvent;
import com.example.itinerary.common.model.TravelEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventNormalizerTest {

    private final EventNormalizer normalizer = new EventNormalizer();

    @Test
    void travelDatesDriveStartAndEnd() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", "e1");
        raw.put("category", "travel");
        raw.put("type", "flight");
        raw.put("title", "LHR to JFK");
        raw.put("departure", Map.of("date", "2025-05-01T09:00:00Z",
                "location", Map.of("name", "Heathrow", "city", "London", "country", "UK")));
        raw.put("arrival", Map.of("date", "2025-05-01T17:00:00Z",
                "location", Map.of("city", "New York", "country", "USA")));
        raw.put("class", "economy");

        ItineraryEvent event = normalizer.normalize(raw);

        assertThat(event).isInstanceOf(TravelEvent.class);
        TravelEvent travel = (TravelEvent) event;
        assertThat(travel.getStart()).isEqualTo("2025-05-01T09:00:00Z");
        assertThat(travel.getEnd()).isEqualTo("2025-05-01T17:00:00Z");
        assertThat(travel.getType()).isEqualTo(EventType.FLIGHT);
        assertThat(travel.getTravelClass()).isEqualTo("economy");
        assertThat(travel.getArrival().getLocation().getName()).isEmpty();
        assertThat(travel.getNotes()).isEmpty();
        assertThat(travel.getId()).isEqualTo("e1");
    }

    @Test
    void accommodationPlaceNameIsBackfilledFromHotelName() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("category", "accommodation");
        raw.put("type", "hotel");
        raw.put("hotelName", "Grand Budapest");
        raw.put("checkIn", Map.of("date", "2025-05-01"));
        raw.put("checkOut", Map.of("date", "2025-05-04"));

        AccommodationEvent stay = (AccommodationEvent) normalizer.normalize(raw);

        assertThat(stay.getPlaceName()).isEqualTo("Grand Budapest");
        assertThat(stay.getStart()).isEqualTo("2025-05-01");
        assertThat(stay.getEnd()).isEqualTo("2025-05-04");
        assertThat(stay.getCheckIn().getLocation().getCity()).isEmpty();
    }

    @Test
    void mealStartAndEndAreTheSameDate() {
        MealEvent meal = (MealEvent) normalizer.normalize(Map.of(
                "category", "meal", "title", "Lunch", "date", "2025-05-02T12:30:00Z"));

        assertThat(meal.getStart()).isEqualTo(meal.getEnd()).isEqualTo("2025-05-02T12:30:00Z");
    }

    @Test
    void unknownFieldsAreQuarantinedIntoNotes() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", "m1");
        raw.put("category", "meal");
        raw.put("title", "Dinner");
        raw.put("notes", "Window seat");
        raw.put("date", "2025-05-02T19:00:00Z");
        raw.put("cuisine", "thai");
        raw.put("party", 4);
        raw.put("ignored", null);

        ItineraryEvent event = normalizer.normalize(raw);

        assertThat(event.getNotes()).isEqualTo(
                "Window seat\n\nAdditional information:\ncuisine: \"thai\"\nparty: 4");
    }

    @Test
    void nestedUnknownFieldsCarryTheirPath() {
        Map<String, Object> departure = new HashMap<>();
        departure.put("date", "2025-05-01T09:00:00Z");
        departure.put("terminal", "5");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("category", "travel");
        raw.put("departure", departure);

        ItineraryEvent event = normalizer.normalize(raw);

        assertThat(event.getNotes()).startsWith("Additional information:\n")
                .contains("departure.terminal: \"5\"");
    }

    @Test
    void missingLocationDefaultsToEmptyStrings() {
        ItineraryEvent event = normalizer.normalize(Map.of("category", "experience", "title", "Walk"));

        assertThat(event.getLocation()).isNotNull();
        assertThat(event.getLocation().getName()).isEmpty();
        assertThat(event.getLocation().getCity()).isEmpty();
        assertThat(event.getLocation().getCountry()).isEmpty();
        assertThat(event.getLocation().getGeolocation()).isNull();
    }

    @Test
    void geolocationRequiresNumericCoordinates() {
        ItineraryEvent kept = normalizer.normalize(Map.of("category", "experience",
                "location", Map.of("name", "Louvre", "geolocation", Map.of("lat", 48.86, "lng", 2.33))));
        ItineraryEvent dropped = normalizer.normalize(Map.of("category", "experience",
                "location", Map.of("name", "Louvre", "geolocation", Map.of("lat", "48.86", "lng", 2.33))));

        assertThat(kept.getLocation().getGeolocation()).isNotNull();
        assertThat(kept.getLocation().getGeolocation().getLat()).isEqualTo(48.86);
        assertThat(dropped.getLocation().getGeolocation()).isNull();
    }

    @Test
    void missingIdIsAssigned() {
        ItineraryEvent a = normalizer.normalize(Map.of("category", "meal"));
        ItineraryEvent b = normalizer.normalize(Map.of("category", "meal", "id", "  "));

        assertThat(a.getId()).isNotBlank();
        assertThat(b.getId()).isNotBlank().isNotEqualTo(a.getId());
    }

    @Test
    void unknownCategoryBecomesExperienceSpanningStartAndEnd() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("category", "shopping");
        raw.put("type", "souvenirs");
        raw.put("start", "2025-05-03T10:00:00Z");
        raw.put("end", "2025-05-03T12:00:00Z");

        ItineraryEvent event = normalizer.normalize(raw);

        assertThat(event.getCategory()).isEqualTo(EventCategory.EXPERIENCE);
        assertThat(((ExperienceEvent) event).getStartDate()).isEqualTo("2025-05-03T10:00:00Z");
        assertThat(event.getStart()).isEqualTo("2025-05-03T10:00:00Z");
        assertThat(event.getEnd()).isEqualTo("2025-05-03T12:00:00Z");
        assertThat(event.getType()).isEqualTo(EventType.OTHER);
        assertThat(event.getNotes())
                .contains("category: \"shopping\"")
                .contains("type: \"souvenirs\"");
    }

    @Test
    void nullRecordStillProducesAnEvent() {
        ItineraryEvent event = normalizer.normalize(null);

        assertThat(event.getCategory()).isEqualTo(EventCategory.EXPERIENCE);
        assertThat(event.getId()).isNotBlank();
        assertThat(event.getStart()).isEmpty();
    }

    @Test
    void isCompleteChecksCategoryDates() {
        ItineraryEvent travel = normalizer.normalize(Map.of("category", "travel",
                "departure", Map.of("date", "2025-05-01")));
        ItineraryEvent meal = normalizer.normalize(Map.of("category", "meal", "date", "2025-05-01"));

        assertThat(normalizer.isComplete(travel)).isFalse();
        assertThat(normalizer.isComplete(meal)).isTrue();
    }

    @Test
    void canonicalEventSerializesWithCategoryDiscriminator() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ItineraryEvent event = normalizer.normalize(Map.of("id", "t1", "category", "travel", "class", "business"));

        String json = mapper.writeValueAsString(event);
        ItineraryEvent back = mapper.readValue(json, ItineraryEvent.class);

        assertThat(json).contains("\"category\":\"travel\"").contains("\"class\":\"business\"");
        assertThat(back).isInstanceOf(TravelEvent.class);
        assertThat(((TravelEvent) back).getTravelClass()).isEqualTo("business");
    }
}
