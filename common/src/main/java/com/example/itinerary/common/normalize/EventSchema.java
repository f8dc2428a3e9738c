package com.example.itinerary.common.normalize;

import com.example.itinerary.common.model.EventCategory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed per-category allow-lists of top-level event fields.
 */
public final class EventSchema {

    private static final List<String> COMMON_FIELDS = List.of(
            "id", "category", "type", "title", "start", "end", "location", "notes");

    private static final Map<EventCategory, Set<String>> ALLOWED = new EnumMap<>(EventCategory.class);
    static {
        ALLOWED.put(EventCategory.TRAVEL, fields("departure", "arrival", "airline", "flightNumber",
                "trainNumber", "seat", "car", "class", "bookingReference"));
        ALLOWED.put(EventCategory.ACCOMMODATION, fields("placeName", "checkIn", "checkOut",
                "roomNumber", "bookingReference"));
        ALLOWED.put(EventCategory.EXPERIENCE, fields("startDate", "endDate", "bookingReference"));
        ALLOWED.put(EventCategory.MEAL, fields("date", "reservationReference"));
    }

    /** Keys of a leg endpoint ({@code departure}, {@code checkIn}, ...). */
    static final Set<String> DATED_LOCATION_FIELDS = Set.of("date", "location");

    /** Keys of a location object. */
    static final Set<String> LOCATION_FIELDS = Set.of("name", "city", "country", "geolocation");

    private EventSchema() {}

    private static Set<String> fields(String... categorySpecific) {
        Set<String> out = new LinkedHashSet<>(COMMON_FIELDS);
        out.addAll(List.of(categorySpecific));
        return Set.copyOf(out);
    }

    public static Set<String> allowedFields(EventCategory category) {
        return ALLOWED.get(category);
    }

    public static boolean isAllowed(EventCategory category, String field) {
        return ALLOWED.get(category).contains(field);
    }

    /**
     * Splits {@code record} into fields on the category allow-list and everything else,
     * preserving the record's key order in both halves.
     */
    public static FieldPartition partition(EventCategory category, Map<String, ?> record) {
        Map<String, Object> known = new LinkedHashMap<>();
        Map<String, Object> unknown = new LinkedHashMap<>();
        if (record != null) {
            Set<String> allowed = ALLOWED.get(category);
            for (Map.Entry<String, ?> e : record.entrySet()) {
                if (allowed.contains(e.getKey())) {
                    known.put(e.getKey(), e.getValue());
                } else {
                    unknown.put(e.getKey(), e.getValue());
                }
            }
        }
        return new FieldPartition(known, unknown);
    }
}
