package com.example.itinerary.assistant.stream;

import com.example.itinerary.common.model.EventCategory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Expands the compact event shape used for generation into the nested shape the normalizer expects:
 * leg endpoints {@code {date,name,city,country}} become {@code {date, location:{name,city,country}}},
 * and experience/meal events get their location from flat {@code name/city/country} fields.
 */
public final class LeanEventExpander {

    private LeanEventExpander() {}

    public static Map<String, Object> expand(Map<String, Object> lean) {
        Map<String, Object> out = new LinkedHashMap<>(lean);
        Optional<EventCategory> category = EventCategory.fromValue(
                lean.get("category") instanceof String s ? s : null);
        if (category.isEmpty()) {
            return out;
        }
        switch (category.get()) {
            case TRAVEL -> {
                expandLeg(out, "departure");
                expandLeg(out, "arrival");
                deriveLocationFrom(out, "departure");
            }
            case ACCOMMODATION -> {
                expandLeg(out, "checkIn");
                expandLeg(out, "checkOut");
                deriveLocationFrom(out, "checkIn");
            }
            case EXPERIENCE, MEAL -> {
                if (out.get("location") == null) {
                    Map<String, Object> location = new LinkedHashMap<>();
                    location.put("name", orEmpty(out.remove("name")));
                    location.put("city", orEmpty(out.remove("city")));
                    location.put("country", orEmpty(out.remove("country")));
                    out.put("location", location);
                }
            }
        }
        return out;
    }

    private static void expandLeg(Map<String, Object> event, String key) {
        if (!(event.get(key) instanceof Map<?, ?> leg)) {
            return;
        }
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("name", orEmpty(leg.get("name")));
        location.put("city", orEmpty(leg.get("city")));
        location.put("country", orEmpty(leg.get("country")));

        Map<String, Object> expanded = new LinkedHashMap<>();
        expanded.put("date", leg.get("date"));
        expanded.put("location", location);
        for (Map.Entry<?, ?> e : leg.entrySet()) {
            String k = String.valueOf(e.getKey());
            if (!k.equals("date") && !k.equals("name") && !k.equals("city") && !k.equals("country")) {
                // an already-nested location wins over the flat fields
                expanded.put(k, e.getValue());
            }
        }
        event.put(key, expanded);
    }

    private static void deriveLocationFrom(Map<String, Object> event, String legKey) {
        if (event.get("location") == null
                && event.get(legKey) instanceof Map<?, ?> leg
                && leg.get("location") instanceof Map<?, ?> location) {
            event.put("location", new LinkedHashMap<Object, Object>(location));
        }
    }

    private static Object orEmpty(Object value) {
        return value != null ? value : "";
    }
}
