package com.example.itinerary.common.normalize;

import com.example.itinerary.common.model.AccommodationEvent;
import com.example.itinerary.common.model.DatedLocation;
import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.EventType;
import com.example.itinerary.common.model.EventVisitor;
import com.example.itinerary.common.model.ExperienceEvent;
import com.example.itinerary.common.model.GeoPoint;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Location;
import com.example.itinerary.common.model.MealEvent;
import com.example.itinerary.common.model.TravelEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns loosely-typed event records (documents from the trip store, agent tool arguments,
 * generated events) into canonical {@link ItineraryEvent}s.
 * <p>
 * The transform never throws: missing sub-objects become empty values, fields outside the
 * category allow-list are written into {@code notes} under {@value #ADDITIONAL_INFO_HEADER}.
 */
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    public static final String ADDITIONAL_INFO_HEADER = "Additional information:";

    private static final List<String> PLACE_NAME_FIELDS = List.of("placeName", "hotelName", "hostelName", "airbnbName");

    private final ObjectMapper mapper;

    public EventNormalizer() {
        this(new ObjectMapper());
    }

    public EventNormalizer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ItineraryEvent normalize(Map<String, ?> raw) {
        Map<String, Object> record = raw != null ? new LinkedHashMap<>(raw) : new LinkedHashMap<>();
        List<String> quarantined = new ArrayList<>();

        Object rawCategory = record.get("category");
        EventCategory category = EventCategory.fromValue(asText(rawCategory)).orElse(null);
        if (category == null) {
            // Unrecognised category: keep the record as a generic experience spanning start..end
            if (rawCategory != null && !asText(rawCategory).isBlank()) {
                quarantined.add(line("category", rawCategory));
            }
            category = EventCategory.EXPERIENCE;
            if (asText(record.get("startDate")).isEmpty()) record.put("startDate", asText(record.get("start")));
            if (asText(record.get("endDate")).isEmpty()) record.put("endDate", asText(record.get("end")));
        }

        if (category == EventCategory.ACCOMMODATION) {
            record.put("placeName", firstNonEmpty(record, PLACE_NAME_FIELDS));
        }

        FieldPartition fields = EventSchema.partition(category, record);
        for (Map.Entry<String, Object> e : fields.unknown().entrySet()) {
            if (e.getValue() != null) {
                quarantined.add(line(e.getKey(), e.getValue()));
            }
        }
        Map<String, Object> known = fields.known();

        ItineraryEvent event = switch (category) {
            case TRAVEL -> travel(known, quarantined);
            case ACCOMMODATION -> accommodation(known, quarantined);
            case EXPERIENCE -> experience(known);
            case MEAL -> meal(known);
        };

        String rawType = asText(known.get("type"));
        event.setType(EventType.fromValue(rawType).orElse(EventType.OTHER));
        if (!rawType.isBlank() && EventType.fromValue(rawType).isEmpty()) {
            quarantined.add(line("type", rawType));
        }
        event.setTitle(asText(known.get("title")));
        event.setLocation(location(known.get("location"), "location", quarantined));

        String id = asText(known.get("id"));
        event.setId(id.isBlank() ? UUID.randomUUID().toString() : id);

        event.setNotes(mergeNotes(asText(known.get("notes")), quarantined));
        return event;
    }

    /**
     * Whether the category-specific dates an event needs are present.
     */
    public boolean isComplete(ItineraryEvent event) {
        return event.accept(new EventVisitor<Boolean>() {
            @Override
            public Boolean visitTravel(TravelEvent e) {
                return !e.getDeparture().getDate().isBlank() && !e.getArrival().getDate().isBlank();
            }

            @Override
            public Boolean visitAccommodation(AccommodationEvent e) {
                return !e.getCheckIn().getDate().isBlank() && !e.getCheckOut().getDate().isBlank();
            }

            @Override
            public Boolean visitExperience(ExperienceEvent e) {
                return !e.getStartDate().isBlank() && !e.getEndDate().isBlank();
            }

            @Override
            public Boolean visitMeal(MealEvent e) {
                return !e.getDate().isBlank();
            }
        });
    }

    private TravelEvent travel(Map<String, Object> known, List<String> quarantined) {
        TravelEvent e = new TravelEvent();
        e.setDeparture(datedLocation(known.get("departure"), "departure", quarantined));
        e.setArrival(datedLocation(known.get("arrival"), "arrival", quarantined));
        e.setAirline(optionalText(known.get("airline")));
        e.setFlightNumber(optionalText(known.get("flightNumber")));
        e.setTrainNumber(optionalText(known.get("trainNumber")));
        e.setSeat(optionalText(known.get("seat")));
        e.setCar(optionalText(known.get("car")));
        e.setTravelClass(optionalText(known.get("class")));
        e.setBookingReference(optionalText(known.get("bookingReference")));
        e.setStart(e.getDeparture().getDate());
        e.setEnd(e.getArrival().getDate());
        return e;
    }

    private AccommodationEvent accommodation(Map<String, Object> known, List<String> quarantined) {
        AccommodationEvent e = new AccommodationEvent();
        e.setCheckIn(datedLocation(known.get("checkIn"), "checkIn", quarantined));
        e.setCheckOut(datedLocation(known.get("checkOut"), "checkOut", quarantined));
        e.setPlaceName(asText(known.get("placeName")));
        e.setRoomNumber(optionalText(known.get("roomNumber")));
        e.setBookingReference(optionalText(known.get("bookingReference")));
        e.setStart(e.getCheckIn().getDate());
        e.setEnd(e.getCheckOut().getDate());
        return e;
    }

    private ExperienceEvent experience(Map<String, Object> known) {
        ExperienceEvent e = new ExperienceEvent();
        e.setStartDate(asText(known.get("startDate")));
        e.setEndDate(asText(known.get("endDate")));
        e.setBookingReference(optionalText(known.get("bookingReference")));
        e.setStart(e.getStartDate());
        e.setEnd(e.getEndDate());
        return e;
    }

    private MealEvent meal(Map<String, Object> known) {
        MealEvent e = new MealEvent();
        e.setDate(asText(known.get("date")));
        e.setReservationReference(optionalText(known.get("reservationReference")));
        e.setStart(e.getDate());
        e.setEnd(e.getDate());
        return e;
    }

    private DatedLocation datedLocation(Object raw, String path, List<String> quarantined) {
        if (!(raw instanceof Map<?, ?> map)) {
            return DatedLocation.empty();
        }
        quarantineExtras(map, EventSchema.DATED_LOCATION_FIELDS, path, quarantined);
        return new DatedLocation(asText(map.get("date")), location(map.get("location"), path + ".location", quarantined));
    }

    private Location location(Object raw, String path, List<String> quarantined) {
        if (!(raw instanceof Map<?, ?> map)) {
            return Location.empty();
        }
        quarantineExtras(map, EventSchema.LOCATION_FIELDS, path, quarantined);
        GeoPoint geo = null;
        if (map.get("geolocation") instanceof Map<?, ?> g
                && g.get("lat") instanceof Number lat
                && g.get("lng") instanceof Number lng) {
            geo = new GeoPoint(lat.doubleValue(), lng.doubleValue());
        }
        return new Location(asText(map.get("name")), asText(map.get("city")), asText(map.get("country")), geo);
    }

    private void quarantineExtras(Map<?, ?> map, java.util.Set<String> allowed, String path, List<String> quarantined) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = String.valueOf(e.getKey());
            if (!allowed.contains(key) && e.getValue() != null) {
                quarantined.add(line(path + "." + key, e.getValue()));
            }
        }
    }

    private String line(String key, Object value) {
        return key + ": " + toJson(value);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            log.warn("[EventNormalizer] Could not render field value as JSON: {}", ex.toString());
            return String.valueOf(value);
        }
    }

    private static String mergeNotes(String notes, List<String> quarantined) {
        if (quarantined.isEmpty()) return notes;
        StringBuilder sb = new StringBuilder(notes);
        if (!notes.isEmpty()) sb.append("\n\n");
        sb.append(ADDITIONAL_INFO_HEADER).append('\n').append(String.join("\n", quarantined));
        return sb.toString();
    }

    private static String firstNonEmpty(Map<String, Object> record, List<String> keys) {
        for (String k : keys) {
            String v = asText(record.get(k));
            if (!v.isEmpty()) return v;
        }
        return "";
    }

    private static String optionalText(Object value) {
        return value == null ? null : asText(value);
    }

    static String asText(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        return String.valueOf(value);
    }
}
