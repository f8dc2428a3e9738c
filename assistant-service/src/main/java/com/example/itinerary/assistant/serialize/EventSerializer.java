package com.example.itinerary.assistant.serialize;

import com.example.itinerary.assistant.query.IsoDates;
import com.example.itinerary.common.model.AccommodationEvent;
import com.example.itinerary.common.model.EventVisitor;
import com.example.itinerary.common.model.ExperienceEvent;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Location;
import com.example.itinerary.common.model.MealEvent;
import com.example.itinerary.common.model.TravelEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens canonical events into the compact form used in model prompts and estimates prompt size.
 */
@Component
public class EventSerializer {

    private final ObjectMapper mapper;

    public EventSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SerializedEvent serializeEventForAi(ItineraryEvent event) {
        SerializedEvent out = new SerializedEvent();
        out.setId(event.getId());
        out.setCategory(event.getCategory());
        out.setType(event.getType());
        out.setTitle(event.getTitle());
        out.setStart(event.getStart());
        out.setEnd(event.getEnd());

        Map<String, String> metadata = event.accept(new EventVisitor<Map<String, String>>() {
            @Override
            public Map<String, String> visitTravel(TravelEvent e) {
                Location from = e.getDeparture().getLocation();
                Location to = e.getArrival().getLocation();
                out.setStart(e.getDeparture().getDate());
                out.setEnd(e.getArrival().getDate());
                out.setCountry(from.getCountry().isEmpty() ? to.getCountry() : from.getCountry());
                out.setCity(from.getCity());
                out.setVenue(from.getName());
                Map<String, String> m = new LinkedHashMap<>();
                m.put("departureCity", from.getCity());
                m.put("arrivalCity", to.getCity());
                m.put("departureName", from.getName());
                m.put("arrivalName", to.getName());
                m.put("flightNumber", e.getFlightNumber());
                m.put("trainNumber", e.getTrainNumber());
                m.put("bookingReference", e.getBookingReference());
                return m;
            }

            @Override
            public Map<String, String> visitAccommodation(AccommodationEvent e) {
                Location checkIn = e.getCheckIn().getLocation();
                out.setStart(e.getCheckIn().getDate());
                out.setEnd(e.getCheckOut().getDate());
                out.setCountry(checkIn.getCountry());
                out.setCity(checkIn.getCity());
                out.setVenue(e.getPlaceName().isEmpty() ? e.getLocation().getName() : e.getPlaceName());
                Map<String, String> m = new LinkedHashMap<>();
                m.put("checkIn", e.getCheckIn().getDate());
                m.put("checkOut", e.getCheckOut().getDate());
                m.put("bookingReference", e.getBookingReference());
                return m;
            }

            @Override
            public Map<String, String> visitExperience(ExperienceEvent e) {
                out.setStart(e.getStartDate());
                out.setEnd(e.getEndDate());
                useLocation(out, e.getLocation());
                Map<String, String> m = new LinkedHashMap<>();
                m.put("bookingReference", e.getBookingReference());
                return m;
            }

            @Override
            public Map<String, String> visitMeal(MealEvent e) {
                out.setStart(e.getDate());
                out.setEnd(e.getDate());
                useLocation(out, e.getLocation());
                Map<String, String> m = new LinkedHashMap<>();
                m.put("bookingReference", e.getReservationReference());
                return m;
            }
        });

        metadata.values().removeIf(v -> v == null || v.isEmpty());
        out.setMetadata(metadata.isEmpty() ? null : metadata);
        return out;
    }

    /**
     * Serializes and sorts by start ascending. The sort is stable; unparsable starts sort as epoch 0.
     */
    public List<SerializedEvent> serializeEventsForAi(List<ItineraryEvent> events) {
        List<SerializedEvent> out = new ArrayList<>(events.size());
        for (ItineraryEvent e : events) {
            out.add(serializeEventForAi(e));
        }
        out.sort(Comparator.comparingLong(s -> IsoDates.epochMillisOrZero(s.getStart())));
        return out;
    }

    public AiContext createAiContext(String tripName, String tripStartDate, String tripEndDate,
                                     List<SerializedEvent> events) {
        return new AiContext(new AiContext.TripSummary(tripName, tripStartDate, tripEndDate), events);
    }

    /** Roughly four characters of compact JSON per token. */
    public int estimateTokenCount(Object payload) {
        return (int) Math.ceil(toJson(payload).length() / 4.0);
    }

    public String toJson(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize model context", ex);
        }
    }

    public String toPrettyJson(Object payload) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize model context", ex);
        }
    }

    private static void useLocation(SerializedEvent out, Location location) {
        out.setCountry(location.getCountry());
        out.setCity(location.getCity());
        out.setVenue(location.getName());
    }
}
