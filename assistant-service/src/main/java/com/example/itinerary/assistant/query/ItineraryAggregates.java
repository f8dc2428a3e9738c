package com.example.itinerary.assistant.query;

import com.example.itinerary.common.model.AccommodationEvent;
import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.EventType;
import com.example.itinerary.common.model.EventVisitor;
import com.example.itinerary.common.model.ExperienceEvent;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Location;
import com.example.itinerary.common.model.MealEvent;
import com.example.itinerary.common.model.TravelEvent;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Exact answers to common itinerary questions. All methods are pure.
 */
public final class ItineraryAggregates {

    private static final long DAY_MS = Duration.ofDays(1).toMillis();
    private static final long HOUR_MS = Duration.ofHours(1).toMillis();
    private static final long MINUTE_MS = Duration.ofMinutes(1).toMillis();
    private static final long MAX_LAYOVER_MS = Duration.ofHours(48).toMillis();

    private ItineraryAggregates() {}

    public static final class HoursMinutes {
        private final long hours;
        private final long minutes;

        public HoursMinutes(long hours, long minutes) {
            this.hours = hours;
            this.minutes = minutes;
        }

        static HoursMinutes ofMillis(long ms) {
            long hours = Math.floorDiv(ms, HOUR_MS);
            long minutes = (long) Math.floor((ms % HOUR_MS) / (double) MINUTE_MS);
            return new HoursMinutes(hours, minutes);
        }

        public long getHours() { return hours; }
        public long getMinutes() { return minutes; }

        @Override
        public String toString() {
            return hours + "h " + minutes + "m";
        }
    }

    public static final class DayCount {
        private final String date;
        private final int count;

        public DayCount(String date, int count) {
            this.date = date;
            this.count = count;
        }

        public String getDate() { return date; }
        public int getCount() { return count; }
    }

    public static int countCountries(List<ItineraryEvent> events) {
        return listCountries(events).size();
    }

    public static List<String> listCountries(List<ItineraryEvent> events) {
        return collectPlaces(events, Location::getCountry);
    }

    public static List<String> listCities(List<ItineraryEvent> events) {
        return collectPlaces(events, Location::getCity);
    }

    public static int countFlights(List<ItineraryEvent> events) {
        int n = 0;
        for (ItineraryEvent e : events) {
            if (e.getCategory() == EventCategory.TRAVEL && e.getType() == EventType.FLIGHT) n++;
        }
        return n;
    }

    public static int countEvents(List<ItineraryEvent> events) {
        return events.size();
    }

    public static Map<EventCategory, Integer> countEventsByCategory(List<ItineraryEvent> events) {
        Map<EventCategory, Integer> counts = new EnumMap<>(EventCategory.class);
        for (EventCategory c : EventCategory.values()) {
            counts.put(c, 0);
        }
        for (ItineraryEvent e : events) {
            counts.merge(e.getCategory(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Sum over stays of whole nights, partial days rounded up. Stays with unparsable dates count as zero.
     */
    public static long calculateHotelNights(List<ItineraryEvent> events) {
        long total = 0;
        for (AccommodationEvent stay : accommodationEvents(events)) {
            Optional<Instant> in = IsoDates.parse(stay.getCheckIn().getDate());
            Optional<Instant> out = IsoDates.parse(stay.getCheckOut().getDate());
            if (in.isPresent() && out.isPresent()) {
                long diff = out.get().toEpochMilli() - in.get().toEpochMilli();
                total += (long) Math.ceil(diff / (double) DAY_MS);
            }
        }
        return total;
    }

    /**
     * Longest gap between one travel event's arrival and the next one's departure, ignoring
     * non-positive gaps and gaps of 48 hours or more.
     */
    public static Optional<HoursMinutes> calculateLongestLayover(List<ItineraryEvent> events) {
        List<TravelEvent> legs = travelEvents(events);
        legs.sort(Comparator.comparingLong(t -> IsoDates.epochMillisOrZero(t.getStart())));

        long max = 0;
        for (int i = 0; i < legs.size() - 1; i++) {
            Optional<Instant> arrival = IsoDates.parse(legs.get(i).getArrival().getDate());
            Optional<Instant> nextDeparture = IsoDates.parse(legs.get(i + 1).getDeparture().getDate());
            if (arrival.isEmpty() || nextDeparture.isEmpty()) continue;
            long gap = nextDeparture.get().toEpochMilli() - arrival.get().toEpochMilli();
            if (gap > 0 && gap < MAX_LAYOVER_MS) {
                max = Math.max(max, gap);
            }
        }
        return max == 0 ? Optional.empty() : Optional.of(HoursMinutes.ofMillis(max));
    }

    public static HoursMinutes calculateTotalTravelDuration(List<ItineraryEvent> events) {
        long total = 0;
        for (TravelEvent t : travelEvents(events)) {
            Optional<Instant> dep = IsoDates.parse(t.getDeparture().getDate());
            Optional<Instant> arr = IsoDates.parse(t.getArrival().getDate());
            if (dep.isPresent() && arr.isPresent()) {
                total += arr.get().toEpochMilli() - dep.get().toEpochMilli();
            }
        }
        return HoursMinutes.ofMillis(total);
    }

    /**
     * Date with the most event starts. Ties go to the date that reached the winning count first
     * when scanning events in list order.
     */
    public static Optional<DayCount> findBusiestDay(List<ItineraryEvent> events) {
        Map<String, Integer> counts = new HashMap<>();
        String best = null;
        int bestCount = 0;
        for (ItineraryEvent e : events) {
            String day = IsoDates.datePart(e.getStart());
            if (day.isEmpty()) continue;
            int c = counts.merge(day, 1, Integer::sum);
            if (c > bestCount) {
                bestCount = c;
                best = day;
            }
        }
        return best == null ? Optional.empty() : Optional.of(new DayCount(best, bestCount));
    }

    /**
     * UTC calendar days from the day of {@code tripStart} through the day of {@code tripEnd},
     * excluding days on which any event starts.
     */
    public static List<String> findFreeDays(List<ItineraryEvent> events, Instant tripStart, Instant tripEnd) {
        Set<String> busy = new HashSet<>();
        for (ItineraryEvent e : events) {
            busy.add(IsoDates.datePart(e.getStart()));
        }
        List<String> free = new ArrayList<>();
        LocalDate last = utcDate(tripEnd);
        for (LocalDate day = utcDate(tripStart); !day.isAfter(last); day = day.plusDays(1)) {
            if (!busy.contains(day.toString())) {
                free.add(day.toString());
            }
        }
        return free;
    }

    /**
     * Inclusive count of UTC calendar days the trip touches, so a partial last day counts as a whole one.
     * Agrees with the range walked by {@link #findFreeDays}. An end before the start gives 0.
     */
    public static long calculateTripDuration(Instant tripStart, Instant tripEnd) {
        long days = ChronoUnit.DAYS.between(utcDate(tripStart), utcDate(tripEnd)) + 1;
        return Math.max(days, 0);
    }

    private static LocalDate utcDate(Instant instant) {
        return instant.atOffset(ZoneOffset.UTC).toLocalDate();
    }

    public static Optional<ItineraryEvent> getEarliestEvent(List<ItineraryEvent> events) {
        ItineraryEvent earliest = null;
        for (ItineraryEvent e : events) {
            if (earliest == null || isBefore(e.getStart(), earliest.getStart())) {
                earliest = e;
            }
        }
        return Optional.ofNullable(earliest);
    }

    public static Optional<ItineraryEvent> getLatestEvent(List<ItineraryEvent> events) {
        ItineraryEvent latest = null;
        for (ItineraryEvent e : events) {
            if (latest == null || isBefore(endOrStart(latest), endOrStart(e))) {
                latest = e;
            }
        }
        return Optional.ofNullable(latest);
    }

    private static String endOrStart(ItineraryEvent e) {
        return e.getEnd().isEmpty() ? e.getStart() : e.getEnd();
    }

    private static boolean isBefore(String a, String b) {
        Optional<Instant> ia = IsoDates.parse(a);
        Optional<Instant> ib = IsoDates.parse(b);
        return ia.isPresent() && ib.isPresent() && ia.get().isBefore(ib.get());
    }

    private static List<TravelEvent> travelEvents(List<ItineraryEvent> events) {
        List<TravelEvent> out = new ArrayList<>();
        for (ItineraryEvent e : events) {
            e.accept(new Only<Void>() {
                @Override
                public Void visitTravel(TravelEvent t) {
                    out.add(t);
                    return null;
                }
            });
        }
        return out;
    }

    private static List<AccommodationEvent> accommodationEvents(List<ItineraryEvent> events) {
        List<AccommodationEvent> out = new ArrayList<>();
        for (ItineraryEvent e : events) {
            e.accept(new Only<Void>() {
                @Override
                public Void visitAccommodation(AccommodationEvent a) {
                    out.add(a);
                    return null;
                }
            });
        }
        return out;
    }

    /** Visitor that ignores every category it does not override. */
    private abstract static class Only<R> implements EventVisitor<R> {
        @Override
        public R visitTravel(TravelEvent e) { return null; }

        @Override
        public R visitAccommodation(AccommodationEvent e) { return null; }

        @Override
        public R visitExperience(ExperienceEvent e) { return null; }

        @Override
        public R visitMeal(MealEvent e) { return null; }
    }

    private static List<String> collectPlaces(List<ItineraryEvent> events, Function<Location, String> field) {
        Set<String> seen = new LinkedHashSet<>();
        EventVisitor<List<Location>> sources = new EventVisitor<>() {
            @Override
            public List<Location> visitTravel(TravelEvent e) {
                return List.of(e.getDeparture().getLocation(), e.getArrival().getLocation());
            }

            @Override
            public List<Location> visitAccommodation(AccommodationEvent e) {
                return List.of(e.getCheckIn().getLocation());
            }

            @Override
            public List<Location> visitExperience(ExperienceEvent e) {
                return List.of(e.getLocation());
            }

            @Override
            public List<Location> visitMeal(MealEvent e) {
                return List.of(e.getLocation());
            }
        };
        for (ItineraryEvent e : events) {
            for (Location l : e.accept(sources)) {
                String value = field.apply(l);
                if (!value.isEmpty()) seen.add(value);
            }
        }
        return new ArrayList<>(seen);
    }
}
