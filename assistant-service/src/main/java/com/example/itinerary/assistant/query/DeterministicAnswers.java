package com.example.itinerary.assistant.query;

import com.example.itinerary.common.model.ItineraryEvent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs a {@link DeterministicFunction} and phrases its result as a short sentence.
 */
@Component
public class DeterministicAnswers {

    static final String UNKNOWN_FUNCTION = "Unknown deterministic function.";

    /**
     * @param tripStart may be null when the trip has no usable start date
     * @param tripEnd   may be null when the trip has no usable end date
     */
    public String execute(String functionName, List<ItineraryEvent> events, Instant tripStart, Instant tripEnd) {
        Optional<DeterministicFunction> function = DeterministicFunction.fromFunctionName(functionName);
        if (function.isEmpty()) {
            return UNKNOWN_FUNCTION;
        }
        return execute(function.get(), events, tripStart, tripEnd);
    }

    public String execute(DeterministicFunction function, List<ItineraryEvent> events, Instant tripStart, Instant tripEnd) {
        switch (function) {
            case COUNT_COUNTRIES: {
                int count = ItineraryAggregates.countCountries(events);
                return "You are visiting " + count + " " + plural(count, "country", "countries") + ".";
            }
            case COUNT_FLIGHTS: {
                int count = ItineraryAggregates.countFlights(events);
                return "You have " + count + " " + plural(count, "flight", "flights") + ".";
            }
            case COUNT_EVENTS: {
                int count = ItineraryAggregates.countEvents(events);
                return "Your trip has " + count + " " + plural(count, "event", "events") + ".";
            }
            case CALCULATE_HOTEL_NIGHTS: {
                long nights = ItineraryAggregates.calculateHotelNights(events);
                return "You have " + nights + " " + plural(nights, "night", "nights") + " of accommodation.";
            }
            case CALCULATE_LONGEST_LAYOVER: {
                Optional<ItineraryAggregates.HoursMinutes> layover = ItineraryAggregates.calculateLongestLayover(events);
                if (layover.isEmpty()) {
                    return "No layovers found between consecutive travel events.";
                }
                ItineraryAggregates.HoursMinutes l = layover.get();
                if (l.getHours() == 0) {
                    return "Your longest layover is " + l.getMinutes() + " minutes.";
                }
                return "Your longest layover is " + l.getHours() + " hours and " + l.getMinutes() + " minutes.";
            }
            case CALCULATE_TOTAL_TRAVEL_DURATION: {
                ItineraryAggregates.HoursMinutes d = ItineraryAggregates.calculateTotalTravelDuration(events);
                return "Your total travel time is " + d.getHours() + " hours and " + d.getMinutes() + " minutes.";
            }
            case FIND_BUSIEST_DAY: {
                Optional<ItineraryAggregates.DayCount> busiest = ItineraryAggregates.findBusiestDay(events);
                if (busiest.isEmpty()) {
                    return "No events found.";
                }
                ItineraryAggregates.DayCount b = busiest.get();
                return "Your busiest day is " + b.getDate() + " with " + b.getCount() + " "
                        + plural(b.getCount(), "event", "events") + ".";
            }
            case FIND_FREE_DAYS: {
                if (tripStart == null || tripEnd == null) {
                    return "Cannot determine free days without trip start and end dates.";
                }
                List<String> free = ItineraryAggregates.findFreeDays(events, tripStart, tripEnd);
                if (free.isEmpty()) {
                    return "You have no free days - every day has at least one event!";
                }
                return "You have " + free.size() + " free " + plural(free.size(), "day", "days") + ": "
                        + String.join(", ", free.subList(0, Math.min(5, free.size())))
                        + (free.size() > 5 ? "..." : "") + ".";
            }
            case LIST_CITIES: {
                List<String> cities = ItineraryAggregates.listCities(events);
                if (cities.isEmpty()) {
                    return "No cities found in your itinerary.";
                }
                return "You are visiting " + cities.size() + " " + plural(cities.size(), "city", "cities") + ": "
                        + String.join(", ", cities) + ".";
            }
            case LIST_COUNTRIES: {
                List<String> countries = ItineraryAggregates.listCountries(events);
                if (countries.isEmpty()) {
                    return "No countries found in your itinerary.";
                }
                return "You are visiting " + countries.size() + " " + plural(countries.size(), "country", "countries")
                        + ": " + String.join(", ", countries) + ".";
            }
            case CALCULATE_TRIP_DURATION: {
                if (tripStart == null || tripEnd == null) {
                    return "Cannot determine trip duration without start and end dates.";
                }
                long days = ItineraryAggregates.calculateTripDuration(tripStart, tripEnd);
                return "Your trip is " + days + " " + plural(days, "day", "days") + " long.";
            }
            default:
                return UNKNOWN_FUNCTION;
        }
    }

    private static String plural(long n, String one, String many) {
        return n == 1 ? one : many;
    }
}
