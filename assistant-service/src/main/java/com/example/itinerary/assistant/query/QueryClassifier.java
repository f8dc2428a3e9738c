package com.example.itinerary.assistant.query;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a question onto a {@link DeterministicFunction} by phrase containment. Rows are tried in order
 * and the first match wins; anything unmatched goes to the model.
 */
@Component
public class QueryClassifier {

    private static final class Rule {
        private final List<String> phrases;
        private final DeterministicFunction function;

        private Rule(DeterministicFunction function, String... phrases) {
            this.function = function;
            this.phrases = List.of(phrases);
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule(DeterministicFunction.LIST_COUNTRIES, "how many countries", "number of countries",
                    "count countries", "countries visiting", "countries am i", "list countries", "which countries"),
            new Rule(DeterministicFunction.COUNT_FLIGHTS, "how many flights", "number of flights", "count flights",
                    "total flights"),
            new Rule(DeterministicFunction.COUNT_EVENTS, "how many events", "number of events", "total events",
                    "count events"),
            new Rule(DeterministicFunction.CALCULATE_HOTEL_NIGHTS, "hotel nights", "accommodation nights",
                    "nights staying", "how many nights", "number of nights"),
            new Rule(DeterministicFunction.CALCULATE_LONGEST_LAYOVER, "longest layover", "biggest layover",
                    "maximum layover", "worst layover"),
            new Rule(DeterministicFunction.CALCULATE_TOTAL_TRAVEL_DURATION, "total travel time",
                    "total travel duration", "time traveling", "hours traveling", "travel duration"),
            new Rule(DeterministicFunction.FIND_BUSIEST_DAY, "busiest day", "most events", "most busy day",
                    "busiest date"),
            new Rule(DeterministicFunction.FIND_FREE_DAYS, "free days", "days with no events", "days without events",
                    "empty days", "no scheduled"),
            new Rule(DeterministicFunction.LIST_CITIES, "what cities", "which cities", "list cities",
                    "cities visiting", "cities am i"),
            new Rule(DeterministicFunction.CALCULATE_TRIP_DURATION, "trip duration", "length of trip",
                    "days traveling", "duration of trip", "total days")
    );

    public Optional<DeterministicFunction> classify(String question) {
        if (question == null) return Optional.empty();
        String q = question.toLowerCase(Locale.ROOT).trim();
        for (Rule rule : RULES) {
            for (String phrase : rule.phrases) {
                if (q.contains(phrase)) {
                    return Optional.of(rule.function);
                }
            }
        }
        return Optional.empty();
    }
}
