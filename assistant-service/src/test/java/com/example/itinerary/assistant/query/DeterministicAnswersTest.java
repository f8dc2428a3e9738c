package com.example.itinerary.assistant.query;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.example.itinerary.assistant.TripFixtures.europeTrip;
import static org.assertj.core.api.Assertions.assertThat;

class DeterministicAnswersTest {

    private final DeterministicAnswers answers = new DeterministicAnswers();
    private final Instant start = Instant.parse("2024-06-01T00:00:00Z");
    private final Instant end = Instant.parse("2024-06-05T00:00:00Z");

    @Test
    void phrasesCountsWithPlurals() {
        assertThat(answers.execute("countCountries", europeTrip(), start, end)).isEqualTo("You are visiting 3 countries.");
        assertThat(answers.execute("countFlights", europeTrip(), start, end)).isEqualTo("You have 2 flights.");
        assertThat(answers.execute("countEvents", europeTrip().subList(0, 1), start, end)).isEqualTo("Your trip has 1 event.");
        assertThat(answers.execute("calculateHotelNights", europeTrip(), start, end))
                .isEqualTo("You have 3 nights of accommodation.");
    }

    @Test
    void listsCountriesInFirstSeenOrder() {
        assertThat(answers.execute(DeterministicFunction.LIST_COUNTRIES, europeTrip(), start, end))
                .isEqualTo("You are visiting 3 countries: USA, France, UK.");
    }

    @Test
    void noLayoversOnEmptyTrip() {
        assertThat(answers.execute("calculateLongestLayover", List.of(), start, end))
                .isEqualTo("No layovers found between consecutive travel events.");
    }

    @Test
    void freeDaysNeedTripDates() {
        assertThat(answers.execute(DeterministicFunction.FIND_FREE_DAYS, europeTrip(), null, end))
                .isEqualTo("Cannot determine free days without trip start and end dates.");
    }

    @Test
    void freeDaysAreListed() {
        assertThat(answers.execute(DeterministicFunction.FIND_FREE_DAYS, europeTrip(), start, end))
                .isEqualTo("You have 3 free days: 2024-06-03, 2024-06-04, 2024-06-05.");
    }

    @Test
    void tripDuration() {
        assertThat(answers.execute(DeterministicFunction.CALCULATE_TRIP_DURATION, europeTrip(), start, end))
                .isEqualTo("Your trip is 5 days long.");
    }

    @Test
    void unknownFunctionName() {
        assertThat(answers.execute("teleport", europeTrip(), start, end)).isEqualTo(DeterministicAnswers.UNKNOWN_FUNCTION);
    }
}
