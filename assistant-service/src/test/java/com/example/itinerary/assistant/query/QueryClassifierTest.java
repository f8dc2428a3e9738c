package com.example.itinerary.assistant.query;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @ParameterizedTest
    @CsvSource({
            "How many countries am I visiting?, listCountries",
            "how many FLIGHTS do I have, countFlights",
            "What is the total events count?, countEvents",
            "How many hotel nights?, calculateHotelNights",
            "What is my longest layover?, calculateLongestLayover",
            "total travel time please, calculateTotalTravelDuration",
            "Which is my busiest day?, findBusiestDay",
            "Do I have any free days?, findFreeDays",
            "Which cities will I see?, listCities",
            "What is the trip duration?, calculateTripDuration"
    })
    void classifiesKnownPhrasings(String question, String function) {
        assertThat(classifier.classify(question))
                .map(DeterministicFunction::getFunctionName)
                .contains(function);
    }

    @Test
    void firstMatchingRowWins() {
        // mentions both countries and flights; countries is listed first
        assertThat(classifier.classify("how many countries and how many flights"))
                .contains(DeterministicFunction.LIST_COUNTRIES);
    }

    @Test
    void openQuestionsGoToTheModel() {
        assertThat(classifier.classify("What should I pack for Paris?")).isEmpty();
        assertThat(classifier.classify(null)).isEmpty();
    }
}
