package com.example.itinerary.assistant.stream;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ItineraryStreamScannerTest {

    private static final String PAYLOAD = "{\"events\":[{\"title\":\"A}B\"},{\"title\":\"C\"}]}";

    @Test
    void everySplitPointYieldsBothObjectsOnce() {
        for (int split = 0; split <= PAYLOAD.length(); split++) {
            ItineraryStreamScanner scanner = new ItineraryStreamScanner();
            List<String> objects = new ArrayList<>(scanner.feed(PAYLOAD.substring(0, split)));
            objects.addAll(scanner.feed(PAYLOAD.substring(split)));

            assertThat(objects).as("split at %d", split)
                    .containsExactly("{\"title\":\"A}B\"}", "{\"title\":\"C\"}");
        }
    }

    @Test
    void characterAtATime() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();
        List<String> objects = new ArrayList<>();
        for (char c : PAYLOAD.toCharArray()) {
            objects.addAll(scanner.feed(String.valueOf(c)));
        }

        assertThat(objects).hasSize(2);
    }

    @Test
    void escapedQuotesAndBracesInsideStrings() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        List<String> objects = scanner.feed("[{\"t\":\"say \\\"{hi}\\\" [x]\",\"n\":{\"k\":1}}]");

        assertThat(objects).containsExactly("{\"t\":\"say \\\"{hi}\\\" [x]\",\"n\":{\"k\":1}}");
    }

    @Test
    void bracketInsideKeyBeforeTheArrayIsIgnored() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        List<String> objects = scanner.feed("{\"note[s]\":1,\"events\":[{\"a\":1}]}");

        assertThat(objects).containsExactly("{\"a\":1}");
    }

    @Test
    void textBeforeTheArrayProducesNothing() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        assertThat(scanner.feed("Here is your itinerary: {\"events\": ")).isEmpty();
        assertThat(scanner.state()).isEqualTo(ItineraryStreamScanner.State.OUTSIDE);
        assertThat(scanner.feed("[{\"a\":1}")).containsExactly("{\"a\":1}");
        assertThat(scanner.state()).isEqualTo(ItineraryStreamScanner.State.IN_ARRAY);
        assertThat(scanner.depth()).isZero();
    }

    @Test
    void unfinishedObjectIsNeverEmitted() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        assertThat(scanner.feed("[{\"a\":1},{\"b\":")).containsExactly("{\"a\":1}");
        assertThat(scanner.depth()).isEqualTo(1);
        assertThat(scanner.feed(null)).isEmpty();
    }

    @Test
    void objectsAfterTheClosedArrayAreNotEvents() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        List<String> objects = new ArrayList<>(scanner.feed("{\"events\":[{\"title\":\"A\"}]"));
        objects.addAll(scanner.feed(",\"meta\":{\"count\":1}}"));

        assertThat(objects).containsExactly("{\"title\":\"A\"}");
        assertThat(scanner.state()).isEqualTo(ItineraryStreamScanner.State.DONE);
    }

    @Test
    void nestedArrayInsideAnEventDoesNotCloseTheStream() {
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();

        List<String> objects = scanner.feed("[{\"tags\":[\"a\",\"b\"]},{\"c\":2}]");

        assertThat(objects).containsExactly("{\"tags\":[\"a\",\"b\"]}", "{\"c\":2}");
    }
}
