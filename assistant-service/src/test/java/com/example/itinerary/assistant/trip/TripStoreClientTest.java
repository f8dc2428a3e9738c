package com.example.itinerary.assistant.trip;

import com.example.itinerary.assistant.config.TripStoreProperties;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Trip;
import com.example.itinerary.common.normalize.EventNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripStoreClientTest {

    private TripStoreClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().baseUrl("http://trips").exchangeFunction(exchange).build();
        return new TripStoreClient(webClient, new EventNormalizer(), new TripStoreProperties());
    }

    private static Mono<ClientResponse> json(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    void loadsTrip() {
        TripStoreClient client = client(req -> {
            assertThat(req.url().getPath()).isEqualTo("/api/trips/t-1");
            return json("{\"id\":\"t-1\",\"name\":\"Japan\",\"startDate\":\"2024-04-01\",\"endDate\":\"2024-04-10\",\"userId\":\"u\"}");
        });

        Trip trip = client.getTrip("t-1");

        assertThat(trip.getName()).isEqualTo("Japan");
        assertThat(trip.getStartDate()).isEqualTo("2024-04-01");
    }

    @Test
    void normalizesEveryEventRecord() {
        TripStoreClient client = client(req -> json("""
                [{"id":"e1","category":"meal","type":"restaurant","title":"Ramen","date":"2024-04-02T19:00:00Z","cuisine":"japanese"},
                 {"id":"e2","category":"spa","title":"Onsen","start":"2024-04-03T10:00:00Z","end":"2024-04-03T12:00:00Z"}]
                """));

        List<ItineraryEvent> events = client.getEvents("t-1");

        assertThat(events).hasSize(2);
        assertThat(events.get(0).getNotes()).contains("cuisine: \"japanese\"");
        assertThat(events.get(1).getCategory()).isEqualTo(EventCategory.EXPERIENCE);
        assertThat(events.get(1).getStart()).isEqualTo("2024-04-03T10:00:00Z");
    }

    @Test
    void missingTripIsNotFound() {
        TripStoreClient client = client(req -> Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build()));

        assertThatThrownBy(() -> client.getTrip("nope"))
                .isInstanceOf(TripNotFoundException.class)
                .hasMessage("Trip not found: nope");
    }

    @Test
    void serverErrorIsUpstreamFailure() {
        TripStoreClient client = client(req -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build()));

        assertThatThrownBy(() -> client.getEvents("t-1"))
                .isInstanceOf(UpstreamCallException.class)
                .hasMessage("Trip store request failed");
    }
}
