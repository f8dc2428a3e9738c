package com.example.itinerary.assistant.trip;

import com.example.itinerary.assistant.config.TripStoreProperties;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Trip;
import com.example.itinerary.common.normalize.EventNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to the external trip store. Every raw event record is normalized before it is returned.
 */
@Service
public class TripStoreClient {

    private static final Logger log = LoggerFactory.getLogger(TripStoreClient.class);

    private static final ParameterizedTypeReference<List<Map<String, Object>>> RAW_EVENTS =
            new ParameterizedTypeReference<>() {};

    private final WebClient tripStore;
    private final EventNormalizer normalizer;
    private final Duration timeout;

    public TripStoreClient(@Qualifier("tripStoreWebClient") WebClient tripStore,
                           EventNormalizer normalizer,
                           TripStoreProperties props) {
        this.tripStore = tripStore;
        this.normalizer = normalizer;
        this.timeout = Duration.ofMillis(props.getRequestTimeoutMs());
    }

    public Trip getTrip(String tripId) {
        long start = System.currentTimeMillis();
        try {
            Trip trip = tripStore.get()
                    .uri("/api/trips/{id}", tripId)
                    .retrieve()
                    .bodyToMono(Trip.class)
                    .block(timeout);
            if (trip == null) {
                throw new TripNotFoundException(tripId);
            }
            log.debug("[TripStoreClient] Loaded trip {} in {} ms", tripId, System.currentTimeMillis() - start);
            return trip;
        } catch (WebClientResponseException httpEx) {
            throw translate(tripId, httpEx);
        } catch (WebClientRequestException ioEx) {
            log.warn("[TripStoreClient] Trip store unreachable for trip {}: {}", tripId, ioEx.getMessage());
            throw new UpstreamCallException("Trip store request failed", ioEx);
        }
    }

    public List<ItineraryEvent> getEvents(String tripId) {
        long start = System.currentTimeMillis();
        try {
            List<Map<String, Object>> raw = tripStore.get()
                    .uri("/api/trips/{id}/events", tripId)
                    .retrieve()
                    .bodyToMono(RAW_EVENTS)
                    .block(timeout);
            List<ItineraryEvent> events = new ArrayList<>();
            if (raw != null) {
                for (Map<String, Object> record : raw) {
                    events.add(normalizer.normalize(record));
                }
            }
            log.debug("[TripStoreClient] Loaded {} events for trip {} in {} ms", events.size(), tripId,
                    System.currentTimeMillis() - start);
            return events;
        } catch (WebClientResponseException httpEx) {
            throw translate(tripId, httpEx);
        } catch (WebClientRequestException ioEx) {
            log.warn("[TripStoreClient] Trip store unreachable for trip {}: {}", tripId, ioEx.getMessage());
            throw new UpstreamCallException("Trip store request failed", ioEx);
        }
    }

    private RuntimeException translate(String tripId, WebClientResponseException httpEx) {
        if (httpEx.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
            return new TripNotFoundException(tripId);
        }
        log.warn("[TripStoreClient] Trip store returned {} for trip {}", httpEx.getStatusCode().value(), tripId);
        return new UpstreamCallException("Trip store request failed", httpEx);
    }
}
