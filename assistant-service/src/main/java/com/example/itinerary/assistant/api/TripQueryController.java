package com.example.itinerary.assistant.api;

import com.example.itinerary.assistant.query.QueryResolver;
import com.example.itinerary.assistant.query.TripQueryResponse;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/trip-query")
public class TripQueryController {

    public static class QueryRequest {
        private final String tripId;
        private final String question;

        @JsonCreator
        public QueryRequest(@JsonProperty("tripId") String tripId,
                            @JsonProperty("question") String question) {
            this.tripId = tripId;
            this.question = question;
        }
        public String getTripId() { return tripId; }
        public String getQuestion() { return question; }
    }

    private final QueryResolver resolver;

    public TripQueryController(QueryResolver resolver) {
        this.resolver = resolver;
    }

    @PostMapping
    public ResponseEntity<TripQueryResponse> query(@RequestHeader(value = "X-User-Id", required = false) String userId,
                                                   @RequestBody QueryRequest request) {
        if (request.getTripId() == null || request.getTripId().isBlank()) {
            throw new IllegalArgumentException("tripId is required");
        }
        return ResponseEntity.ok(resolver.ask(userId, request.getTripId(), request.getQuestion()));
    }
}
