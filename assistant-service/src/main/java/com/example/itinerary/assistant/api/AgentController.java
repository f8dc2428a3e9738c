package com.example.itinerary.assistant.api;

import com.example.itinerary.assistant.agent.AgentChatResponse;
import com.example.itinerary.assistant.agent.AgentMessage;
import com.example.itinerary.assistant.agent.AgentOrchestrator;
import com.example.itinerary.assistant.stream.GeneratedItinerary;
import com.example.itinerary.assistant.stream.ItineraryGenerator;
import com.example.itinerary.assistant.stream.ItineraryRequest;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/agent")
public class AgentController {

    public static class ChatRequest {
        private final String tripId;
        private final List<AgentMessage> messages;

        @JsonCreator
        public ChatRequest(@JsonProperty("tripId") String tripId,
                           @JsonProperty("messages") List<AgentMessage> messages) {
            this.tripId = tripId;
            this.messages = messages;
        }
        public String getTripId() { return tripId; }
        public List<AgentMessage> getMessages() { return messages; }
    }

    private final AgentOrchestrator orchestrator;
    private final ItineraryGenerator generator;

    public AgentController(AgentOrchestrator orchestrator, ItineraryGenerator generator) {
        this.orchestrator = orchestrator;
        this.generator = generator;
    }

    @PostMapping("/chat")
    public ResponseEntity<AgentChatResponse> chat(@RequestBody ChatRequest request) {
        if (request.getTripId() == null || request.getTripId().isBlank()) {
            throw new IllegalArgumentException("Invalid tripId");
        }
        if (request.getMessages() == null || request.getMessages().isEmpty()) {
            throw new IllegalArgumentException("Messages array is required");
        }
        return ResponseEntity.ok(orchestrator.chat(request.getTripId(), request.getMessages()));
    }

    @PostMapping("/generate-itinerary")
    public ResponseEntity<GeneratedItinerary> generateItinerary(@RequestBody ItineraryRequest request) {
        return ResponseEntity.ok(generator.generate(request));
    }
}
