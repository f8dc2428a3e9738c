package com.example.itinerary.assistant.api;

import com.example.itinerary.assistant.stream.GenerationSummary;
import com.example.itinerary.assistant.stream.ItineraryGenerator;
import com.example.itinerary.assistant.stream.ItineraryRequest;
import com.example.itinerary.common.model.ItineraryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Server-sent events for itinerary generation: one message per event as it is produced, then a
 * summary. Request validation happens before the stream opens so bad input still gets a JSON 400.
 */
@RestController
@RequestMapping("/api/agent")
public class ItineraryStreamController {

    private static final Logger log = LoggerFactory.getLogger(ItineraryStreamController.class);

    private final ItineraryGenerator generator;
    private final TaskExecutor executor;

    public ItineraryStreamController(ItineraryGenerator generator,
                                     @Qualifier("applicationTaskExecutor") TaskExecutor executor) {
        this.generator = generator;
        this.executor = executor;
    }

    @PostMapping(value = "/generate-itinerary-stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter generateItineraryStream(@RequestBody ItineraryRequest request) {
        generator.validate(request);
        SseEmitter emitter = new SseEmitter(0L);
        executor.execute(() -> run(request, emitter));
        return emitter;
    }

    private void run(ItineraryRequest request, SseEmitter emitter) {
        try {
            GenerationSummary summary = generator.generateStream(request, event -> send(emitter, eventMessage(event)));
            send(emitter, doneMessage(summary));
            emitter.complete();
        } catch (RuntimeException ex) {
            log.warn("[ItineraryStreamController] Streaming generation failed: {}", ex.toString());
            try {
                emitter.send(SseEmitter.event().data(Map.of("error",
                        ex.getMessage() != null ? ex.getMessage() : "Generation failed")));
                emitter.complete();
            } catch (IOException | IllegalStateException sendEx) {
                emitter.completeWithError(sendEx);
            }
        }
    }

    private static void send(SseEmitter emitter, Map<String, Object> message) {
        try {
            emitter.send(SseEmitter.event().data(message));
        } catch (IOException ex) {
            throw new UncheckedIOException("Client disconnected", ex);
        }
    }

    private static Map<String, Object> eventMessage(ItineraryEvent event) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("event", event);
        return out;
    }

    private static Map<String, Object> doneMessage(GenerationSummary summary) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("done", true);
        out.put("reply", summary.getReply());
        out.put("tokensUsed", summary.getTokensUsed());
        out.put("promptTokens", summary.getPromptTokens());
        out.put("completionTokens", summary.getCompletionTokens());
        out.put("estimatedCostUsd", summary.getEstimatedCostUsd());
        out.put("latencyMs", summary.getLatencyMs());
        out.put("eventCount", summary.getEventCount());
        return out;
    }
}
