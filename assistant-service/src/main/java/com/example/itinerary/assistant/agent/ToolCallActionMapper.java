package com.example.itinerary.assistant.agent;

import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.normalize.EventNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the model's tool calls into proposed {@link AgentAction}s. Nothing here touches stored data.
 */
@Component
public class ToolCallActionMapper {

    private static final Logger log = LoggerFactory.getLogger(ToolCallActionMapper.class);

    static final String UNKNOWN_EVENT = "Unknown Event";
    static final String PENDING_PREFIX = "pending-";

    private static final TypeReference<LinkedHashMap<String, Object>> ARGS = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final EventNormalizer normalizer;
    private final SecureRandom random = new SecureRandom();

    public ToolCallActionMapper(ObjectMapper mapper, EventNormalizer normalizer) {
        this.mapper = mapper;
        this.normalizer = normalizer;
    }

    public List<AgentAction> toActions(List<ToolExecutionRequest> calls, List<ItineraryEvent> existing) {
        List<AgentAction> actions = new ArrayList<>();
        for (ToolExecutionRequest call : calls) {
            Optional<AgentActionType> type = AgentActionType.fromToolName(call.name());
            if (type.isEmpty()) {
                log.warn("[ToolCallActionMapper] Skipping unknown tool {}", call.name());
                continue;
            }
            Map<String, Object> args;
            try {
                args = parseArguments(call.arguments());
            } catch (JsonProcessingException ex) {
                log.warn("[ToolCallActionMapper] Skipping {} call with malformed arguments: {}", call.name(), ex.getOriginalMessage());
                continue;
            }
            switch (type.get()) {
                case CREATE_EVENT -> actions.add(create(args));
                case EDIT_EVENT -> actions.add(edit(args, existing));
                case DELETE_EVENT -> actions.add(delete(args, existing));
            }
        }
        return actions;
    }

    private AgentAction create(Map<String, Object> args) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("id", PENDING_PREFIX + newId());
        raw.putAll(args);
        if (raw.get("location") == null) {
            raw.put("location", Map.of("name", ""));
        }
        return AgentAction.create(newId(), normalizer.normalize(raw));
    }

    private AgentAction edit(Map<String, Object> args, List<ItineraryEvent> existing) {
        String eventId = stringArg(args, "eventId");
        Optional<ItineraryEvent> current = find(existing, eventId);

        Map<String, Object> updates = new LinkedHashMap<>(args);
        updates.remove("eventId");

        Map<String, Object> merged = new LinkedHashMap<>();
        current.ifPresent(e -> merged.putAll(mapper.convertValue(e, ARGS)));
        merged.put("id", eventId);
        Object title = updates.get("title");
        merged.put("title", title != null ? title : current.map(ItineraryEvent::getTitle).orElse(UNKNOWN_EVENT));
        // supplied nested objects replace the existing ones wholesale
        merged.putAll(updates);
        return AgentAction.edit(newId(), normalizer.normalize(merged));
    }

    private AgentAction delete(Map<String, Object> args, List<ItineraryEvent> existing) {
        String eventId = stringArg(args, "eventId");
        String title = find(existing, eventId)
                .map(ItineraryEvent::getTitle)
                .filter(t -> !t.isEmpty())
                .orElse(UNKNOWN_EVENT);
        return AgentAction.delete(newId(), new EventReference(eventId, title), stringArg(args, "reason"));
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed = mapper.readValue(arguments, ARGS);
        return parsed != null ? parsed : new LinkedHashMap<>();
    }

    private static Optional<ItineraryEvent> find(List<ItineraryEvent> events, String id) {
        if (id == null) return Optional.empty();
        for (ItineraryEvent e : events) {
            if (id.equals(e.getId())) return Optional.of(e);
        }
        return Optional.empty();
    }

    private static String stringArg(Map<String, Object> args, String key) {
        Object v = args.get(key);
        return v != null ? String.valueOf(v) : null;
    }

    /** 16 lowercase hex characters. */
    String newId() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
