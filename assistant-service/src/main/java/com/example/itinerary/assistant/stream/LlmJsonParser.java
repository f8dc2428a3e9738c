package com.example.itinerary.assistant.stream;

import com.example.itinerary.assistant.error.UpstreamCallException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses JSON produced by a model. A strict parse is tried first, then the outermost
 * {@code {...}} block of the text; if both fail the call is treated as an upstream failure.
 */
@Component
public class LlmJsonParser {

    private static final Logger log = LoggerFactory.getLogger(LlmJsonParser.class);

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public LlmJsonParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonNode parse(String raw) {
        String text = raw == null || raw.isBlank() ? "{}" : raw;
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException first) {
            int open = text.indexOf('{');
            int close = text.lastIndexOf('}');
            if (open >= 0 && close > open) {
                try {
                    return mapper.readTree(text.substring(open, close + 1));
                } catch (JsonProcessingException second) {
                    log.warn("[LlmJsonParser] Fallback parse failed: {}", second.getOriginalMessage());
                }
            }
            log.warn("[LlmJsonParser] Could not parse model output (first 500 chars): {}",
                    text.substring(0, Math.min(500, text.length())));
            throw new UpstreamCallException("Failed to parse generated itinerary", first);
        }
    }

    /**
     * Event records from {@code {"events":[...]}}, {@code {"itinerary":[...]}} or a bare array.
     * Non-object items are skipped.
     */
    public List<Map<String, Object>> eventRecords(JsonNode root) {
        JsonNode items = root;
        if (root != null && root.isObject()) {
            items = root.has("events") ? root.get("events") : root.get("itinerary");
        }
        List<Map<String, Object>> out = new ArrayList<>();
        if (items == null || !items.isArray()) {
            return out;
        }
        for (JsonNode item : items) {
            if (item.isObject()) {
                out.add(mapper.convertValue(item, RECORD));
            }
        }
        return out;
    }

    public Map<String, Object> parseObject(String json) throws JsonProcessingException {
        return mapper.readValue(json, RECORD);
    }
}
