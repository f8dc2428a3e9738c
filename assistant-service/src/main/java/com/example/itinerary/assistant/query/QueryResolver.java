package com.example.itinerary.assistant.query;

import com.example.itinerary.assistant.cache.QueryCacheEntry;
import com.example.itinerary.assistant.cache.ResponseCache;
import com.example.itinerary.assistant.config.QueryProperties;
import com.example.itinerary.assistant.error.ContextTooLargeException;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.assistant.serialize.AiContext;
import com.example.itinerary.assistant.serialize.EventSerializer;
import com.example.itinerary.assistant.telemetry.QueryTelemetryPublisher;
import com.example.itinerary.assistant.trip.TripStoreClient;
import com.example.itinerary.common.events.QueryTelemetryEvent;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Trip;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Answers one question about a trip. Each step is terminal on first match: validation,
 * empty trip, cache, deterministic computation, then the model.
 */
@Service
public class QueryResolver {

    private static final Logger log = LoggerFactory.getLogger(QueryResolver.class);

    static final String NO_EVENTS_ANSWER =
            "This trip has no events yet. Add some events to your trip to ask questions about it!";
    static final String NO_ANSWER = "No answer generated";
    static final String UNTITLED_TRIP = "Untitled Trip";

    static final String SYSTEM_PROMPT = """
            You are an itinerary analysis assistant.

            You are given structured trip data in JSON format containing a trip name, dates, and events.
            Answer user questions using this data. Be helpful and use logical reasoning based on the provided information.

            Date Handling Rules:
            - All dates are in ISO 8601 format
            - To calculate duration: parse dates and compute difference
            - For accommodation nights: checkOut date minus checkIn date
            - For travel duration: arrival date minus departure date
            - Trip duration: trip.endDate minus trip.startDate

            Important:
            - Use the trip.startDate and trip.endDate to answer questions about trip length
            - Use the events array to count activities, locations, and times
            - If you can reasonably infer an answer from the data, provide it
            - Only respond "The provided itinerary data does not contain enough information" if truly impossible to answer

            Examples:

            Q: "How many days is my trip?"
            A: Calculate days between trip.startDate and trip.endDate

            Q: "How many hotel nights do I have?"
            A: Count accommodation events and sum (checkOut - checkIn) for each.

            Q: "What is my longest layover?"
            A: For consecutive travel events, compute (next departure - previous arrival). Report the maximum.

            Q: "What is my busiest day?"
            A: Count events per day, find the day with most events.

            Be concise and friendly. Answer the question directly.""";

    private final QueryValidator validator;
    private final QueryClassifier classifier;
    private final DeterministicAnswers answers;
    private final EventSerializer serializer;
    private final ResponseSanitizer sanitizer;
    private final ResponseCache cache;
    private final QueryTelemetryPublisher telemetry;
    private final TripStoreClient tripStore;
    private final ChatLanguageModel model;
    private final Clock clock;
    private final int maxContextTokens;
    private final TokenPricing pricing;

    public QueryResolver(QueryValidator validator,
                         QueryClassifier classifier,
                         DeterministicAnswers answers,
                         EventSerializer serializer,
                         ResponseSanitizer sanitizer,
                         ResponseCache cache,
                         QueryTelemetryPublisher telemetry,
                         TripStoreClient tripStore,
                         @Qualifier("queryChatModel") ChatLanguageModel model,
                         Clock clock,
                         QueryProperties props) {
        this.validator = validator;
        this.classifier = classifier;
        this.answers = answers;
        this.serializer = serializer;
        this.sanitizer = sanitizer;
        this.cache = cache;
        this.telemetry = telemetry;
        this.tripStore = tripStore;
        this.model = model;
        this.clock = clock;
        this.maxContextTokens = props.getMaxContextTokens();
        this.pricing = new TokenPricing(props.getInputPricePerMillion(), props.getOutputPricePerMillion());
    }

    /**
     * Validates the question, loads the trip and its events, then resolves.
     */
    public TripQueryResponse ask(String userId, String tripId, String question) {
        validator.validate(question);
        Trip trip = tripStore.getTrip(tripId);
        List<ItineraryEvent> events = tripStore.getEvents(tripId);
        return resolve(userId, trip, events, question);
    }

    public TripQueryResponse resolve(String userId, Trip trip, List<ItineraryEvent> events, String question) {
        long startMs = clock.millis();
        validator.validate(question);
        String tripId = trip.getId();

        if (events.isEmpty()) {
            return new TripQueryResponse(NO_EVENTS_ANSWER, 0, 0, 0, 0, 0, false, false);
        }

        Optional<QueryCacheEntry> hit = cache.get(tripId, question);
        if (hit.isPresent()) {
            log.info("[QueryResolver] Cache hit for trip {}", tripId);
            long latency = clock.millis() - startMs;
            QueryCacheEntry entry = hit.get();
            publish(userId, tripId, question, entry.getAnswer(), entry.getTokensUsed(), 0, 0, 0, latency, true, false);
            return new TripQueryResponse(entry.getAnswer(), entry.getTokensUsed(), 0, 0, 0, latency, true, false);
        }

        Instant tripStart = IsoDates.parse(trip.getStartDate()).orElse(null);
        Instant tripEnd = IsoDates.parse(trip.getEndDate()).orElse(null);

        Optional<DeterministicFunction> function = classifier.classify(question);
        if (function.isPresent()) {
            log.info("[QueryResolver] Deterministic query detected: {}", function.get().getFunctionName());
            String answer = answers.execute(function.get(), events, tripStart, tripEnd);
            long latency = clock.millis() - startMs;
            cache.put(tripId, question, answer, 0);
            publish(userId, tripId, question, answer, 0, 0, 0, 0, latency, false, true);
            return new TripQueryResponse(answer, 0, 0, 0, 0, latency, false, true);
        }

        AiContext context = serializer.createAiContext(
                tripName(trip),
                isoOrRaw(tripStart, trip.getStartDate()),
                isoOrRaw(tripEnd, trip.getEndDate()),
                serializer.serializeEventsForAi(events));
        int estimated = serializer.estimateTokenCount(context);
        log.debug("[QueryResolver] Estimated context tokens for trip {}: {}", tripId, estimated);
        if (estimated > maxContextTokens) {
            throw new ContextTooLargeException(
                    "Trip is too large for AI analysis (too many events). Please try a more specific question.",
                    estimated, maxContextTokens);
        }

        String userPrompt = "Trip Data:\n" + serializer.toPrettyJson(context) + "\n\nUser Question:\n" + question;
        List<ChatMessage> messages = List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(userPrompt));

        Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (Exception ex) {
            log.warn("[QueryResolver] Model call failed for trip {}: {}", tripId, ex.toString());
            throw new UpstreamCallException("AI query failed: " + messageOf(ex), ex);
        }

        AiMessage message = response != null ? response.content() : null;
        String raw = message != null && message.text() != null ? message.text() : NO_ANSWER;
        String answer = sanitizer.sanitize(raw);
        TokenUsage usage = response != null ? response.tokenUsage() : null;
        int promptTokens = TokenPricing.promptTokens(usage);
        int completionTokens = TokenPricing.completionTokens(usage);
        int tokensUsed = promptTokens + completionTokens;
        double cost = pricing.cost(promptTokens, completionTokens);
        long latency = clock.millis() - startMs;

        cache.put(tripId, question, answer, tokensUsed);
        publish(userId, tripId, question, answer, tokensUsed, promptTokens, completionTokens, cost, latency, false, false);
        log.info("[QueryResolver] Answered trip {} with {} tokens in {} ms", tripId, tokensUsed, latency);
        return new TripQueryResponse(answer, tokensUsed, promptTokens, completionTokens, cost, latency, false, false);
    }

    private void publish(String userId, String tripId, String question, String answer, int tokensUsed,
                         int promptTokens, int completionTokens, double cost, long latencyMs,
                         boolean cached, boolean deterministic) {
        QueryTelemetryEvent event = new QueryTelemetryEvent();
        event.setUserId(userId);
        event.setTripId(tripId);
        event.setQuestion(question);
        event.setAnswer(answer);
        event.setTokensUsed(tokensUsed);
        event.setPromptTokens(promptTokens);
        event.setCompletionTokens(completionTokens);
        event.setEstimatedCostUsd(cost);
        event.setLatencyMs(latencyMs);
        event.setCached(cached);
        event.setDeterministic(deterministic);
        event.setCreatedAt(clock.instant());
        telemetry.publish(event);
    }

    public static String tripName(Trip trip) {
        return trip.getName() != null && !trip.getName().isBlank() ? trip.getName() : UNTITLED_TRIP;
    }

    public static String messageOf(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : "Unknown error";
    }

    private static String isoOrRaw(Instant parsed, String raw) {
        return parsed != null ? parsed.toString() : raw;
    }
}
