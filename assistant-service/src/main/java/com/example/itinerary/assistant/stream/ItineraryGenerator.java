package com.example.itinerary.assistant.stream;

import com.example.itinerary.assistant.config.AgentProperties;
import com.example.itinerary.assistant.error.QueryValidationException;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.assistant.query.QueryResolver;
import com.example.itinerary.assistant.query.TokenPricing;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.normalize.EventNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.StreamingResponseHandler;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Generates placeholder itineraries from a free-text trip description, either in one call or
 * streamed event by event.
 */
@Service
public class ItineraryGenerator {

    private static final Logger log = LoggerFactory.getLogger(ItineraryGenerator.class);

    static final String TRUNCATED_MESSAGE =
            "Generated itinerary was too long and got truncated. Try a shorter trip or simpler description.";
    static final String PLACEHOLDER_NOTE = "placeholder";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ChatLanguageModel model;
    private final StreamingChatLanguageModel streamingModel;
    private final LlmJsonParser parser;
    private final EventNormalizer normalizer;
    private final Clock clock;
    private final int maxDescriptionLength;
    private final TokenPricing pricing;

    public ItineraryGenerator(@Qualifier("generationChatModel") ChatLanguageModel model,
                              @Qualifier("generationStreamingModel") StreamingChatLanguageModel streamingModel,
                              LlmJsonParser parser,
                              EventNormalizer normalizer,
                              Clock clock,
                              AgentProperties props) {
        this.model = model;
        this.streamingModel = streamingModel;
        this.parser = parser;
        this.normalizer = normalizer;
        this.clock = clock;
        this.maxDescriptionLength = props.getMaxDescriptionLength();
        this.pricing = new TokenPricing(props.getInputPricePerMillion(), props.getOutputPricePerMillion());
    }

    public void validate(ItineraryRequest request) {
        if (request == null || isBlank(request.getTripName())) {
            throw new QueryValidationException("Trip name is required");
        }
        if (isBlank(request.getStartDate()) || isBlank(request.getEndDate())) {
            throw new QueryValidationException("Start and end dates are required");
        }
        if (isBlank(request.getDescription())) {
            throw new QueryValidationException("Trip description is required");
        }
        if (request.getDescription().length() > maxDescriptionLength) {
            throw new QueryValidationException("Trip description too long (max " + maxDescriptionLength + " characters)");
        }
    }

    public GeneratedItinerary generate(ItineraryRequest request) {
        validate(request);
        long startMs = clock.millis();

        Response<AiMessage> response;
        try {
            response = model.generate(messages(request, false));
        } catch (Exception ex) {
            log.warn("[ItineraryGenerator] Generation call failed: {}", ex.toString());
            throw new UpstreamCallException("Itinerary generation failed: " + QueryResolver.messageOf(ex), ex);
        }
        if (response == null) {
            throw new UpstreamCallException("Itinerary generation failed: empty response");
        }
        if (response.finishReason() == FinishReason.LENGTH) {
            log.warn("[ItineraryGenerator] Output hit the token limit for trip \"{}\"", request.getTripName());
            throw new UpstreamCallException(TRUNCATED_MESSAGE);
        }

        String text = response.content() != null ? response.content().text() : null;
        List<ItineraryEvent> events = new ArrayList<>();
        for (Map<String, Object> record : parser.eventRecords(parser.parse(text))) {
            events.add(toEvent(record));
        }

        int promptTokens = TokenPricing.promptTokens(response.tokenUsage());
        int completionTokens = TokenPricing.completionTokens(response.tokenUsage());
        long latency = clock.millis() - startMs;
        log.info("[ItineraryGenerator] Generated {} events for \"{}\" in {} ms", events.size(), request.getTripName(), latency);
        return new GeneratedItinerary(events, GenerationPrompts.reply(events.size(), request.getTripName()),
                promptTokens, completionTokens, pricing.cost(promptTokens, completionTokens), latency);
    }

    /**
     * Streams the generation, handing each event to {@code sink} as soon as its JSON object is
     * complete. Blocks until the model finishes.
     */
    public GenerationSummary generateStream(ItineraryRequest request, Consumer<ItineraryEvent> sink) {
        validate(request);
        long startMs = clock.millis();
        ItineraryStreamScanner scanner = new ItineraryStreamScanner();
        int[] emitted = {0};
        CompletableFuture<Response<AiMessage>> done = new CompletableFuture<>();

        try {
            streamingModel.generate(messages(request, true), new StreamingResponseHandler<AiMessage>() {
                @Override
                public void onNext(String token) {
                    for (String json : scanner.feed(token)) {
                        try {
                            sink.accept(toEvent(parser.parseObject(json)));
                            emitted[0]++;
                        } catch (JsonProcessingException ex) {
                            log.warn("[ItineraryGenerator] Skipping unparsable streamed event: {}", ex.getOriginalMessage());
                        }
                    }
                }

                @Override
                public void onComplete(Response<AiMessage> response) {
                    done.complete(response);
                }

                @Override
                public void onError(Throwable error) {
                    done.completeExceptionally(error);
                }
            });
        } catch (Exception ex) {
            done.completeExceptionally(ex);
        }

        Response<AiMessage> response;
        try {
            response = done.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UpstreamCallException("Itinerary generation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("[ItineraryGenerator] Streaming generation failed: {}", cause.toString());
            throw new UpstreamCallException("Itinerary generation failed: " + QueryResolver.messageOf(cause), cause);
        }

        if (response != null && response.finishReason() == FinishReason.LENGTH) {
            log.warn("[ItineraryGenerator] Streamed output hit the token limit after {} events", emitted[0]);
        }
        int promptTokens = response != null ? TokenPricing.promptTokens(response.tokenUsage()) : 0;
        int completionTokens = response != null ? TokenPricing.completionTokens(response.tokenUsage()) : 0;
        long latency = clock.millis() - startMs;
        log.info("[ItineraryGenerator] Streamed {} events for \"{}\" in {} ms", emitted[0], request.getTripName(), latency);
        return new GenerationSummary(GenerationPrompts.reply(emitted[0], request.getTripName()),
                promptTokens, completionTokens, pricing.cost(promptTokens, completionTokens), latency, emitted[0]);
    }

    private ItineraryEvent toEvent(Map<String, Object> lean) {
        Map<String, Object> record = LeanEventExpander.expand(lean);
        record.put("id", "placeholder-" + randomHex(4));
        Object notes = record.get("notes");
        if (notes == null || notes.toString().isEmpty()) {
            record.put("notes", PLACEHOLDER_NOTE);
        }
        return normalizer.normalize(record);
    }

    private static List<ChatMessage> messages(ItineraryRequest request, boolean streaming) {
        return List.of(SystemMessage.from(GenerationPrompts.SYSTEM_PROMPT),
                UserMessage.from(GenerationPrompts.userPrompt(request, streaming)));
    }

    private static String randomHex(int bytes) {
        byte[] buf = new byte[bytes];
        RANDOM.nextBytes(buf);
        return HexFormat.of().formatHex(buf);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
