package com.example.itinerary.assistant.agent;

import com.example.itinerary.assistant.config.AgentProperties;
import com.example.itinerary.assistant.error.ContextTooLargeException;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.assistant.query.DeterministicAnswers;
import com.example.itinerary.assistant.query.DeterministicFunction;
import com.example.itinerary.assistant.query.IsoDates;
import com.example.itinerary.assistant.query.QueryClassifier;
import com.example.itinerary.assistant.query.QueryResolver;
import com.example.itinerary.assistant.query.TokenPricing;
import com.example.itinerary.assistant.serialize.AiContext;
import com.example.itinerary.assistant.serialize.EventSerializer;
import com.example.itinerary.assistant.trip.TripStoreClient;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.Trip;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One conversational turn of the itinerary editing agent. Tool calls come back as proposed
 * actions; the orchestrator never changes the trip itself.
 */
@Service
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final QueryClassifier classifier;
    private final DeterministicAnswers answers;
    private final EventSerializer serializer;
    private final ToolCallActionMapper actionMapper;
    private final TripStoreClient tripStore;
    private final ChatLanguageModel model;
    private final ChatLanguageModel summaryModel;
    private final Clock clock;
    private final int maxContextTokens;
    private final TokenPricing pricing;

    public AgentOrchestrator(QueryClassifier classifier,
                             DeterministicAnswers answers,
                             EventSerializer serializer,
                             ToolCallActionMapper actionMapper,
                             TripStoreClient tripStore,
                             @Qualifier("agentChatModel") ChatLanguageModel model,
                             @Qualifier("agentSummaryChatModel") ChatLanguageModel summaryModel,
                             Clock clock,
                             AgentProperties props) {
        this.classifier = classifier;
        this.answers = answers;
        this.serializer = serializer;
        this.actionMapper = actionMapper;
        this.tripStore = tripStore;
        this.model = model;
        this.summaryModel = summaryModel;
        this.clock = clock;
        this.maxContextTokens = props.getMaxContextTokens();
        this.pricing = new TokenPricing(props.getInputPricePerMillion(), props.getOutputPricePerMillion());
    }

    public AgentChatResponse chat(String tripId, List<AgentMessage> messages) {
        Trip trip = tripStore.getTrip(tripId);
        List<ItineraryEvent> events = tripStore.getEvents(tripId);
        return chat(trip, events, messages);
    }

    public AgentChatResponse chat(Trip trip, List<ItineraryEvent> events, List<AgentMessage> messages) {
        long startMs = clock.millis();
        Instant tripStart = IsoDates.parse(trip.getStartDate()).orElse(null);
        Instant tripEnd = IsoDates.parse(trip.getEndDate()).orElse(null);

        Optional<AgentMessage> lastUser = lastUserMessage(messages);
        if (lastUser.isPresent()) {
            Optional<DeterministicFunction> function = classifier.classify(lastUser.get().getContent());
            if (function.isPresent()) {
                log.info("[AgentOrchestrator] Deterministic turn for trip {}: {}", trip.getId(), function.get().getFunctionName());
                String answer = answers.execute(function.get(), events, tripStart, tripEnd);
                return new AgentChatResponse(answer, List.of(), 0, 0, 0, clock.millis() - startMs);
            }
        }

        AiContext context = serializer.createAiContext(QueryResolver.tripName(trip),
                tripStart != null ? tripStart.toString() : trip.getStartDate(),
                tripEnd != null ? tripEnd.toString() : trip.getEndDate(),
                serializer.serializeEventsForAi(events));
        int estimated = serializer.estimateTokenCount(context);
        if (estimated > maxContextTokens) {
            throw new ContextTooLargeException(
                    "Trip is too large for AI analysis. Please try a more specific question.", estimated, maxContextTokens);
        }

        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(SystemMessage.from(AgentPrompts.SYSTEM_PROMPT + AgentPrompts.TRIP_DATA_HEADER
                + serializer.toPrettyJson(context)));
        for (AgentMessage m : messages) {
            if (AgentMessage.USER.equals(m.getRole())) {
                conversation.add(UserMessage.from(m.getContent()));
            } else if (AgentMessage.ASSISTANT.equals(m.getRole())) {
                conversation.add(AiMessage.from(m.getContent()));
            }
        }

        Response<AiMessage> first = call(model, conversation, true);
        AiMessage assistant = first.content();
        int promptTokens = TokenPricing.promptTokens(first.tokenUsage());
        int completionTokens = TokenPricing.completionTokens(first.tokenUsage());
        String reply = assistant != null && assistant.text() != null ? assistant.text() : "";

        List<AgentAction> actions = List.of();
        if (assistant != null && assistant.hasToolExecutionRequests()) {
            List<ToolExecutionRequest> calls = assistant.toolExecutionRequests();
            actions = actionMapper.toActions(calls, events);
            log.info("[AgentOrchestrator] Trip {}: {} tool calls, {} proposed actions", trip.getId(), calls.size(), actions.size());

            List<ChatMessage> followUp = new ArrayList<>(conversation);
            followUp.add(assistant);
            for (ToolExecutionRequest call : calls) {
                followUp.add(ToolExecutionResultMessage.from(call, AgentPrompts.TOOL_ACK));
            }
            Response<AiMessage> summary = call(summaryModel, followUp, false);
            AiMessage summaryMessage = summary.content();
            if (summaryMessage != null && summaryMessage.text() != null && !summaryMessage.text().isEmpty()) {
                reply = summaryMessage.text();
            }
            promptTokens += TokenPricing.promptTokens(summary.tokenUsage());
            completionTokens += TokenPricing.completionTokens(summary.tokenUsage());
        }

        long latency = clock.millis() - startMs;
        log.debug("[AgentOrchestrator] Turn for trip {} done in {} ms; tokens={}", trip.getId(), latency,
                promptTokens + completionTokens);
        return new AgentChatResponse(reply, actions, promptTokens, completionTokens,
                pricing.cost(promptTokens, completionTokens), latency);
    }

    private Response<AiMessage> call(ChatLanguageModel target, List<ChatMessage> messages, boolean withTools) {
        try {
            Response<AiMessage> response = withTools
                    ? target.generate(messages, ItineraryToolSpecifications.all())
                    : target.generate(messages);
            if (response == null) {
                throw new UpstreamCallException("AI agent error: empty response");
            }
            return response;
        } catch (UpstreamCallException ex) {
            throw ex;
        } catch (Exception ex) {
            log.warn("[AgentOrchestrator] Model call failed: {}", ex.toString());
            throw new UpstreamCallException("AI agent error: " + QueryResolver.messageOf(ex), ex);
        }
    }

    private static Optional<AgentMessage> lastUserMessage(List<AgentMessage> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (AgentMessage.USER.equals(messages.get(i).getRole())) {
                return Optional.of(messages.get(i));
            }
        }
        return Optional.empty();
    }
}
