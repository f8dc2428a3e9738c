package com.example.itinerary.assistant.agent;

import com.example.itinerary.assistant.config.AgentProperties;
import com.example.itinerary.assistant.error.ContextTooLargeException;
import com.example.itinerary.assistant.error.UpstreamCallException;
import com.example.itinerary.assistant.query.DeterministicAnswers;
import com.example.itinerary.assistant.query.QueryClassifier;
import com.example.itinerary.assistant.serialize.EventSerializer;
import com.example.itinerary.assistant.trip.TripStoreClient;
import com.example.itinerary.common.model.Trip;
import com.example.itinerary.common.normalize.EventNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.example.itinerary.assistant.TripFixtures.europeTrip;
import static com.example.itinerary.assistant.TripFixtures.trip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentOrchestratorTest {

    @Mock ChatLanguageModel model;
    @Mock ChatLanguageModel summaryModel;
    @Mock TripStoreClient tripStore;
    @Captor ArgumentCaptor<List<ChatMessage>> sentMessages;

    private final AgentProperties props = new AgentProperties();
    private final ObjectMapper mapper = new ObjectMapper();
    private AgentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = newOrchestrator();
    }

    private AgentOrchestrator newOrchestrator() {
        return new AgentOrchestrator(new QueryClassifier(), new DeterministicAnswers(), new EventSerializer(mapper),
                new ToolCallActionMapper(mapper, new EventNormalizer(mapper)), tripStore, model, summaryModel,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC), props);
    }

    @Test
    void deterministicTurnNeedsNoModel() {
        AgentChatResponse response = orchestrator.chat(trip("t-1"), europeTrip(),
                List.of(AgentMessage.user("hi"), AgentMessage.assistant("Hello!"), AgentMessage.user("How many flights?")));

        assertThat(response.getReply()).isEqualTo("You have 2 flights.");
        assertThat(response.getActions()).isEmpty();
        assertThat(response.getTokensUsed()).isZero();
        verifyNoInteractions(model, summaryModel);
    }

    @Test
    void plainReplyWithoutToolCalls() {
        when(model.generate(anyList(), anyList()))
                .thenReturn(Response.from(AiMessage.from("Paris is lovely in June."), new TokenUsage(3000, 40)));

        AgentChatResponse response = orchestrator.chat(trip("t-1"), europeTrip(),
                List.of(AgentMessage.user("Any tips for Paris?")));

        assertThat(response.getReply()).isEqualTo("Paris is lovely in June.");
        assertThat(response.getActions()).isEmpty();
        assertThat(response.getTokensUsed()).isEqualTo(3040);
        verifyNoInteractions(summaryModel);
    }

    @Test
    void toolCallsBecomeProposedActionsWithSummaryReply() {
        ToolExecutionRequest delete = ToolExecutionRequest.builder()
                .id("call-1").name("delete_event").arguments("{\"eventId\":\"h1\",\"reason\":\"Staying with friends\"}")
                .build();
        when(model.generate(anyList(), anyList()))
                .thenReturn(Response.from(AiMessage.from(List.of(delete)), new TokenUsage(3000, 30)));
        when(summaryModel.generate(anyList()))
                .thenReturn(Response.from(AiMessage.from("I've proposed removing Hotel Lumiere."), new TokenUsage(3100, 20)));

        AgentChatResponse response = orchestrator.chat(trip("t-1"), europeTrip(),
                List.of(AgentMessage.user("Remove my Paris hotel")));

        assertThat(response.getReply()).isEqualTo("I've proposed removing Hotel Lumiere.");
        assertThat(response.getActions()).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AgentActionType.DELETE_EVENT);
            assertThat(a.getTarget().getTitle()).isEqualTo("Hotel Lumiere");
            assertThat(a.getStatus()).isEqualTo(AgentActionStatus.PROPOSED);
        });
        assertThat(response.getPromptTokens()).isEqualTo(6100);
        assertThat(response.getCompletionTokens()).isEqualTo(50);

        verify(summaryModel).generate(sentMessages.capture());
        List<ChatMessage> sent = sentMessages.getValue();
        assertThat(sent.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(sent.get(sent.size() - 1)).isInstanceOfSatisfying(ToolExecutionResultMessage.class, m -> {
            assertThat(m.id()).isEqualTo("call-1");
            assertThat(m.text()).isEqualTo("{\"success\":true,\"status\":\"proposed_to_user\"}");
        });
    }

    @Test
    void oversizedTripIsRejected() {
        props.setMaxContextTokens(5);
        orchestrator = newOrchestrator();

        assertThatThrownBy(() -> orchestrator.chat(trip("t-1"), europeTrip(), List.of(AgentMessage.user("Plan day two"))))
                .isInstanceOf(ContextTooLargeException.class)
                .hasMessageContaining("too large");
    }

    @Test
    void modelFailureIsUpstreamError() {
        when(model.generate(anyList(), anyList())).thenThrow(new RuntimeException("timeout"));

        assertThatThrownBy(() -> orchestrator.chat(trip("t-1"), europeTrip(), List.of(AgentMessage.user("Plan day two"))))
                .isInstanceOf(UpstreamCallException.class)
                .hasMessage("AI agent error: timeout");
    }

    @Test
    void loadsTripFromStore() {
        when(tripStore.getTrip("t-1")).thenReturn(trip("t-1"));
        when(tripStore.getEvents("t-1")).thenReturn(europeTrip());

        AgentChatResponse response = orchestrator.chat("t-1", List.of(AgentMessage.user("how many countries?")));

        assertThat(response.getReply()).startsWith("You are visiting 3 countries");
    }

    @Test
    void unnamedTripIsPresentedAsUntitled() {
        when(model.generate(anyList(), anyList()))
                .thenReturn(Response.from(AiMessage.from("Sure."), new TokenUsage(100, 5)));
        Trip unnamed = trip("t-2");
        unnamed.setName(null);

        orchestrator.chat(unnamed, europeTrip(), List.of(AgentMessage.user("Any tips for Paris?")));

        verify(model).generate(sentMessages.capture(), anyList());
        assertThat(sentMessages.getValue().get(0)).isInstanceOfSatisfying(SystemMessage.class,
                m -> assertThat(m.text()).contains("Untitled Trip"));
    }
}
