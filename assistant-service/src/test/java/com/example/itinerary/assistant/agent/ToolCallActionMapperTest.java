package com.example.itinerary.assistant.agent;

import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.ItineraryEvent;
import com.example.itinerary.common.model.MealEvent;
import com.example.itinerary.common.normalize.EventNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.itinerary.assistant.TripFixtures.meal;
import static org.assertj.core.api.Assertions.assertThat;

class ToolCallActionMapperTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ToolCallActionMapper actionMapper = new ToolCallActionMapper(mapper, new EventNormalizer(mapper));
    private final List<ItineraryEvent> existing = List.of(meal("m1", "Bistro", "2024-06-02T19:00:00Z", "Paris", "France"));

    private static ToolExecutionRequest call(String name, String arguments) {
        return ToolExecutionRequest.builder().id("call-" + name).name(name).arguments(arguments).build();
    }

    @Test
    void createProposesPendingEvent() {
        List<AgentAction> actions = actionMapper.toActions(List.of(call("create_event", """
                {"category":"experience","type":"museum","title":"Louvre",
                 "startDate":"2024-06-03T09:00:00Z","endDate":"2024-06-03T12:00:00Z"}
                """)), existing);

        assertThat(actions).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AgentActionType.CREATE_EVENT);
            assertThat(a.getStatus()).isEqualTo(AgentActionStatus.PROPOSED);
            assertThat(a.getId()).matches("[0-9a-f]{16}");
            assertThat(a.getEvent().getId()).startsWith(ToolCallActionMapper.PENDING_PREFIX);
            assertThat(a.getEvent().getCategory()).isEqualTo(EventCategory.EXPERIENCE);
            assertThat(a.getEvent().getStart()).isEqualTo("2024-06-03T09:00:00Z");
            assertThat(a.getEvent().getLocation().getName()).isEmpty();
        });
    }

    @Test
    void editMergesOntoExistingEvent() {
        List<AgentAction> actions = actionMapper.toActions(List.of(call("edit_event", """
                {"eventId":"m1","date":"2024-06-02T20:30:00Z"}
                """)), existing);

        assertThat(actions).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AgentActionType.EDIT_EVENT);
            assertThat(a.getEvent()).isInstanceOf(MealEvent.class);
            MealEvent edited = (MealEvent) a.getEvent();
            assertThat(edited.getId()).isEqualTo("m1");
            assertThat(edited.getTitle()).isEqualTo("Bistro");
            assertThat(edited.getDate()).isEqualTo("2024-06-02T20:30:00Z");
            assertThat(edited.getLocation().getCity()).isEqualTo("Paris");
        });
    }

    @Test
    void editOfUnknownEventFallsBackToPlaceholderTitle() {
        List<AgentAction> actions = actionMapper.toActions(List.of(call("edit_event", """
                {"eventId":"ghost","category":"meal","date":"2024-06-02T20:30:00Z"}
                """)), existing);

        assertThat(actions).singleElement()
                .satisfies(a -> assertThat(a.getEvent().getTitle()).isEqualTo(ToolCallActionMapper.UNKNOWN_EVENT));
    }

    @Test
    void deleteCarriesTargetAndReason() {
        List<AgentAction> actions = actionMapper.toActions(List.of(
                call("delete_event", "{\"eventId\":\"m1\",\"reason\":\"Duplicate booking\"}"),
                call("delete_event", "{\"eventId\":\"ghost\",\"reason\":\"Stale\"}")), existing);

        assertThat(actions).hasSize(2);
        assertThat(actions.get(0).getTarget().getTitle()).isEqualTo("Bistro");
        assertThat(actions.get(0).getReason()).isEqualTo("Duplicate booking");
        assertThat(actions.get(0).getEvent()).isNull();
        assertThat(actions.get(1).getTarget().getTitle()).isEqualTo(ToolCallActionMapper.UNKNOWN_EVENT);
    }

    @Test
    void unknownToolsAndMalformedArgumentsAreSkipped() {
        List<AgentAction> actions = actionMapper.toActions(List.of(
                call("book_flight", "{}"),
                call("create_event", "{not json"),
                call("delete_event", "{\"eventId\":\"m1\",\"reason\":\"x\"}")), existing);

        assertThat(actions).extracting(AgentAction::getType).containsExactly(AgentActionType.DELETE_EVENT);
    }
}
