package com.example.itinerary.assistant.agent;

import com.example.itinerary.common.model.EventCategory;
import com.example.itinerary.common.model.EventType;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * The three tools offered to the agent. Argument schemas mirror the canonical event shape.
 */
public final class ItineraryToolSpecifications {

    private ItineraryToolSpecifications() {}

    public static List<ToolSpecification> all() {
        return List.of(createEvent(), editEvent(), deleteEvent());
    }

    static ToolSpecification createEvent() {
        JsonObjectSchema params = JsonObjectSchema.builder()
                .addProperty("category", JsonEnumSchema.builder()
                        .enumValues(values(EventCategory.values()))
                        .description("The event category")
                        .build())
                .addProperty("type", JsonEnumSchema.builder()
                        .enumValues(values(EventType.values()))
                        .description("The specific event type")
                        .build())
                .addProperty("title", string("Event title"))
                .addProperty("start", string("Start date/time in ISO 8601"))
                .addProperty("end", string("End date/time in ISO 8601"))
                .addProperty("notes", string("Optional notes"))
                .addProperty("location", location(true))
                .addProperty("departure", datedLocation("For travel events only"))
                .addProperty("arrival", datedLocation("For travel events only"))
                .addProperty("checkIn", datedLocation("For accommodation events only"))
                .addProperty("checkOut", datedLocation("For accommodation events only"))
                .addProperty("startDate", string("For experience events only"))
                .addProperty("endDate", string("For experience events only"))
                .addProperty("date", string("For meal events only"))
                .required("category", "type", "title", "start", "location")
                .build();
        return ToolSpecification.builder()
                .name(AgentActionType.CREATE_EVENT.getToolName())
                .description("Create a new event in the trip itinerary.")
                .parameters(params)
                .build();
    }

    static ToolSpecification editEvent() {
        JsonObjectSchema params = JsonObjectSchema.builder()
                .addProperty("eventId", string("The ID of the event to edit"))
                .addStringProperty("title")
                .addStringProperty("start")
                .addStringProperty("end")
                .addStringProperty("notes")
                .addProperty("location", location(false))
                .addProperty("departure", datedLocation(null))
                .addProperty("arrival", datedLocation(null))
                .addProperty("checkIn", datedLocation(null))
                .addProperty("checkOut", datedLocation(null))
                .addStringProperty("startDate")
                .addStringProperty("endDate")
                .addStringProperty("date")
                .required("eventId")
                .build();
        return ToolSpecification.builder()
                .name(AgentActionType.EDIT_EVENT.getToolName())
                .description("Edit an existing event. Only include fields that should change.")
                .parameters(params)
                .build();
    }

    static ToolSpecification deleteEvent() {
        JsonObjectSchema params = JsonObjectSchema.builder()
                .addProperty("eventId", string("The ID of the event to delete"))
                .addProperty("reason", string("Brief explanation of why"))
                .required("eventId")
                .build();
        return ToolSpecification.builder()
                .name(AgentActionType.DELETE_EVENT.getToolName())
                .description("Delete an event from the trip.")
                .parameters(params)
                .build();
    }

    private static JsonSchemaElement string(String description) {
        return JsonStringSchema.builder().description(description).build();
    }

    private static JsonObjectSchema location(boolean nameRequired) {
        JsonObjectSchema.Builder b = JsonObjectSchema.builder()
                .addStringProperty("name")
                .addStringProperty("city")
                .addStringProperty("country");
        if (nameRequired) {
            b.required("name");
        }
        return b.build();
    }

    private static JsonObjectSchema datedLocation(String description) {
        return JsonObjectSchema.builder()
                .description(description)
                .addStringProperty("date")
                .addProperty("location", location(false))
                .build();
    }

    private static List<String> values(Enum<?>[] constants) {
        List<String> out = new ArrayList<>();
        for (Enum<?> c : constants) {
            out.add(c.toString());
        }
        return out;
    }
}
