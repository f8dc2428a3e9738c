package com.example.itinerary.assistant.agent;

/**
 * Identifies the target of a proposed deletion.
 */
public class EventReference {
    private final String id;
    private final String title;

    public EventReference(String id, String title) {
        this.id = id;
        this.title = title;
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
}
