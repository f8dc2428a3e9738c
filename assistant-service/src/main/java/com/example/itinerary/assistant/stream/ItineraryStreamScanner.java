package com.example.itinerary.assistant.stream;

import java.util.ArrayList;
import java.util.List;

/**
 * Incremental scanner that pulls complete JSON objects out of the first top-level array of a
 * text stream, whatever the chunk boundaries. Each object is returned exactly once, as soon as
 * its closing brace arrives.
 * <p>
 * One instance per stream; not thread-safe.
 */
public class ItineraryStreamScanner {

    public enum State {
        /** Before the first {@code [} outside a string. */
        OUTSIDE,
        IN_ARRAY,
        IN_STRING,
        /** Just after a backslash inside a string. */
        ESCAPED,
        /** The array is closed; the rest of the stream is ignored. */
        DONE
    }

    private final StringBuilder buffer = new StringBuilder();
    private State state = State.OUTSIDE;
    private State afterString = State.OUTSIDE;
    private int depth;
    private int objectStart = -1;

    /**
     * Consumes one chunk and returns the text of every object completed by it, in order.
     */
    public List<String> feed(CharSequence chunk) {
        List<String> completed = new ArrayList<>();
        if (chunk == null) return completed;
        for (int i = 0; i < chunk.length(); i++) {
            String done = accept(chunk.charAt(i));
            if (done != null) {
                completed.add(done);
            }
        }
        return completed;
    }

    /**
     * The single transition function. Returns the object text when {@code c} closes one, else null.
     */
    String accept(char c) {
        buffer.append(c);
        int pos = buffer.length() - 1;
        String emitted = null;

        switch (state) {
            case DONE:
                break;
            case ESCAPED:
                state = State.IN_STRING;
                break;
            case IN_STRING:
                if (c == '\\') {
                    state = State.ESCAPED;
                } else if (c == '"') {
                    state = afterString;
                }
                break;
            case OUTSIDE:
                if (c == '"') {
                    enterString(State.OUTSIDE);
                } else if (c == '[') {
                    state = State.IN_ARRAY;
                }
                break;
            case IN_ARRAY:
                if (c == '"') {
                    enterString(State.IN_ARRAY);
                } else if (c == '{') {
                    if (depth == 0) {
                        objectStart = pos;
                    }
                    depth++;
                } else if (c == ']' && depth == 0) {
                    state = State.DONE;
                } else if (c == '}' && depth > 0) {
                    depth--;
                    if (depth == 0 && objectStart >= 0) {
                        emitted = buffer.substring(objectStart, pos + 1);
                        objectStart = -1;
                    }
                }
                break;
        }

        // Nothing outside an open object is needed again
        if (depth == 0) {
            buffer.setLength(0);
        }
        return emitted;
    }

    private void enterString(State returnTo) {
        afterString = returnTo;
        state = State.IN_STRING;
    }

    public State state() {
        return state;
    }

    public int depth() {
        return depth;
    }
}
