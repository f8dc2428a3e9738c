package com.example.itinerary.common.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of checking a raw event record against its category allow-list.
 */
public final class FieldPartition {
    private final Map<String, Object> known;
    private final Map<String, Object> unknown;

    FieldPartition(Map<String, Object> known, Map<String, Object> unknown) {
        this.known = Collections.unmodifiableMap(new LinkedHashMap<>(known));
        this.unknown = Collections.unmodifiableMap(new LinkedHashMap<>(unknown));
    }

    public Map<String, Object> known() {
        return known;
    }

    public Map<String, Object> unknown() {
        return unknown;
    }

    public boolean hasUnknown() {
        return !unknown.isEmpty();
    }
}
