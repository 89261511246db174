package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Priority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        if ("normal".equalsIgnoreCase(raw.trim())) {
            return MEDIUM;
        }
        for (Priority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
