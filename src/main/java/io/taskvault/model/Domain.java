package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Domain {
    PERSONAL("personal"),
    BUSINESS("business"),
    BOTH("both");

    private final String wireName;

    Domain(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Domain fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PERSONAL;
        }
        for (Domain value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown domain: " + raw);
    }
}
