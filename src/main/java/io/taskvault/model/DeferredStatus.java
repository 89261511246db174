package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeferredStatus {
    DEFERRED("deferred"),
    RETRIED("retried"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String wireName;

    DeferredStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static DeferredStatus fromString(String raw) {
        for (DeferredStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown deferred status: " + raw);
    }
}
