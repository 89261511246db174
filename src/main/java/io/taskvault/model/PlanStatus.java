package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PlanStatus {
    OPEN("open"),
    COMPLETE("complete"),
    REJECTED("rejected");

    private final String wireName;

    PlanStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    @JsonCreator
    public static PlanStatus fromString(String raw) {
        for (PlanStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown plan status: " + raw);
    }
}
