package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    AWAITING_APPROVAL("awaiting_approval"),
    READY_TO_EXECUTE("ready_to_execute"),
    COMPLETE("complete"),
    REJECTED("rejected"),
    PARTIAL("partial"),
    RETRY_QUEUED("retry_queued"),
    DEFERRED("deferred");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Terminal regardless of any human follow-up. A deferred task only becomes terminal
     * once its deferred entry is dismissed, which the escalation ladder tracks separately.
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == REJECTED || this == PARTIAL;
    }

    @JsonCreator
    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status cannot be empty");
        }
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
