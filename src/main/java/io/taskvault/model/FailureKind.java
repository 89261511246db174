package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a failed execution is escalated. Looked up from the configured error-class table,
 * never inferred from exception types.
 */
public enum FailureKind {
    TRANSIENT("transient"),
    NON_CRITICAL("non_critical"),
    CRITICAL("critical"),
    LOGIC("logic"),
    UNRECOGNIZED("unrecognized");

    private final String wireName;

    FailureKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static FailureKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNRECOGNIZED;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (FailureKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown failure kind: " + raw);
    }
}
