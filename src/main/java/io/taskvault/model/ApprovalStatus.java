package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Approval pools double as statuses: a request's status is the pool its artifact sits in.
 */
public enum ApprovalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected");

    private final String poolName;

    ApprovalStatus(String poolName) {
        this.poolName = poolName;
    }

    @JsonValue
    public String poolName() {
        return poolName;
    }

    @JsonCreator
    public static ApprovalStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        String value = raw.trim();
        // Alias accepted in hand-edited sidecars.
        if ("pending_approval".equalsIgnoreCase(value)) {
            return PENDING;
        }
        for (ApprovalStatus status : values()) {
            if (status.poolName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + raw);
    }
}
