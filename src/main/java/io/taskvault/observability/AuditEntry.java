package io.taskvault.observability;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"timestamp", "action_type", "actor", "target", "parameters", "approval_status", "result", "error", "prev_hash", "hash"})
public record AuditEntry(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("action_type") String actionType,
        @JsonProperty("actor") String actor,
        @JsonProperty("target") String target,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("approval_status") String approvalStatus,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash
) {
    public AuditEntry {
        parameters = parameters == null ? Map.of() : parameters;
    }

    AuditEntry withoutHash() {
        return new AuditEntry(timestamp, actionType, actor, target, parameters, approvalStatus, result, error, prevHash, null);
    }

    AuditEntry withHash(String rowHash) {
        return new AuditEntry(timestamp, actionType, actor, target, parameters, approvalStatus, result, error, prevHash, rowHash);
    }
}
