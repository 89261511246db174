package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record DeferredEntry(
        @JsonProperty("id") String id,
        @JsonProperty("action") String action,
        @JsonProperty("service") String service,
        @JsonProperty("error") String error,
        @JsonProperty("actor") String actor,
        @JsonProperty("payload") ActionPayload payload,
        @JsonProperty("queued_at") Instant queuedAt,
        @JsonProperty("status") DeferredStatus status,
        @JsonProperty("alert_ref") String alertRef,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public DeferredEntry withStatus(DeferredStatus next, Instant now) {
        return new DeferredEntry(id, action, service, error, actor, payload, queuedAt, next, alertRef, now);
    }

    public DeferredEntry redeferred(String nextError, String nextAlertRef, Instant now) {
        return new DeferredEntry(id, action, service, nextError, actor, payload, queuedAt, DeferredStatus.DEFERRED, nextAlertRef, now);
    }
}
