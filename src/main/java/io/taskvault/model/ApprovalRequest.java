package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Human checkpoint record. {@code status} reflects the value at creation time; the
 * authoritative status is whichever pool the artifact currently sits in.
 */
public record ApprovalRequest(
        @JsonProperty("id") String id,
        @JsonProperty("action") String action,
        @JsonProperty("source_task") String sourceTask,
        @JsonProperty("plan_ref") String planRef,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("status") ApprovalStatus status,
        @JsonProperty("draft_content") String draftContent,
        @JsonProperty("risk_table") List<RiskRow> riskTable,
        @JsonProperty("deferred_entry_id") String deferredEntryId,
        @JsonProperty("created_at") Instant createdAt
) {
    public static final String CRITICAL_FAILURE_ACTION = "critical_failure";

    public ApprovalRequest {
        riskTable = riskTable == null ? List.of() : List.copyOf(riskTable);
    }

    public boolean isAlert() {
        return deferredEntryId != null && !deferredEntryId.isBlank();
    }

    public ApprovalRequest observedAs(ApprovalStatus observed) {
        return new ApprovalRequest(id, action, sourceTask, planRef, priority, observed, draftContent, riskTable,
                deferredEntryId, createdAt);
    }
}
