package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Sidecar of a task. The raw content lives next to it in {@code <name>.md}; the sidecar
 * is {@code <name>.md.meta.json}.
 */
public record TaskRecord(
        @JsonProperty("name") String name,
        @JsonProperty("dedup_key") String dedupKey,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("source") SourceTag source,
        @JsonProperty("domain") Domain domain,
        @JsonProperty("sensitive") boolean sensitive,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("category") String category,
        @JsonProperty("rule_applied") String ruleApplied,
        @JsonProperty("retry_count") int retryCount,
        @JsonProperty("retry_after") Instant retryAfter,
        @JsonProperty("plan_refs") List<String> planRefs,
        @JsonProperty("pending_domains") List<Domain> pendingDomains,
        @JsonProperty("original_task") String originalTask,
        @JsonProperty("requeued_as") String requeuedAs,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("metadata") Map<String, String> metadata,
        @JsonProperty("received_at") Instant receivedAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public TaskRecord {
        planRefs = planRefs == null ? List.of() : List.copyOf(planRefs);
        pendingDomains = pendingDomains == null ? List.of() : List.copyOf(pendingDomains);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        priority = priority == null ? Priority.MEDIUM : priority;
        if (retryCount < 0) {
            throw new IllegalArgumentException("retry_count cannot be negative: " + retryCount);
        }
    }

    public static TaskRecord admitted(String name, String dedupKey, SourceTag source, Map<String, String> metadata, Instant now) {
        return new TaskRecord(name, dedupKey, TaskStatus.PENDING, source, null, false, Priority.MEDIUM, null, null,
                0, null, List.of(), List.of(), null, null, null, metadata, now, now);
    }

    public TaskRecord withStatus(TaskStatus next, Instant now) {
        return new TaskRecord(name, dedupKey, next, source, domain, sensitive, priority, category, ruleApplied,
                retryCount, retryAfter, planRefs, pendingDomains, originalTask, requeuedAs, lastError, metadata, receivedAt, now);
    }

    public TaskRecord withRouting(Domain nextDomain, boolean nextSensitive, Priority nextPriority, String nextCategory,
                                  String nextRule, List<String> nextPlanRefs, Instant now) {
        return new TaskRecord(name, dedupKey, status, source, nextDomain, nextSensitive, nextPriority, nextCategory, nextRule,
                retryCount, retryAfter, nextPlanRefs, pendingDomains, originalTask, requeuedAs, lastError, metadata, receivedAt, now);
    }

    public TaskRecord withRequeuedAs(String nextName, String error, Instant now) {
        return new TaskRecord(name, dedupKey, status, source, domain, sensitive, priority, category, ruleApplied,
                retryCount, retryAfter, planRefs, pendingDomains, originalTask, nextName, error, metadata, receivedAt, now);
    }

    public TaskRecord withLastError(String error, Instant now) {
        return new TaskRecord(name, dedupKey, status, source, domain, sensitive, priority, category, ruleApplied,
                retryCount, retryAfter, planRefs, pendingDomains, originalTask, requeuedAs, error, metadata, receivedAt, now);
    }

    /**
     * Builds the follow-up task created by a cooldown requeue. It keeps the dedup key so
     * the same content cannot be admitted again while the retry is outstanding.
     */
    public TaskRecord requeue(String nextName, List<Domain> remainingDomains, Instant retryAt, String error, Instant now) {
        return new TaskRecord(nextName, dedupKey, TaskStatus.RETRY_QUEUED, source, domain, sensitive, priority, category,
                ruleApplied, retryCount + 1, retryAt, List.of(), remainingDomains, name, null, error, metadata, now, now);
    }

    public boolean coolingDown(Instant now) {
        return status == TaskStatus.RETRY_QUEUED && retryAfter != null && now.isBefore(retryAfter);
    }
}
