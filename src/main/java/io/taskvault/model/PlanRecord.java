package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record PlanRecord(
        @JsonProperty("id") String id,
        @JsonProperty("task") String task,
        @JsonProperty("domain") Domain domain,
        @JsonProperty("category") String category,
        @JsonProperty("source") SourceTag source,
        @JsonProperty("sensitive") boolean sensitive,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("rule_applied") String ruleApplied,
        @JsonProperty("status") PlanStatus status,
        @JsonProperty("checklist") List<ChecklistItem> checklist,
        @JsonProperty("original_content") String originalContent,
        @JsonProperty("agent_notes") String agentNotes,
        @JsonProperty("approval_ref") String approvalRef,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public PlanRecord {
        checklist = checklist == null ? List.of() : List.copyOf(checklist);
    }

    public PlanRecord withStatus(PlanStatus next, Instant now) {
        return new PlanRecord(id, task, domain, category, source, sensitive, priority, ruleApplied, next, checklist,
                originalContent, agentNotes, approvalRef, createdAt, now);
    }

    public PlanRecord withApprovalRef(String ref, Instant now) {
        return new PlanRecord(id, task, domain, category, source, sensitive, priority, ruleApplied, status, checklist,
                originalContent, agentNotes, ref, createdAt, now);
    }

    public PlanRecord withNotes(String notes, Instant now) {
        return new PlanRecord(id, task, domain, category, source, sensitive, priority, ruleApplied, status, checklist,
                originalContent, notes, approvalRef, createdAt, now);
    }

    public PlanRecord withChecklistDone(String prefix, Instant now) {
        List<ChecklistItem> updated = checklist.stream()
                .map(item -> item.text().startsWith(prefix) ? item.markDone() : item)
                .toList();
        return new PlanRecord(id, task, domain, category, source, sensitive, priority, ruleApplied, status, updated,
                originalContent, agentNotes, approvalRef, createdAt, now);
    }
}
