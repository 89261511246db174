package io.taskvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Everything needed to perform an action without consulting the task it came from.
 */
public record ActionPayload(
        @JsonProperty("action") String action,
        @JsonProperty("task") String task,
        @JsonProperty("plan_id") String planId,
        @JsonProperty("domain") Domain domain,
        @JsonProperty("source") SourceTag source,
        @JsonProperty("category") String category,
        @JsonProperty("priority") Priority priority,
        @JsonProperty("sensitive") boolean sensitive,
        @JsonProperty("content") String content,
        @JsonProperty("approval_ref") String approvalRef
) {
}
