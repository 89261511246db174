package io.taskvault.approval;

import io.taskvault.model.ApprovalRequest;

import java.util.List;

public record ApprovalPollResult(List<ApprovalRequest> approved, List<ApprovalRequest> rejected) {
    public ApprovalPollResult {
        approved = List.copyOf(approved);
        rejected = List.copyOf(rejected);
    }
}
