package io.taskvault.approval;

import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.RiskRow;

final class ApprovalMarkdown {
    private ApprovalMarkdown() {
    }

    static String render(ApprovalRequest request) {
        StringBuilder sb = new StringBuilder();
        sb.append("---\n");
        sb.append("id: ").append(request.id()).append('\n');
        sb.append("action: ").append(request.action()).append('\n');
        sb.append("source_task: ").append(nullToDash(request.sourceTask())).append('\n');
        sb.append("plan_ref: ").append(nullToDash(request.planRef())).append('\n');
        sb.append("priority: ").append(request.priority().wireName()).append('\n');
        sb.append("status: ").append(request.status().poolName()).append('\n');
        if (request.isAlert()) {
            sb.append("deferred_entry_id: ").append(request.deferredEntryId()).append('\n');
        }
        sb.append("created: ").append(request.createdAt()).append('\n');
        sb.append("---\n\n");

        if (request.isAlert()) {
            sb.append("# Critical failure: action deferred\n\n");
        } else {
            sb.append("# Approval required: ").append(request.action()).append("\n\n");
        }
        sb.append("## Details\n\n").append(request.draftContent() == null ? "" : request.draftContent()).append("\n\n");

        if (!request.riskTable().isEmpty()) {
            sb.append("## Risk assessment\n\n");
            sb.append("| Risk | Level | Notes |\n");
            sb.append("|------|-------|-------|\n");
            for (RiskRow row : request.riskTable()) {
                sb.append("| ").append(row.risk()).append(" | ").append(row.level()).append(" | ")
                        .append(row.notes() == null ? "" : row.notes().replace("|", "/")).append(" |\n");
            }
            sb.append('\n');
        }

        sb.append("## To decide\n\n");
        if (request.isAlert()) {
            sb.append("- Move this file to `approvals/approved/` to retry the action.\n");
            sb.append("- Move this file to `approvals/rejected/` to dismiss it.\n");
        } else {
            sb.append("- Move this file to `approvals/approved/` to approve.\n");
            sb.append("- Move this file to `approvals/rejected/` to reject.\n");
        }
        return sb.toString();
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
