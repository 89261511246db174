package io.taskvault.dashboard;

import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ChecklistItem;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditEntry;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Renders {@code dashboard.md}. The file is replaced atomically and can be deleted at any
 * time; the next cycle rebuilds it.
 */
public final class DashboardRenderer {
    static final int TARGET_WIDTH = 45;

    public String render(DashboardView view) {
        StringBuilder sb = new StringBuilder();
        sb.append("# TaskVault Dashboard\n\n");
        sb.append("_Generated ").append(view.generatedAt()).append("_\n\n");

        sb.append("## Summary\n\n");
        sb.append("| Status | Active tasks |\n");
        sb.append("|--------|--------------|\n");
        for (TaskStatus status : TaskStatus.values()) {
            Integer count = view.activeCounts().get(status);
            if (count != null) {
                sb.append("| ").append(status.wireName()).append(" | ").append(count).append(" |\n");
            }
        }
        sb.append("| open deferred entries | ").append(view.openDeferredEntries().size()).append(" |\n\n");

        section(sb, "Pending", view.pending().isEmpty());
        for (TaskRecord task : view.pending()) {
            sb.append("- `").append(task.name()).append("` from ").append(task.source().wireName())
                    .append(", received ").append(task.receivedAt()).append('\n');
        }

        section(sb, "Awaiting approval", view.pendingApprovals().isEmpty());
        for (ApprovalRequest request : view.pendingApprovals()) {
            sb.append("- `").append(request.id()).append("` ").append(request.action())
                    .append(" for `").append(request.sourceTask()).append("` (").append(request.priority().wireName())
                    .append(request.isAlert() ? ", alert" : "").append(")\n");
        }

        section(sb, "Retry queued", view.retryQueued().isEmpty());
        for (TaskRecord task : view.retryQueued()) {
            boolean cooling = task.coolingDown(view.generatedAt());
            sb.append("- `").append(task.name()).append("` retry ").append(task.retryCount())
                    .append(", retry after ").append(task.retryAfter())
                    .append(cooling ? " (cooling down)" : " (ready)").append('\n');
        }

        section(sb, "Deferred", view.openDeferredEntries().isEmpty() && view.deferredTasks().isEmpty());
        for (DeferredEntry entry : view.openDeferredEntries()) {
            sb.append("- `").append(entry.id()).append("` ").append(entry.action())
                    .append(" for `").append(entry.payload().task()).append("`: ").append(entry.error())
                    .append(" (").append(entry.status().wireName())
                    .append(entry.alertRef() == null ? "" : ", alert `" + entry.alertRef() + "`").append(")\n");
        }
        for (TaskRecord task : view.deferredTasks()) {
            sb.append("- task `").append(task.name()).append("` deferred since ").append(task.updatedAt()).append('\n');
        }

        section(sb, "Open plans", view.openPlans().isEmpty());
        if (!view.openPlans().isEmpty()) {
            sb.append("| Plan | Domain | Priority | Checklist |\n");
            sb.append("|------|--------|----------|-----------|\n");
            for (PlanRecord plan : view.openPlans()) {
                long done = plan.checklist().stream().filter(ChecklistItem::done).count();
                sb.append("| ").append(truncate(plan.id())).append(" | ").append(plan.domain().wireName())
                        .append(" | ").append(plan.priority().wireName())
                        .append(" | ").append(done).append('/').append(plan.checklist().size()).append(" |\n");
            }
        }

        section(sb, "Completed", view.completed().isEmpty());
        for (TaskRecord task : view.completed()) {
            sb.append("- `").append(task.name()).append("` ").append(task.status().wireName())
                    .append(" at ").append(task.updatedAt()).append('\n');
        }

        section(sb, "Recent activity", view.recentActivity().isEmpty());
        if (!view.recentActivity().isEmpty()) {
            sb.append(auditTable(view.recentActivity()));
        }
        return sb.toString();
    }

    public void write(DashboardView view, Path target) {
        try {
            Jsons.writeStringAtomically(target, render(view));
        } catch (IOException e) {
            throw new StateStoreException("Failed to write dashboard: " + target, e);
        }
    }

    static String auditTable(List<AuditEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append("| Timestamp | Action Type | Actor | Target | Approval | Result |\n");
        sb.append("|-----------|-------------|-------|--------|----------|--------|\n");
        for (AuditEntry entry : entries) {
            sb.append("| ").append(format(entry.timestamp()))
                    .append(" | ").append(entry.actionType())
                    .append(" | ").append(entry.actor())
                    .append(" | ").append(truncate(entry.target()))
                    .append(" | ").append(entry.approvalStatus())
                    .append(" | ").append(entry.result())
                    .append(" |\n");
        }
        return sb.toString();
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= TARGET_WIDTH) {
            return value;
        }
        return value.substring(0, TARGET_WIDTH - 3) + "...";
    }

    private static String format(Instant instant) {
        return instant == null ? "" : instant.toString();
    }

    private static void section(StringBuilder sb, String title, boolean empty) {
        sb.append("\n## ").append(title).append("\n\n");
        if (empty) {
            sb.append("_None_\n");
        }
    }
}
