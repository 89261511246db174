package io.taskvault.dashboard;

import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read model folded from the state store and the audit log. Holds no state of its own.
 */
public record DashboardView(
        Instant generatedAt,
        Map<TaskStatus, Integer> activeCounts,
        List<TaskRecord> pending,
        List<TaskRecord> awaitingApproval,
        List<ApprovalRequest> pendingApprovals,
        List<TaskRecord> retryQueued,
        List<TaskRecord> deferredTasks,
        List<DeferredEntry> openDeferredEntries,
        List<PlanRecord> openPlans,
        List<TaskRecord> completed,
        List<AuditEntry> recentActivity
) {
    public DashboardView {
        activeCounts = Map.copyOf(activeCounts);
        pending = List.copyOf(pending);
        awaitingApproval = List.copyOf(awaitingApproval);
        pendingApprovals = List.copyOf(pendingApprovals);
        retryQueued = List.copyOf(retryQueued);
        deferredTasks = List.copyOf(deferredTasks);
        openDeferredEntries = List.copyOf(openDeferredEntries);
        openPlans = List.copyOf(openPlans);
        completed = List.copyOf(completed);
        recentActivity = List.copyOf(recentActivity);
    }
}
