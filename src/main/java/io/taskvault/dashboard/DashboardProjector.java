package io.taskvault.dashboard;

import io.taskvault.approval.ApprovalGate;
import io.taskvault.escalation.DeferredQueue;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.PlanStatus;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class DashboardProjector {
    private final StateStore store;
    private final ApprovalGate gate;
    private final DeferredQueue deferredQueue;
    private final AuditLog audit;
    private final int recentLimit;
    private final Clock clock;

    public DashboardProjector(StateStore store, ApprovalGate gate, DeferredQueue deferredQueue, AuditLog audit,
                              int recentLimit, Clock clock) {
        this.store = store;
        this.gate = gate;
        this.deferredQueue = deferredQueue;
        this.audit = audit;
        this.recentLimit = recentLimit;
        this.clock = clock;
    }

    public DashboardView project() {
        List<TaskRecord> active = store.listActive();
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskRecord task : active) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        List<DeferredEntry> openEntries = deferredQueue.list().stream()
                .filter(entry -> entry.status() == DeferredStatus.DEFERRED || entry.status() == DeferredStatus.RETRIED)
                .toList();
        List<PlanRecord> openPlans = store.listPlans().stream()
                .filter(plan -> plan.status() == PlanStatus.OPEN)
                .toList();
        List<TaskRecord> completed = store.listArchived().stream()
                .filter(task -> task.status() != TaskStatus.RETRY_QUEUED)
                .sorted(Comparator.comparing(TaskRecord::updatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .limit(recentLimit)
                .toList();
        return new DashboardView(
                clock.instant(),
                counts,
                byStatus(active, TaskStatus.PENDING),
                byStatus(active, TaskStatus.AWAITING_APPROVAL),
                gate.pending(),
                byStatus(active, TaskStatus.RETRY_QUEUED),
                byStatus(active, TaskStatus.DEFERRED),
                openEntries,
                openPlans,
                completed,
                audit.recent(recentLimit)
        );
    }

    private static List<TaskRecord> byStatus(List<TaskRecord> tasks, TaskStatus status) {
        return tasks.stream().filter(task -> task.status() == status).toList();
    }
}
