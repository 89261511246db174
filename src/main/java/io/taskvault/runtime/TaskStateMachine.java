package io.taskvault.runtime;

import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Owns task status changes. Each transition writes the sidecar first and then exactly one
 * {@code status_transition} audit entry.
 */
public final class TaskStateMachine {
    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);
    private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED = new EnumMap<>(TaskStatus.class);

    static {
        ALLOWED.put(TaskStatus.PENDING, EnumSet.of(TaskStatus.PROCESSING));
        ALLOWED.put(TaskStatus.PROCESSING, EnumSet.of(TaskStatus.AWAITING_APPROVAL, TaskStatus.READY_TO_EXECUTE));
        ALLOWED.put(TaskStatus.AWAITING_APPROVAL, EnumSet.of(TaskStatus.COMPLETE, TaskStatus.REJECTED,
                TaskStatus.PARTIAL, TaskStatus.RETRY_QUEUED, TaskStatus.DEFERRED));
        ALLOWED.put(TaskStatus.READY_TO_EXECUTE, EnumSet.of(TaskStatus.COMPLETE, TaskStatus.PARTIAL,
                TaskStatus.RETRY_QUEUED, TaskStatus.DEFERRED));
        ALLOWED.put(TaskStatus.RETRY_QUEUED, EnumSet.of(TaskStatus.PENDING));
        ALLOWED.put(TaskStatus.DEFERRED, EnumSet.of(TaskStatus.COMPLETE, TaskStatus.PARTIAL));
        ALLOWED.put(TaskStatus.COMPLETE, EnumSet.noneOf(TaskStatus.class));
        ALLOWED.put(TaskStatus.REJECTED, EnumSet.noneOf(TaskStatus.class));
        ALLOWED.put(TaskStatus.PARTIAL, EnumSet.noneOf(TaskStatus.class));
    }

    private final StateStore store;
    private final AuditLog audit;
    private final Clock clock;

    public TaskStateMachine(StateStore store, AuditLog audit, Clock clock) {
        this.store = store;
        this.audit = audit;
        this.clock = clock;
    }

    public static boolean canTransition(TaskStatus from, TaskStatus to) {
        return ALLOWED.getOrDefault(from, Set.of()).contains(to);
    }

    public TaskRecord transition(TaskRecord task, TaskStatus to, String reason) {
        TaskStatus from = task.status();
        if (!canTransition(from, to)) {
            throw new IllegalStateException("Illegal task transition " + from.wireName() + " -> " + to.wireName()
                    + " for " + task.name());
        }
        TaskRecord next = task.withStatus(to, clock.instant());
        store.saveTask(next);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("from", from.wireName());
        params.put("to", to.wireName());
        if (reason != null) {
            params.put("reason", reason);
        }
        audit.log(AuditEvent.success(AuditActions.STATUS_TRANSITION, "state_machine", task.name(), params));
        log.info("Task {} {} -> {}", task.name(), from.wireName(), to.wireName());
        return next;
    }

    /**
     * Moves a finished task out of the active set. Terminal statuses, dismissed deferrals and
     * tasks handed over to a requeued follow-up are the only ones that may leave.
     */
    public TaskRecord archive(TaskRecord task, String reason) {
        TaskStatus status = task.status();
        if (!status.isTerminal() && status != TaskStatus.DEFERRED && status != TaskStatus.RETRY_QUEUED) {
            throw new IllegalStateException("Cannot archive task in status " + status.wireName() + ": " + task.name());
        }
        TaskRecord archived = store.archive(task.withStatus(status, clock.instant()));
        audit.log(AuditEvent.success(AuditActions.ARCHIVE, "state_machine", task.name(),
                Map.of("status", status.wireName(), "reason", reason == null ? "" : reason)));
        return archived;
    }
}
