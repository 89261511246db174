package io.taskvault.escalation;

import io.taskvault.config.VaultSettings;
import io.taskvault.executor.ActionExecutor;
import io.taskvault.executor.ActionRequest;
import io.taskvault.executor.ActionResult;
import io.taskvault.executor.TimeLimitedExecution;
import io.taskvault.ingest.TaskNames;
import io.taskvault.model.ActionPayload;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.model.Domain;
import io.taskvault.model.FailureKind;
import io.taskvault.model.TaskRecord;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Three tiers for a failing action.
 * <ol>
 *     <li>Transient failures are retried in place with exponential backoff.</li>
 *     <li>Other failures of non-critical actions requeue the task after a cooldown, up to
 *     {@code max_retries} times.</li>
 *     <li>Everything else is parked in the deferred queue and surfaced as an alert.</li>
 * </ol>
 * Logic failures are never retried and end the ladder in {@link LadderState#FATAL}.
 */
public final class EscalationLadder {
    private static final Logger log = LoggerFactory.getLogger(EscalationLadder.class);
    private static final String ACTOR = "escalation_ladder";

    private final VaultSettings settings;
    private final ErrorClassifier classifier;
    private final BackoffSchedule backoff;
    private final Sleeper sleeper;
    private final TimeLimitedExecution execution;
    private final StateStore store;
    private final DeferredQueue deferredQueue;
    private final AlertWriter alerts;
    private final AuditLog audit;
    private final Clock clock;

    public EscalationLadder(
            VaultSettings settings,
            Sleeper sleeper,
            TimeLimitedExecution execution,
            StateStore store,
            DeferredQueue deferredQueue,
            AlertWriter alerts,
            AuditLog audit,
            Clock clock
    ) {
        this.settings = settings;
        this.classifier = ErrorClassifier.from(settings);
        this.backoff = BackoffSchedule.from(settings);
        this.sleeper = sleeper;
        this.execution = execution;
        this.store = store;
        this.deferredQueue = deferredQueue;
        this.alerts = alerts;
        this.audit = audit;
        this.clock = clock;
    }

    public BackoffSchedule backoff() {
        return backoff;
    }

    /**
     * Runs one action through the ladder. A {@link LadderState#DEFER} outcome has already been
     * written to the deferred queue with its alert; a {@link LadderState#REQUEUE} outcome is
     * applied by the caller through {@link #requeue}, since a task may hold several plans.
     */
    public LadderOutcome run(TaskRecord task, ActionPayload payload, ActionExecutor executor) {
        LadderOutcome outcome = attempt(payload, executor, task.retryCount());
        if (outcome.state() == LadderState.DEFER) {
            DeferredEntry entry = defer(payload, executor.id(), outcome, reasonFor(outcome, task.retryCount(), payload));
            return outcome.withDeferredEntry(entry.id());
        }
        return outcome;
    }

    /**
     * Replays a deferred entry after its alert was approved. Success resolves the entry; a logic
     * failure comes back as {@link LadderState#FATAL} without a new alert; any other failure puts
     * it back in the queue with a fresh alert.
     */
    public LadderOutcome replay(DeferredEntry entry, ActionExecutor executor) {
        Instant now = clock.instant();
        deferredQueue.update(entry.withStatus(DeferredStatus.RETRIED, now));
        LadderOutcome outcome = attempt(entry.payload(), executor, 0);
        if (outcome.succeeded()) {
            deferredQueue.update(entry.withStatus(DeferredStatus.RESOLVED, clock.instant()));
            audit.log(AuditEvent.success(AuditActions.DEFERRED_RESOLUTION, ACTOR, entry.id(),
                    Map.of("status", DeferredStatus.RESOLVED.wireName(), "attempts", outcome.attempts()))
                    .withApproval(ApprovalStatus.APPROVED));
            log.info("Deferred entry {} resolved after replay", entry.id());
            return outcome;
        }
        if (outcome.state() == LadderState.FATAL) {
            // Left open under the same alert; the caller aborts the cycle.
            deferredQueue.update(entry.redeferred(outcome.describeFailure(), entry.alertRef(), clock.instant()));
            audit.log(AuditEvent.fail(AuditActions.DEFERRED_RESOLUTION, ACTOR, entry.id(),
                    Map.of("status", DeferredStatus.DEFERRED.wireName(), "failure_kind", FailureKind.LOGIC.wireName()),
                    outcome.describeFailure()).withApproval(ApprovalStatus.APPROVED));
            log.error("Replay of deferred entry {} hit a logic failure: {}", entry.id(), outcome.describeFailure());
            return outcome;
        }
        DeferredEntry pending = entry.redeferred(outcome.describeFailure(), null, clock.instant());
        String alertId = alerts.raise(pending, "replay failed: " + outcome.describeFailure());
        deferredQueue.update(entry.redeferred(outcome.describeFailure(), alertId, clock.instant()));
        audit.log(AuditEvent.fail(AuditActions.DEFERRED_RESOLUTION, ACTOR, entry.id(),
                Map.of("status", DeferredStatus.DEFERRED.wireName(), "alert", alertId), outcome.describeFailure())
                .withApproval(ApprovalStatus.APPROVED));
        log.warn("Replay of deferred entry {} failed again: {}", entry.id(), outcome.describeFailure());
        return new LadderOutcome(LadderState.DEFER, outcome.attempts(), outcome.failureKind(), outcome.errorClass(),
                outcome.error(), null, entry.id());
    }

    /**
     * Alert rejected: the entry is closed without running the action.
     */
    public DeferredEntry dismiss(DeferredEntry entry) {
        DeferredEntry dismissed = entry.withStatus(DeferredStatus.DISMISSED, clock.instant());
        deferredQueue.update(dismissed);
        audit.log(AuditEvent.success(AuditActions.DEFERRED_RESOLUTION, ACTOR, entry.id(),
                Map.of("status", DeferredStatus.DISMISSED.wireName())).withApproval(ApprovalStatus.REJECTED));
        log.info("Deferred entry {} dismissed", entry.id());
        return dismissed;
    }

    /**
     * Creates the follow-up task for a cooldown requeue. The caller moves the failed task to
     * {@code retry_queued} and archives it.
     */
    public TaskRecord requeue(TaskRecord task, List<Domain> remainingDomains, LadderOutcome failure) {
        Instant now = clock.instant();
        int nextRetry = task.retryCount() + 1;
        String nextName = TaskNames.requeued(task.name(), nextRetry);
        Instant retryAfter = now.plus(settings.requeueCooldown());
        TaskRecord followUp = task.requeue(nextName, remainingDomains, retryAfter, failure.describeFailure(), now);
        store.createTask(followUp, store.readContent(task.name()));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("requeued_as", nextName);
        params.put("retry_count", nextRetry);
        params.put("retry_after", retryAfter.toString());
        params.put("pending_domains", remainingDomains.stream().map(Domain::wireName).toList());
        audit.log(AuditEvent.fail(AuditActions.REQUEUE, ACTOR, task.name(), params, failure.describeFailure()));
        log.warn("Task {} requeued as {} until {}", task.name(), nextName, retryAfter);
        return followUp;
    }

    LadderOutcome attempt(ActionPayload payload, ActionExecutor executor, int retryCount) {
        LadderState state = LadderState.ATTEMPT;
        int attempts = 0;
        int retries = 0;
        ActionResult last = null;
        FailureKind kind = null;
        while (!state.isFinal()) {
            switch (state) {
                case ATTEMPT -> {
                    attempts++;
                    last = execute(executor, payload, attempts);
                    if (last.success()) {
                        auditAttempt(payload, attempts, last, null, null);
                        state = LadderState.SUCCEEDED;
                    } else {
                        kind = classifier.classify(last.errorClass());
                        boolean retry = kind == FailureKind.TRANSIENT && retries < backoff.maxRetries()
                                && !Thread.currentThread().isInterrupted();
                        Duration wait = retry ? backoff.delay(retries) : null;
                        auditAttempt(payload, attempts, last, kind, wait);
                        log.warn("Attempt {} of {} for {} failed ({}): {}", attempts, payload.action(), payload.planId(),
                                kind.wireName(), last.error());
                        state = retry ? LadderState.BACKOFF : escalate(kind, payload, retryCount);
                    }
                }
                case BACKOFF -> {
                    try {
                        sleeper.sleep(backoff.delay(retries));
                        retries++;
                        state = LadderState.ATTEMPT;
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        state = escalate(kind, payload, retryCount);
                    }
                }
                default -> throw new IllegalStateException("Unexpected ladder state " + state);
            }
        }
        if (state == LadderState.SUCCEEDED) {
            return LadderOutcome.succeeded(attempts, last.output());
        }
        return new LadderOutcome(state, attempts, kind, last.errorClass(), last.error(), null, null);
    }

    LadderState escalate(FailureKind kind, ActionPayload payload, int retryCount) {
        return switch (kind) {
            case LOGIC -> LadderState.FATAL;
            case CRITICAL, UNRECOGNIZED -> LadderState.DEFER;
            case TRANSIENT, NON_CRITICAL -> settings.isCriticalAction(payload.action()) || retryCount >= settings.maxRetries()
                    ? LadderState.DEFER
                    : LadderState.REQUEUE;
        };
    }

    private DeferredEntry defer(ActionPayload payload, String service, LadderOutcome outcome, String reason) {
        Instant now = clock.instant();
        String entryId = "DEFERRED_" + payload.planId() + "_" + (deferredQueue.forTask(payload.task()).size() + 1);
        DeferredEntry entry = new DeferredEntry(entryId, payload.action(), service, outcome.describeFailure(), ACTOR,
                payload, now, DeferredStatus.DEFERRED, null, now);
        deferredQueue.append(entry);
        String alertId = alerts.raise(entry, reason);
        DeferredEntry withAlert = entry.redeferred(entry.error(), alertId, now);
        deferredQueue.update(withAlert);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("deferred_entry", entryId);
        params.put("alert", alertId);
        params.put("failure_kind", outcome.failureKind().wireName());
        params.put("reason", reason);
        audit.log(AuditEvent.fail(AuditActions.DEFERRED, ACTOR, payload.task(), params, outcome.describeFailure()));
        audit.log(AuditEvent.success(AuditActions.ALERT_CREATED, ACTOR, alertId, Map.of("deferred_entry", entryId))
                .withApproval(ApprovalStatus.PENDING));
        log.error("Action {} for {} deferred ({}); alert {}", payload.action(), payload.task(), reason, alertId);
        return withAlert;
    }

    private String reasonFor(LadderOutcome outcome, int retryCount, ActionPayload payload) {
        if (outcome.failureKind() == FailureKind.CRITICAL) {
            return "critical error class " + outcome.errorClass();
        }
        if (outcome.failureKind() == FailureKind.UNRECOGNIZED) {
            return "unrecognized error class " + outcome.errorClass();
        }
        if (settings.isCriticalAction(payload.action())) {
            return "critical action " + payload.action();
        }
        return "retry limit reached (" + retryCount + "/" + settings.maxRetries() + "), task abandoned";
    }

    private ActionResult execute(ActionExecutor executor, ActionPayload payload, int attempt) {
        ActionRequest request = new ActionRequest(payload, attempt, settings.executionTimeout());
        try {
            return execution.run(executor, request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ActionResult.fail("timeout", "interrupted while waiting for " + executor.id());
        }
    }

    private void auditAttempt(ActionPayload payload, int attempt, ActionResult result, FailureKind kind, Duration wait) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("attempt", attempt);
        params.put("action", payload.action());
        params.put("plan_id", payload.planId());
        if (!result.success()) {
            params.put("error_class", result.errorClass());
            params.put("failure_kind", kind.wireName());
        }
        if (wait != null) {
            params.put("next_delay_ms", wait.toMillis());
        }
        AuditEvent event = result.success()
                ? AuditEvent.success(AuditActions.EXECUTION_ATTEMPT, ACTOR, payload.task(), params)
                : AuditEvent.fail(AuditActions.EXECUTION_ATTEMPT, ACTOR, payload.task(), params, result.error());
        audit.log(event.withApproval(payload.approvalRef() == null ? null : ApprovalStatus.APPROVED));
    }
}
