package io.taskvault.runtime;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.config.VaultSettings;
import io.taskvault.executor.ActionExecutor;
import io.taskvault.executor.ActionRequest;
import io.taskvault.executor.ActionResult;
import io.taskvault.executor.ExecutorRegistry;
import io.taskvault.executor.OutboxExecutor;
import io.taskvault.ingest.AdmitOutcome;
import io.taskvault.ingest.IncomingItem;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.model.Domain;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.PlanStatus;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.RunLock;
import io.taskvault.storage.RunLockUnavailableException;
import io.taskvault.testing.MutableClock;
import io.taskvault.testing.RecordingSleeper;
import io.taskvault.testing.ScriptedExecutor;
import io.taskvault.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

final class TaskVaultRuntimeTest {
    private static final String WIRE = "Please wire $500 to vendor X, urgent";

    private static TaskVaultRuntime runtime(TaskVaultConfig config, MutableClock clock, ExecutorRegistry registry) {
        TaskVaultRuntime runtime = TaskVaultRuntime.builder(config)
                .settings(VaultSettings.defaults())
                .clock(clock)
                .sleeper(new RecordingSleeper(clock))
                .executors(registry)
                .build();
        runtime.init();
        return runtime;
    }

    private static ExecutorRegistry outboxOnly(TaskVaultConfig config) {
        return new ExecutorRegistry(new OutboxExecutor(config.outboxDir()));
    }

    private static void decide(TaskVaultConfig config, String requestId, ApprovalStatus pool) throws IOException {
        TestFiles.move(config.approvalPool(ApprovalStatus.PENDING).resolve(requestId + ".md"), config.approvalPool(pool));
    }

    @Test
    void urgentWireWaitsForApprovalThenHandsOffPayment() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-wire-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            TaskVaultRuntime runtime = runtime(config, clock, outboxOnly(config));
            String name = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING)).taskName();

            CycleOutcome first = runtime.runCycle();

            Assertions.assertEquals(1, first.processed());
            Assertions.assertEquals(1, first.awaitingApproval());
            TaskRecord routed = runtime.task(name).orElseThrow();
            Assertions.assertEquals(TaskStatus.AWAITING_APPROVAL, routed.status());
            Assertions.assertEquals(Domain.BUSINESS, routed.domain());
            Assertions.assertEquals(Priority.HIGH, routed.priority());
            Assertions.assertEquals("CD-6", routed.ruleApplied());
            Assertions.assertTrue(routed.sensitive());
            PlanRecord plan = runtime.plansFor(routed).get(0);
            Assertions.assertEquals("APPROVAL_PLAN_" + name, plan.approvalRef());
            Path outboxFile = config.outboxDir().resolve("payment").resolve("PLAN_" + name + ".json");
            Assertions.assertFalse(Files.exists(outboxFile));
            String dashboard = Files.readString(config.dashboardFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(dashboard.contains("APPROVAL_PLAN_" + name));

            CycleOutcome undecided = runtime.runCycle();
            Assertions.assertEquals(0, undecided.completed());
            Assertions.assertEquals(TaskStatus.AWAITING_APPROVAL, runtime.task(name).orElseThrow().status());

            decide(config, plan.approvalRef(), ApprovalStatus.APPROVED);
            CycleOutcome approved = runtime.runCycle();

            Assertions.assertEquals(1, approved.completed());
            TaskRecord done = runtime.task(name).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETE, done.status());
            Assertions.assertTrue(runtime.tasks(false).isEmpty());
            Assertions.assertTrue(Files.exists(outboxFile));
            Assertions.assertEquals(PlanStatus.COMPLETE, runtime.plansFor(done).get(0).status());
            Assertions.assertTrue(new AuditLog(config.auditDir(), clock).verify(LocalDate.parse("2026-10-19")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void rejectedRequestNeverExecutes() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-reject-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            TaskVaultRuntime runtime = runtime(config, clock, outboxOnly(config));
            String name = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();

            decide(config, "APPROVAL_PLAN_" + name, ApprovalStatus.REJECTED);
            CycleOutcome outcome = runtime.runCycle();

            Assertions.assertEquals(1, outcome.rejected());
            Assertions.assertEquals(TaskStatus.REJECTED, runtime.task(name).orElseThrow().status());
            Assertions.assertFalse(Files.exists(config.outboxDir().resolve("payment")));

            AdmitOutcome resubmitted = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING));
            Assertions.assertEquals(AdmitOutcome.REASON_ALREADY_PROCESSED, resubmitted.reason());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void splitTaskWaitsForBothDecisionsAndEndsPartial() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-split-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            TaskVaultRuntime runtime = runtime(config, clock, outboxOnly(config));
            String name = runtime.submit(IncomingItem.of("Can you send $50 for the kids school trip",
                    SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();
            Assertions.assertEquals(List.of("PLAN_" + name + "_personal", "PLAN_" + name + "_business"),
                    runtime.task(name).orElseThrow().planRefs());

            decide(config, "APPROVAL_PLAN_" + name + "_personal", ApprovalStatus.APPROVED);
            CycleOutcome halfDecided = runtime.runCycle();
            Assertions.assertEquals(0, halfDecided.partial());
            Assertions.assertEquals(TaskStatus.AWAITING_APPROVAL, runtime.task(name).orElseThrow().status());

            decide(config, "APPROVAL_PLAN_" + name + "_business", ApprovalStatus.REJECTED);
            CycleOutcome decided = runtime.runCycle();

            Assertions.assertEquals(1, decided.partial());
            Assertions.assertEquals(TaskStatus.PARTIAL, runtime.task(name).orElseThrow().status());
            Path messages = config.outboxDir().resolve("send_message");
            Assertions.assertTrue(Files.exists(messages.resolve("PLAN_" + name + "_personal.json")));
            Assertions.assertFalse(Files.exists(messages.resolve("PLAN_" + name + "_business.json")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void transientEmailFailuresRequeueAfterCooldown() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-requeue-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ScriptedExecutor email = new ScriptedExecutor("send_email", clock).failTimes(6, "rate_limit");
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("send_email", email);
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            String content = "Can we move our call to Thursday?";
            String name = runtime.submit(IncomingItem.of(content, SourceTag.EXTERNAL_EMAIL)).taskName();
            runtime.runCycle();
            decide(config, "APPROVAL_PLAN_" + name, ApprovalStatus.APPROVED);
            clock.advance(Duration.ofMinutes(1));

            CycleOutcome failing = runtime.runCycle();

            Assertions.assertEquals(1, failing.requeued());
            Assertions.assertEquals(6, email.calls());
            TaskRecord original = runtime.task(name).orElseThrow();
            Assertions.assertEquals(TaskStatus.RETRY_QUEUED, original.status());
            Assertions.assertEquals(name + "_R1", original.requeuedAs());
            TaskRecord followUp = runtime.task(name + "_R1").orElseThrow();
            Assertions.assertEquals(TaskStatus.RETRY_QUEUED, followUp.status());
            Assertions.assertEquals(1, followUp.retryCount());
            Assertions.assertEquals(email.calledAt().get(5).plus(Duration.ofHours(1)), followUp.retryAfter());
            Assertions.assertEquals(List.of(TaskStatus.RETRY_QUEUED),
                    runtime.tasks(false).stream().map(TaskRecord::status).toList());
            Assertions.assertTrue(runtime.deferredEntries().isEmpty());

            AdmitOutcome duplicate = runtime.submit(IncomingItem.of(content, SourceTag.EXTERNAL_EMAIL));
            Assertions.assertEquals(AdmitOutcome.REASON_IN_FLIGHT, duplicate.reason());
            Assertions.assertEquals(followUp.name(), duplicate.taskName());

            clock.advance(Duration.ofMinutes(30));
            Assertions.assertEquals(0, runtime.runCycle().releasedFromCooldown());
            Assertions.assertEquals(TaskStatus.RETRY_QUEUED, runtime.task(followUp.name()).orElseThrow().status());

            clock.advance(Duration.ofMinutes(31));
            CycleOutcome released = runtime.runCycle();
            Assertions.assertEquals(1, released.releasedFromCooldown());
            Assertions.assertEquals(TaskStatus.AWAITING_APPROVAL, runtime.task(followUp.name()).orElseThrow().status());

            decide(config, "APPROVAL_PLAN_" + followUp.name(), ApprovalStatus.APPROVED);
            CycleOutcome retried = runtime.runCycle();

            Assertions.assertEquals(1, retried.completed());
            Assertions.assertEquals(7, email.calls());
            Assertions.assertEquals(TaskStatus.COMPLETE, runtime.task(followUp.name()).orElseThrow().status());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void criticalFailureDefersUntilAlertApproved() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-defer-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ScriptedExecutor payment = new ScriptedExecutor("payment", clock).failTimes(1, "service_outage");
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("payment", payment);
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            String name = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();
            decide(config, "APPROVAL_PLAN_" + name, ApprovalStatus.APPROVED);

            CycleOutcome failing = runtime.runCycle();

            Assertions.assertEquals(1, failing.deferred());
            Assertions.assertEquals(TaskStatus.DEFERRED, runtime.task(name).orElseThrow().status());
            DeferredEntry entry = runtime.deferredEntries().get(0);
            Assertions.assertEquals("PLAN_" + name, entry.payload().planId());
            Assertions.assertEquals(WIRE, entry.payload().content());
            Assertions.assertEquals(DeferredStatus.DEFERRED, entry.status());
            Assertions.assertTrue(Files.exists(config.approvalPool(ApprovalStatus.PENDING).resolve(entry.alertRef() + ".md")));

            decide(config, entry.alertRef(), ApprovalStatus.APPROVED);
            CycleOutcome replayed = runtime.runCycle();

            Assertions.assertEquals(1, replayed.alertsResolved());
            Assertions.assertEquals(1, replayed.completed());
            Assertions.assertEquals(2, payment.calls());
            Assertions.assertEquals(DeferredStatus.RESOLVED, runtime.deferredEntries().get(0).status());
            Assertions.assertEquals(TaskStatus.COMPLETE, runtime.task(name).orElseThrow().status());
            Assertions.assertTrue(runtime.tasks(false).isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void dismissedAlertArchivesTaskAsDeferred() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-dismiss-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ScriptedExecutor payment = new ScriptedExecutor("payment", clock).failTimes(1, "auth_failure");
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("payment", payment);
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            String name = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();
            decide(config, "APPROVAL_PLAN_" + name, ApprovalStatus.APPROVED);
            runtime.runCycle();
            String alertId = runtime.deferredEntries().get(0).alertRef();

            decide(config, alertId, ApprovalStatus.REJECTED);
            CycleOutcome outcome = runtime.runCycle();

            Assertions.assertEquals(1, outcome.alertsDismissed());
            Assertions.assertEquals(1, payment.calls());
            Assertions.assertEquals(DeferredStatus.DISMISSED, runtime.deferredEntries().get(0).status());
            Assertions.assertEquals(TaskStatus.DEFERRED, runtime.task(name).orElseThrow().status());
            Assertions.assertTrue(runtime.tasks(false).isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void deferredHalfOfMixedSplitSettlesPartial() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-split-defer-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ScriptedExecutor messages = new ScriptedExecutor("send_message", clock).failTimes(1, "auth_failure");
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("send_message", messages);
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            String name = runtime.submit(IncomingItem.of("Can you send $50 for the kids school trip",
                    SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();
            decide(config, "APPROVAL_PLAN_" + name + "_personal", ApprovalStatus.APPROVED);
            decide(config, "APPROVAL_PLAN_" + name + "_business", ApprovalStatus.REJECTED);

            CycleOutcome failing = runtime.runCycle();
            Assertions.assertEquals(1, failing.deferred());
            Assertions.assertEquals(TaskStatus.DEFERRED, runtime.task(name).orElseThrow().status());

            decide(config, runtime.deferredEntries().get(0).alertRef(), ApprovalStatus.APPROVED);
            CycleOutcome replayed = runtime.runCycle();

            Assertions.assertEquals(1, replayed.alertsResolved());
            Assertions.assertEquals(1, replayed.partial());
            Assertions.assertEquals(0, replayed.completed());
            Assertions.assertEquals(2, messages.calls());
            Assertions.assertEquals(TaskStatus.PARTIAL, runtime.task(name).orElseThrow().status());
            Assertions.assertTrue(runtime.tasks(false).isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void logicFailureDuringReplayAbortsTheCycle() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-replay-logic-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ScriptedExecutor payment = new ScriptedExecutor("payment", clock)
                    .failTimes(1, "service_outage")
                    .failTimes(1, "validation");
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("payment", payment);
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            String name = runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING)).taskName();
            runtime.runCycle();
            decide(config, "APPROVAL_PLAN_" + name, ApprovalStatus.APPROVED);
            runtime.runCycle();
            DeferredEntry entry = runtime.deferredEntries().get(0);
            decide(config, entry.alertRef(), ApprovalStatus.APPROVED);

            Assertions.assertThrows(TaskVaultLogicException.class, runtime::runCycle);

            Assertions.assertEquals(2, payment.calls());
            DeferredEntry after = runtime.deferredEntries().get(0);
            Assertions.assertEquals(DeferredStatus.DEFERRED, after.status());
            Assertions.assertEquals(entry.alertRef(), after.alertRef());
            Assertions.assertEquals(1, runtime.deferredEntries().size());
            Assertions.assertEquals(TaskStatus.DEFERRED, runtime.task(name).orElseThrow().status());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void inboxFileRunsStraightThroughWhenNotSensitive() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-inbox-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            TaskVaultRuntime runtime = runtime(config, clock, outboxOnly(config));
            Files.writeString(config.inboxDir().resolve("note.txt"), "Water the plants", StandardCharsets.UTF_8);

            CycleOutcome outcome = runtime.runCycle();

            Assertions.assertEquals(1, outcome.admitted());
            Assertions.assertEquals(1, outcome.processed());
            Assertions.assertEquals(1, outcome.completed());
            Assertions.assertEquals(0, outcome.awaitingApproval());
            TaskRecord task = runtime.tasks(true).get(0);
            Assertions.assertEquals(TaskStatus.COMPLETE, task.status());
            Assertions.assertTrue(Files.exists(config.outboxDir().resolve("process_task").resolve("PLAN_" + task.name() + ".json")));
            Assertions.assertTrue(runtime.approvals().isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void logicFailureAbortsTheCycle() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-logic-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("process_task", new ScriptedExecutor("process_task", clock).failTimes(1, "validation"));
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            runtime.submit(IncomingItem.of("Water the plants", SourceTag.INBOX));

            Assertions.assertThrows(TaskVaultLogicException.class, runtime::runCycle);
            try (RunLock lock = RunLock.acquire(config.lockFile())) {
                Assertions.assertTrue(lock.isHeld());
            }
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void cancelStopsBeforeTheNextTask() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-cancel-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            AtomicReference<TaskVaultRuntime> holder = new AtomicReference<>();
            ExecutorRegistry registry = outboxOnly(config);
            registry.register("process_task", new ActionExecutor() {
                @Override
                public String id() {
                    return "cancelling";
                }

                @Override
                public ActionResult execute(ActionRequest request) {
                    holder.get().requestCancel();
                    return ActionResult.ok("done");
                }
            });
            TaskVaultRuntime runtime = runtime(config, clock, registry);
            holder.set(runtime);
            String first = runtime.submit(IncomingItem.of("Water the plants", SourceTag.INBOX)).taskName();
            clock.advance(Duration.ofSeconds(1));
            String second = runtime.submit(IncomingItem.of("Fold the laundry", SourceTag.INBOX)).taskName();

            CycleOutcome outcome = runtime.runCycle();

            Assertions.assertTrue(outcome.cancelled());
            Assertions.assertEquals(1, outcome.processed());
            Assertions.assertEquals(TaskStatus.COMPLETE, runtime.task(first).orElseThrow().status());
            Assertions.assertEquals(TaskStatus.PENDING, runtime.task(second).orElseThrow().status());
            Assertions.assertTrue(Files.exists(config.dashboardFile()));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void heldLockRejectsCycleAndDashboardRebuilds() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-runtime-lock-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            TaskVaultRuntime runtime = runtime(config, clock, outboxOnly(config));
            runtime.submit(IncomingItem.of(WIRE, SourceTag.BUSINESS_MESSAGING));

            try (RunLock ignored = RunLock.acquire(config.lockFile())) {
                Assertions.assertThrows(RunLockUnavailableException.class, runtime::runCycle);
                Assertions.assertThrows(RunLockUnavailableException.class,
                        () -> runtime.submit(IncomingItem.of("Water the plants", SourceTag.INBOX)));
            }

            runtime.runCycle();
            Files.delete(config.dashboardFile());
            runtime.rebuildDashboard();

            String dashboard = Files.readString(config.dashboardFile(), StandardCharsets.UTF_8);
            Assertions.assertTrue(dashboard.startsWith("# TaskVault Dashboard"));
            Assertions.assertTrue(dashboard.contains("| awaiting_approval | 1 |"));
            Assertions.assertTrue(runtime.renderDashboard().contains("## Awaiting approval"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
