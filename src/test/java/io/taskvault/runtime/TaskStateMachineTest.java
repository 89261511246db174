package io.taskvault.runtime;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.Domain;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.PlanStatus;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEntry;
import io.taskvault.observability.AuditLog;
import io.taskvault.storage.StateStore;
import io.taskvault.testing.MutableClock;
import io.taskvault.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

final class TaskStateMachineTest {

    @Test
    void transitionTableMatchesLifecycle() {
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.PENDING, TaskStatus.PROCESSING));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.PROCESSING, TaskStatus.AWAITING_APPROVAL));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.AWAITING_APPROVAL, TaskStatus.PARTIAL));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.READY_TO_EXECUTE, TaskStatus.DEFERRED));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.RETRY_QUEUED, TaskStatus.PENDING));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.DEFERRED, TaskStatus.COMPLETE));
        Assertions.assertTrue(TaskStateMachine.canTransition(TaskStatus.DEFERRED, TaskStatus.PARTIAL));

        Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.PENDING, TaskStatus.COMPLETE));
        Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.READY_TO_EXECUTE, TaskStatus.REJECTED));
        Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.DEFERRED, TaskStatus.PENDING));
        for (TaskStatus to : TaskStatus.values()) {
            Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.COMPLETE, to));
            Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.REJECTED, to));
            Assertions.assertFalse(TaskStateMachine.canTransition(TaskStatus.PARTIAL, to));
        }
    }

    @Test
    void transitionPersistsThenAuditsOnce() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-fsm-");
        try {
            MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            StateStore store = new StateStore(config);
            store.init();
            AuditLog audit = new AuditLog(config.auditDir(), clock);
            TaskStateMachine machine = new TaskStateMachine(store, audit, clock);
            TaskRecord task = TaskRecord.admitted("INBOX_A", "inbox:a", SourceTag.INBOX, Map.of(), clock.instant());
            store.createTask(task, "x");

            TaskRecord processing = machine.transition(task, TaskStatus.PROCESSING, "classified");

            Assertions.assertEquals(TaskStatus.PROCESSING, store.findActive("INBOX_A").orElseThrow().status());
            List<AuditEntry> entries = audit.recent(10);
            Assertions.assertEquals(1, entries.size());
            Assertions.assertEquals(AuditActions.STATUS_TRANSITION, entries.get(0).actionType());
            Assertions.assertEquals("pending", entries.get(0).parameters().get("from"));
            Assertions.assertEquals("processing", entries.get(0).parameters().get("to"));

            Assertions.assertThrows(IllegalStateException.class,
                    () -> machine.transition(processing, TaskStatus.COMPLETE, "skip ahead"));
            Assertions.assertThrows(IllegalStateException.class, () -> machine.archive(processing, "too early"));
            Assertions.assertEquals(1, audit.recent(10).size());
            Assertions.assertTrue(store.isActive("INBOX_A"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static PlanRecord plan(String id, PlanStatus status) {
        return new PlanRecord(id, "INBOX_A", Domain.PERSONAL, "general", SourceTag.INBOX, false, Priority.MEDIUM, null,
                status, List.of(), "x", "", null, null, null);
    }

    @Test
    void terminalStatusFollowsPlanOutcomes() {
        PlanRecord done = plan("PLAN_A_personal", PlanStatus.COMPLETE);
        PlanRecord refused = plan("PLAN_A_business", PlanStatus.REJECTED);

        Assertions.assertEquals(TaskStatus.COMPLETE, TaskVaultRuntime.terminalStatus(List.of(done)));
        Assertions.assertEquals(TaskStatus.REJECTED, TaskVaultRuntime.terminalStatus(List.of(refused)));
        Assertions.assertEquals(TaskStatus.PARTIAL, TaskVaultRuntime.terminalStatus(List.of(done, refused)));
    }
}
