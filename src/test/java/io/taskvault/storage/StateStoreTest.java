package io.taskvault.storage;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.SourceTag;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.testing.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

final class StateStoreTest {
    private static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

    @Test
    void initCreatesLayout() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-store-layout-");
        try {
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            new StateStore(config).init();

            Assertions.assertTrue(Files.isDirectory(config.inboxDir()));
            Assertions.assertTrue(Files.isDirectory(config.activeTasksDir()));
            Assertions.assertTrue(Files.isDirectory(config.archivedTasksDir()));
            Assertions.assertTrue(Files.isDirectory(config.plansDir()));
            Assertions.assertTrue(Files.isDirectory(config.auditDir()));
            Assertions.assertTrue(Files.isDirectory(config.outboxDir()));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void tasksRoundTripAndArchive() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-store-tasks-");
        try {
            TaskVaultConfig config = TaskVaultConfig.fromRoot(root.toString());
            StateStore store = new StateStore(config);
            store.init();
            TaskRecord older = TaskRecord.admitted("INBOX_A", "inbox:aaa", SourceTag.INBOX, Map.of("subject", "hi"), T0);
            TaskRecord newer = TaskRecord.admitted("INBOX_B", "inbox:bbb", SourceTag.INBOX, Map.of(), T0.plusSeconds(5));
            store.createTask(newer, "second");
            store.createTask(older, "first");

            Assertions.assertEquals(List.of("INBOX_A", "INBOX_B"), store.listActive().stream().map(TaskRecord::name).toList());
            Assertions.assertEquals("first", store.readContent("INBOX_A"));
            Assertions.assertEquals("hi", store.findActive("INBOX_A").orElseThrow().metadata().get("subject"));
            Assertions.assertTrue(Files.exists(config.activeTasksDir().resolve("INBOX_A.md.meta.json")));

            store.archive(older.withStatus(TaskStatus.COMPLETE, T0.plusSeconds(10)));

            Assertions.assertFalse(store.isActive("INBOX_A"));
            Assertions.assertEquals(TaskStatus.COMPLETE, store.find("INBOX_A").orElseThrow().status());
            Assertions.assertEquals("first", store.readContent("INBOX_A"));
            Assertions.assertTrue(store.findFinishedByDedupKey("inbox:aaa").isPresent());
            Assertions.assertTrue(store.findActiveByDedupKey("inbox:bbb").isPresent());
            Assertions.assertEquals(1, store.listActive(TaskStatus.PENDING).size());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void requeuedArchiveDoesNotCloseDedupKey() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-store-requeue-");
        try {
            StateStore store = new StateStore(TaskVaultConfig.fromRoot(root.toString()));
            store.init();
            TaskRecord task = TaskRecord.admitted("INBOX_A", "inbox:aaa", SourceTag.INBOX, Map.of(), T0);
            store.createTask(task, "x");
            store.archive(task.withStatus(TaskStatus.RETRY_QUEUED, T0));

            Assertions.assertTrue(store.findFinishedByDedupKey("inbox:aaa").isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void savingAnInactiveTaskFails() throws Exception {
        Path root = Files.createTempDirectory("taskvault-test-store-inactive-");
        try {
            StateStore store = new StateStore(TaskVaultConfig.fromRoot(root.toString()));
            store.init();
            TaskRecord ghost = TaskRecord.admitted("INBOX_GHOST", "inbox:ghost", SourceTag.INBOX, Map.of(), T0);

            Assertions.assertThrows(StateStoreException.class, () -> store.saveTask(ghost));
            Assertions.assertThrows(StateStoreException.class, () -> store.requirePlan("PLAN_missing"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }
}
