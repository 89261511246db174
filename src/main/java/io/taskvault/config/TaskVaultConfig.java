package io.taskvault.config;

import io.taskvault.model.ApprovalStatus;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class TaskVaultConfig {
    public static final String DEFAULT_ROOT = "vault";
    public static final String SETTINGS_FILE = "vault-settings.json";
    public static final String SIGNAL_TABLE_FILE = "signal-table.json";
    public static final String ROUTING_RULES_FILE = "routing-rules.json";

    private final Path rootDir;

    public TaskVaultConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static TaskVaultConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new TaskVaultConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path inboxDir() {
        return rootDir.resolve("inbox");
    }

    public Path consumedInboxDir() {
        return inboxDir().resolve(".consumed");
    }

    public Path activeTasksDir() {
        return rootDir.resolve("tasks").resolve("active");
    }

    public Path archivedTasksDir() {
        return rootDir.resolve("tasks").resolve("archive");
    }

    public Path plansDir() {
        return rootDir.resolve("plans");
    }

    public Path approvalsRoot() {
        return rootDir.resolve("approvals");
    }

    public Path approvalPool(ApprovalStatus status) {
        return approvalsRoot().resolve(status.poolName());
    }

    public Path deferredQueueFile() {
        return rootDir.resolve("deferred_queue.json");
    }

    public Path auditDir() {
        return rootDir.resolve("audit");
    }

    public Path outboxDir() {
        return rootDir.resolve("outbox");
    }

    public Path dashboardFile() {
        return rootDir.resolve("dashboard.md");
    }

    public Path lockFile() {
        return rootDir.resolve("vault.lock");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path signalTableFile() {
        return rootDir.resolve(SIGNAL_TABLE_FILE);
    }

    public Path routingRulesFile() {
        return rootDir.resolve(ROUTING_RULES_FILE);
    }
}
