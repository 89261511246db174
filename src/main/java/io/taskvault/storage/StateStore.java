package io.taskvault.storage;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for tasks and plans. Each task is a content file {@code <name>.md} with a
 * JSON sidecar {@code <name>.md.meta.json}; active tasks live under {@code tasks/active},
 * finished ones are moved to {@code tasks/archive}. All sidecar writes replace atomically.
 */
public final class StateStore {
    static final String CONTENT_SUFFIX = ".md";
    static final String SIDECAR_SUFFIX = ".md.meta.json";

    private static final Comparator<TaskRecord> BY_RECEIVED = Comparator
            .comparing(TaskRecord::receivedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(TaskRecord::name);

    private final TaskVaultConfig config;

    public StateStore(TaskVaultConfig config) {
        this.config = config;
    }

    public TaskVaultConfig config() {
        return config;
    }

    public void init() {
        try {
            Files.createDirectories(config.inboxDir());
            Files.createDirectories(config.consumedInboxDir());
            Files.createDirectories(config.activeTasksDir());
            Files.createDirectories(config.archivedTasksDir());
            Files.createDirectories(config.plansDir());
            for (ApprovalStatus pool : ApprovalStatus.values()) {
                Files.createDirectories(config.approvalPool(pool));
            }
            Files.createDirectories(config.auditDir());
            Files.createDirectories(config.outboxDir());
        } catch (IOException e) {
            throw new StateStoreException("Failed to initialize vault layout: " + config.rootDir(), e);
        }
    }

    /**
     * Writes the content first and the sidecar second: a sidecar never points at missing content.
     */
    public void createTask(TaskRecord task, String content) {
        Path contentPath = config.activeTasksDir().resolve(task.name() + CONTENT_SUFFIX);
        try {
            Files.createDirectories(config.activeTasksDir());
            Files.writeString(contentPath, content == null ? "" : content, StandardCharsets.UTF_8);
            Jsons.writeAtomically(sidecar(config.activeTasksDir(), task.name()), task);
        } catch (IOException e) {
            throw new StateStoreException("Failed to create task: " + contentPath, e);
        }
    }

    public void saveTask(TaskRecord task) {
        Path target = sidecar(config.activeTasksDir(), task.name());
        if (!Files.exists(target)) {
            throw new StateStoreException("Task is not active: " + task.name());
        }
        try {
            Jsons.writeAtomically(target, task);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write task sidecar: " + target, e);
        }
    }

    public Optional<TaskRecord> findActive(String name) {
        return readSidecar(sidecar(config.activeTasksDir(), name));
    }

    public Optional<TaskRecord> findArchived(String name) {
        return readSidecar(sidecar(config.archivedTasksDir(), name));
    }

    public Optional<TaskRecord> find(String name) {
        Optional<TaskRecord> active = findActive(name);
        return active.isPresent() ? active : findArchived(name);
    }

    public boolean isActive(String name) {
        return Files.exists(sidecar(config.activeTasksDir(), name));
    }

    public String readContent(String name) {
        Path active = config.activeTasksDir().resolve(name + CONTENT_SUFFIX);
        Path path = Files.exists(active) ? active : config.archivedTasksDir().resolve(name + CONTENT_SUFFIX);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException("Failed to read task content: " + path, e);
        }
    }

    public List<TaskRecord> listActive() {
        return listSidecars(config.activeTasksDir());
    }

    public List<TaskRecord> listArchived() {
        return listSidecars(config.archivedTasksDir());
    }

    public List<TaskRecord> listActive(TaskStatus status) {
        return listActive().stream().filter(task -> task.status() == status).toList();
    }

    public Optional<TaskRecord> findActiveByDedupKey(String dedupKey) {
        return listActive().stream().filter(task -> dedupKey.equals(task.dedupKey())).findFirst();
    }

    /**
     * Finished tasks that close a dedup key. A task archived as {@code retry_queued} was
     * handed over to its follow-up and does not count.
     */
    public Optional<TaskRecord> findFinishedByDedupKey(String dedupKey) {
        return listArchived().stream()
                .filter(task -> dedupKey.equals(task.dedupKey()))
                .filter(task -> task.status().isTerminal() || task.status() == TaskStatus.DEFERRED)
                .findFirst();
    }

    /**
     * Persists the final sidecar in place, then moves the sidecar and content into the archive.
     */
    public TaskRecord archive(TaskRecord task) {
        saveTask(task);
        Path fromContent = config.activeTasksDir().resolve(task.name() + CONTENT_SUFFIX);
        Path toContent = config.archivedTasksDir().resolve(task.name() + CONTENT_SUFFIX);
        try {
            Files.createDirectories(config.archivedTasksDir());
            move(sidecar(config.activeTasksDir(), task.name()), sidecar(config.archivedTasksDir(), task.name()));
            if (Files.exists(fromContent)) {
                move(fromContent, toContent);
            }
            return task;
        } catch (IOException e) {
            throw new StateStoreException("Failed to archive task: " + task.name(), e);
        }
    }

    public void savePlan(PlanRecord plan) {
        Path target = config.plansDir().resolve(plan.id() + ".json");
        try {
            Jsons.writeAtomically(target, plan);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write plan: " + target, e);
        }
    }

    public Optional<PlanRecord> findPlan(String planId) {
        Path path = config.plansDir().resolve(planId + ".json");
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(path.toFile(), PlanRecord.class));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read plan: " + path, e);
        }
    }

    public PlanRecord requirePlan(String planId) {
        return findPlan(planId).orElseThrow(() -> new StateStoreException("Plan not found: " + planId));
    }

    public List<PlanRecord> listPlans() {
        List<PlanRecord> plans = new ArrayList<>();
        if (!Files.isDirectory(config.plansDir())) {
            return plans;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(config.plansDir(), "*.json")) {
            for (Path path : stream) {
                plans.add(Jsons.mapper().readValue(path.toFile(), PlanRecord.class));
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to list plans: " + config.plansDir(), e);
        }
        plans.sort(Comparator.comparing(PlanRecord::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparing(PlanRecord::id));
        return plans;
    }

    private List<TaskRecord> listSidecars(Path dir) {
        List<TaskRecord> tasks = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return tasks;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SIDECAR_SUFFIX)) {
            for (Path path : stream) {
                tasks.add(Jsons.mapper().readValue(path.toFile(), TaskRecord.class));
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to list tasks: " + dir, e);
        }
        tasks.sort(BY_RECEIVED);
        return tasks;
    }

    private Optional<TaskRecord> readSidecar(Path path) {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Jsons.mapper().readValue(path.toFile(), TaskRecord.class));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read task sidecar: " + path, e);
        }
    }

    private static Path sidecar(Path dir, String name) {
        return dir.resolve(name + SIDECAR_SUFFIX);
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
