package io.taskvault.cli;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.ingest.AdmitOutcome;
import io.taskvault.ingest.IncomingItem;
import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.model.SourceTag;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.runtime.CycleOutcome;
import io.taskvault.runtime.TaskVaultLogicException;
import io.taskvault.runtime.TaskVaultRuntime;
import io.taskvault.storage.RunLockUnavailableException;
import io.taskvault.storage.StateStoreException;
import io.taskvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "taskvault",
        mixinStandardHelpOptions = true,
        description = "File-backed task orchestrator",
        subcommands = {
                TaskVaultCommand.InitCommand.class,
                TaskVaultCommand.SubmitCommand.class,
                TaskVaultCommand.RunCycleCommand.class,
                TaskVaultCommand.TasksCommand.class,
                TaskVaultCommand.TaskCommand.class,
                TaskVaultCommand.ApprovalsCommand.class,
                TaskVaultCommand.DeferredCommand.class,
                TaskVaultCommand.DashboardCommand.class,
                TaskVaultCommand.AuditTailCommand.class
        }
)
public final class TaskVaultCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_STATE_STORE = 1;
    public static final int EXIT_LOGIC = 2;
    public static final int EXIT_LOCK_HELD = 4;

    private static final Logger log = LoggerFactory.getLogger(TaskVaultCommand.class);

    @Option(names = {"--root"}, description = "Vault root directory", defaultValue = TaskVaultConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use a subcommand. Try --help.");
    }

    TaskVaultRuntime runtime() {
        return TaskVaultRuntime.open(TaskVaultConfig.fromRoot(root));
    }

    @Command(name = "init", description = "Create the vault directory layout")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Override
        public Integer call() {
            TaskVaultRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized TaskVault at: " + runtime.config().rootDir());
            return EXIT_OK;
        }
    }

    @Command(name = "submit", description = "Admit one item of work")
    static final class SubmitCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--source"}, defaultValue = "inbox",
                description = "inbox|external-email|external-social|business-messaging")
        String source;

        @Option(names = {"--content"}, description = "Task content")
        String content;

        @Option(names = {"--file"}, description = "Read task content from a file")
        Path file;

        @Option(names = {"--subject"}, description = "Optional subject line")
        String subject;

        @Option(names = {"--sender"}, description = "Optional sender")
        String sender;

        @Override
        public Integer call() throws IOException {
            if ((content == null) == (file == null)) {
                System.err.println("Exactly one of --content or --file is required");
                return EXIT_LOGIC;
            }
            String body = content != null ? content : Files.readString(file, StandardCharsets.UTF_8);
            Map<String, String> metadata = new LinkedHashMap<>();
            if (subject != null) {
                metadata.put("subject", subject);
            }
            if (sender != null) {
                metadata.put("sender", sender);
            }
            try {
                AdmitOutcome outcome = parent.runtime()
                        .submit(new IncomingItem(body, SourceTag.fromString(source), metadata));
                System.out.println(Jsons.toJson(outcome));
                return EXIT_OK;
            } catch (RunLockUnavailableException e) {
                System.err.println(e.getMessage());
                return EXIT_LOCK_HELD;
            }
        }
    }

    @Command(name = "run-cycle", description = "Run one orchestration cycle")
    static final class RunCycleCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Override
        public Integer call() {
            try {
                CycleOutcome outcome = parent.runtime().runCycle();
                System.out.println(Jsons.toJson(outcome));
                return EXIT_OK;
            } catch (RunLockUnavailableException e) {
                log.warn("Cycle skipped: {}", e.getMessage());
                System.err.println(e.getMessage());
                return EXIT_LOCK_HELD;
            } catch (TaskVaultLogicException | IllegalStateException e) {
                log.error("Cycle aborted by logic error", e);
                System.err.println("Fatal: " + e.getMessage());
                return EXIT_LOGIC;
            } catch (StateStoreException e) {
                log.error("Cycle aborted: vault not readable or writable", e);
                System.err.println("State store failure: " + e.getMessage());
                return EXIT_STATE_STORE;
            }
        }
    }

    @Command(name = "tasks", description = "List tasks")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--status"}, description = "Filter by task status")
        String status;

        @Option(names = {"--archived"}, description = "Include archived tasks")
        boolean archived;

        @Override
        public Integer call() {
            List<TaskRecord> tasks = parent.runtime().tasks(archived);
            if (status != null && !status.isBlank()) {
                TaskStatus wanted = TaskStatus.fromString(status);
                tasks = tasks.stream().filter(task -> task.status() == wanted).toList();
            }
            System.out.println(Jsons.toJson(tasks));
            return EXIT_OK;
        }
    }

    @Command(name = "task", description = "Show a task with its plans")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Parameters(index = "0", description = "Task name")
        String name;

        @Override
        public Integer call() {
            TaskVaultRuntime runtime = parent.runtime();
            Optional<TaskRecord> task = runtime.task(name);
            if (task.isEmpty()) {
                System.out.println("{\"error\":\"task not found\"}");
                return EXIT_STATE_STORE;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("task", task.get());
            out.put("plans", runtime.plansFor(task.get()));
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "approvals", description = "List approval requests and alerts")
    static final class ApprovalsCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--status"}, description = "pending|approved|rejected")
        String status;

        @Override
        public Integer call() {
            List<ApprovalRequest> requests = parent.runtime().approvals();
            if (status != null && !status.isBlank()) {
                ApprovalStatus wanted = ApprovalStatus.fromString(status);
                requests = requests.stream().filter(request -> request.status() == wanted).toList();
            }
            System.out.println(Jsons.toJson(requests));
            return EXIT_OK;
        }
    }

    @Command(name = "deferred", description = "List deferred queue entries")
    static final class DeferredCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--status"}, description = "deferred|retried|resolved|dismissed")
        String status;

        @Override
        public Integer call() {
            List<DeferredEntry> entries = parent.runtime().deferredEntries();
            if (status != null && !status.isBlank()) {
                DeferredStatus wanted = DeferredStatus.fromString(status);
                entries = entries.stream().filter(entry -> entry.status() == wanted).toList();
            }
            System.out.println(Jsons.toJson(entries));
            return EXIT_OK;
        }
    }

    @Command(name = "dashboard", description = "Print the status dashboard projected from current state")
    static final class DashboardCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Override
        public Integer call() {
            System.out.println(parent.runtime().renderDashboard());
            return EXIT_OK;
        }
    }

    @Command(name = "audit-tail", description = "Print the latest audit entries, newest first")
    static final class AuditTailCommand implements Callable<Integer> {
        @ParentCommand
        TaskVaultCommand parent;

        @Option(names = {"--lines"}, defaultValue = "50", description = "Number of latest entries")
        int lines;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().auditTail(lines)));
            return EXIT_OK;
        }
    }
}
