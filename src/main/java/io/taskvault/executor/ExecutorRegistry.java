package io.taskvault.executor;

import io.taskvault.config.TaskVaultConfig;
import io.taskvault.config.VaultSettings;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps an action name to its executor. Actions without a registration fall back to the
 * default executor, which hands the payload off to the outbox.
 */
public final class ExecutorRegistry {
    private final Map<String, ActionExecutor> executors = new ConcurrentHashMap<>();
    private final ActionExecutor fallback;

    public ExecutorRegistry(ActionExecutor fallback) {
        this.fallback = fallback;
    }

    public static ExecutorRegistry fromSettings(TaskVaultConfig config, VaultSettings settings) {
        ExecutorRegistry registry = new ExecutorRegistry(new OutboxExecutor(config.outboxDir()));
        for (VaultSettings.ExecutorSpec spec : settings.executors()) {
            long timeoutMs = spec.timeoutMs() == null ? settings.executionTimeoutMs() : spec.timeoutMs();
            registry.register(spec.action(), new ScriptExecutor(spec.action(), spec.command(), timeoutMs, config.rootDir()));
        }
        return registry;
    }

    public void register(String action, ActionExecutor executor) {
        executors.put(normalize(action), executor);
    }

    public ActionExecutor forAction(String action) {
        return executors.getOrDefault(normalize(action), fallback);
    }

    public Collection<String> registeredActions() {
        return executors.keySet();
    }

    private static String normalize(String action) {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be empty");
        }
        return action.trim().toLowerCase(Locale.ROOT);
    }
}
