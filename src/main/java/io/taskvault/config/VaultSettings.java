package io.taskvault.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.taskvault.model.FailureKind;
import io.taskvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolved runtime settings. Every field of {@code vault-settings.json} is optional and
 * falls back to the defaults below; out-of-range values are clamped.
 */
public record VaultSettings(
        int maxRetries,
        int transientMaxRetries,
        long backoffBaseMs,
        int backoffFactor,
        long requeueCooldownMinutes,
        long executionTimeoutMs,
        int recentActivityLimit,
        Set<String> criticalActions,
        Map<String, FailureKind> errorClasses,
        List<ExecutorSpec> executors
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_TRANSIENT_MAX_RETRIES = 5;
    public static final long DEFAULT_BACKOFF_BASE_MS = 1_000L;
    public static final int DEFAULT_BACKOFF_FACTOR = 2;
    public static final long DEFAULT_REQUEUE_COOLDOWN_MINUTES = 60L;
    public static final long DEFAULT_EXECUTION_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_RECENT_ACTIVITY_LIMIT = 20;

    public VaultSettings {
        criticalActions = Set.copyOf(criticalActions);
        errorClasses = Map.copyOf(errorClasses);
        executors = List.copyOf(executors);
    }

    public static VaultSettings defaults() {
        return new VaultSettings(
                DEFAULT_MAX_RETRIES,
                DEFAULT_TRANSIENT_MAX_RETRIES,
                DEFAULT_BACKOFF_BASE_MS,
                DEFAULT_BACKOFF_FACTOR,
                DEFAULT_REQUEUE_COOLDOWN_MINUTES,
                DEFAULT_EXECUTION_TIMEOUT_MS,
                DEFAULT_RECENT_ACTIVITY_LIMIT,
                Set.of("payment"),
                defaultErrorClasses(),
                List.of()
        );
    }

    public static VaultSettings load(Path settingsFile) {
        VaultSettings defaults = defaults();
        if (!Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load vault settings: " + settingsFile, e);
        }
    }

    static VaultSettings fromFile(SettingsFile file, VaultSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Map<String, FailureKind> classes = new LinkedHashMap<>(defaults.errorClasses());
        if (file.errorClasses() != null) {
            file.errorClasses().forEach((errorClass, kind) -> {
                if (errorClass != null && !errorClass.isBlank()) {
                    classes.put(normalizeErrorClass(errorClass), FailureKind.fromString(kind));
                }
            });
        }
        Set<String> critical = file.criticalActions() == null
                ? defaults.criticalActions()
                : file.criticalActions().stream()
                        .filter(value -> value != null && !value.isBlank())
                        .map(value -> value.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toSet());
        return new VaultSettings(
                sanitizeInt(file.maxRetries(), defaults.maxRetries(), 0),
                sanitizeInt(file.transientMaxRetries(), defaults.transientMaxRetries(), 0),
                sanitizeLong(file.backoffBaseMs(), defaults.backoffBaseMs(), 0L),
                sanitizeInt(file.backoffFactor(), defaults.backoffFactor(), 1),
                sanitizeLong(file.requeueCooldownMinutes(), defaults.requeueCooldownMinutes(), 1L),
                sanitizeLong(file.executionTimeoutMs(), defaults.executionTimeoutMs(), 100L),
                sanitizeInt(file.recentActivityLimit(), defaults.recentActivityLimit(), 1),
                critical,
                classes,
                file.executors() == null ? defaults.executors() : file.executors()
        );
    }

    public Duration requeueCooldown() {
        return Duration.ofMinutes(requeueCooldownMinutes);
    }

    public Duration executionTimeout() {
        return Duration.ofMillis(executionTimeoutMs);
    }

    public boolean isCriticalAction(String action) {
        return action != null && criticalActions.contains(action.toLowerCase(Locale.ROOT));
    }

    public static String normalizeErrorClass(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static Map<String, FailureKind> defaultErrorClasses() {
        Map<String, FailureKind> classes = new LinkedHashMap<>();
        classes.put("rate_limit", FailureKind.TRANSIENT);
        classes.put("connection", FailureKind.TRANSIENT);
        classes.put("timeout", FailureKind.TRANSIENT);
        classes.put("recipient_rejected", FailureKind.NON_CRITICAL);
        classes.put("content_rejected", FailureKind.NON_CRITICAL);
        classes.put("not_found", FailureKind.NON_CRITICAL);
        classes.put("auth_failure", FailureKind.CRITICAL);
        classes.put("missing_credential", FailureKind.CRITICAL);
        classes.put("service_outage", FailureKind.CRITICAL);
        classes.put("disk_full", FailureKind.CRITICAL);
        classes.put("validation", FailureKind.LOGIC);
        classes.put("config_error", FailureKind.LOGIC);
        return classes;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    public record ExecutorSpec(
            @JsonProperty("action") String action,
            @JsonProperty("command") List<String> command,
            @JsonProperty("timeout_ms") Long timeoutMs
    ) {
    }

    record SettingsFile(
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("transient_max_retries") Integer transientMaxRetries,
            @JsonProperty("backoff_base_ms") Long backoffBaseMs,
            @JsonProperty("backoff_factor") Integer backoffFactor,
            @JsonProperty("requeue_cooldown_minutes") Long requeueCooldownMinutes,
            @JsonProperty("execution_timeout_ms") Long executionTimeoutMs,
            @JsonProperty("recent_activity_limit") Integer recentActivityLimit,
            @JsonProperty("critical_actions") List<String> criticalActions,
            @JsonProperty("error_classes") Map<String, String> errorClasses,
            @JsonProperty("executors") List<ExecutorSpec> executors
    ) {
    }
}
