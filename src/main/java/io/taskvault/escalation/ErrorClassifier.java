package io.taskvault.escalation;

import io.taskvault.config.VaultSettings;
import io.taskvault.model.FailureKind;

import java.util.Map;

/**
 * Looks up an executor's error class in the configured table. Classes missing from the table
 * are {@link FailureKind#UNRECOGNIZED} and are never retried.
 */
public final class ErrorClassifier {
    private final Map<String, FailureKind> table;

    public ErrorClassifier(Map<String, FailureKind> table) {
        this.table = Map.copyOf(table);
    }

    public static ErrorClassifier from(VaultSettings settings) {
        return new ErrorClassifier(settings.errorClasses());
    }

    public FailureKind classify(String errorClass) {
        if (errorClass == null || errorClass.isBlank()) {
            return FailureKind.UNRECOGNIZED;
        }
        return table.getOrDefault(VaultSettings.normalizeErrorClass(errorClass), FailureKind.UNRECOGNIZED);
    }
}
