package io.taskvault.runtime;

/**
 * A failure that retrying cannot fix: a validation error, a bad configuration, or a bug.
 * Aborts the cycle.
 */
public final class TaskVaultLogicException extends RuntimeException {
    public TaskVaultLogicException(String message) {
        super(message);
    }

    public TaskVaultLogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
