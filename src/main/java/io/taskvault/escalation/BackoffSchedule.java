package io.taskvault.escalation;

import io.taskvault.config.VaultSettings;

import java.time.Duration;

/**
 * Exponential waits between transient retries: {@code base * factor^n} for retry {@code n}.
 * With the defaults (1 s, factor 2, five retries) the waits are 1, 2, 4, 8 and 16 s.
 */
public record BackoffSchedule(long baseMs, int factor, int maxRetries) {
    public BackoffSchedule {
        if (baseMs < 0 || factor < 1 || maxRetries < 0) {
            throw new IllegalArgumentException("invalid backoff schedule: base=" + baseMs + " factor=" + factor
                    + " retries=" + maxRetries);
        }
    }

    public static BackoffSchedule from(VaultSettings settings) {
        return new BackoffSchedule(settings.backoffBaseMs(), settings.backoffFactor(), settings.transientMaxRetries());
    }

    public Duration delay(int retryIndex) {
        long delay = baseMs;
        for (int i = 0; i < retryIndex; i++) {
            delay = Math.multiplyExact(delay, (long) factor);
        }
        return Duration.ofMillis(delay);
    }

    /** Upper bound on the total time spent waiting for one action. */
    public Duration totalBound() {
        Duration total = Duration.ZERO;
        for (int i = 0; i < maxRetries; i++) {
            total = total.plus(delay(i));
        }
        return total;
    }
}
