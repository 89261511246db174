package io.taskvault.ingest;

public record AdmitOutcome(boolean accepted, String taskName, String dedupKey, String reason) {
    public static final String REASON_ALREADY_PROCESSED = "already_processed";
    public static final String REASON_IN_FLIGHT = "in_flight";

    public static AdmitOutcome accepted(String taskName, String dedupKey) {
        return new AdmitOutcome(true, taskName, dedupKey, null);
    }

    /**
     * @param existingTask the task that already holds the dedup key
     */
    public static AdmitOutcome skipped(String existingTask, String dedupKey, String reason) {
        return new AdmitOutcome(false, existingTask, dedupKey, reason);
    }
}
