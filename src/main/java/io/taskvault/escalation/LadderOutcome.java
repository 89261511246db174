package io.taskvault.escalation;

import io.taskvault.model.FailureKind;

/**
 * How one action left the ladder.
 *
 * @param deferredEntryId set when the action was parked in the deferred queue
 */
public record LadderOutcome(
        LadderState state,
        int attempts,
        FailureKind failureKind,
        String errorClass,
        String error,
        String output,
        String deferredEntryId
) {
    public static LadderOutcome succeeded(int attempts, String output) {
        return new LadderOutcome(LadderState.SUCCEEDED, attempts, null, null, null, output, null);
    }

    public boolean succeeded() {
        return state == LadderState.SUCCEEDED;
    }

    LadderOutcome withDeferredEntry(String entryId) {
        return new LadderOutcome(state, attempts, failureKind, errorClass, error, output, entryId);
    }

    public String describeFailure() {
        return errorClass == null ? String.valueOf(error) : errorClass + ": " + error;
    }
}
