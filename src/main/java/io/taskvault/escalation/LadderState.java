package io.taskvault.escalation;

public enum LadderState {
    ATTEMPT,
    BACKOFF,
    SUCCEEDED,
    REQUEUE,
    DEFER,
    FATAL;

    public boolean isFinal() {
        return this == SUCCEEDED || this == REQUEUE || this == DEFER || this == FATAL;
    }
}
