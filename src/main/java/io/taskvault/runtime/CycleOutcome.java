package io.taskvault.runtime;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CycleOutcome(
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("admitted") int admitted,
        @JsonProperty("duplicates_skipped") int duplicatesSkipped,
        @JsonProperty("released_from_cooldown") int releasedFromCooldown,
        @JsonProperty("processed") int processed,
        @JsonProperty("awaiting_approval") int awaitingApproval,
        @JsonProperty("completed") int completed,
        @JsonProperty("partial") int partial,
        @JsonProperty("rejected") int rejected,
        @JsonProperty("requeued") int requeued,
        @JsonProperty("deferred") int deferred,
        @JsonProperty("alerts_resolved") int alertsResolved,
        @JsonProperty("alerts_dismissed") int alertsDismissed,
        @JsonProperty("cancelled") boolean cancelled
) {
    static final class Counters {
        final Instant startedAt;
        int admitted;
        int duplicatesSkipped;
        int releasedFromCooldown;
        int processed;
        int awaitingApproval;
        int completed;
        int partial;
        int rejected;
        int requeued;
        int deferred;
        int alertsResolved;
        int alertsDismissed;
        boolean cancelled;

        Counters(Instant startedAt) {
            this.startedAt = startedAt;
        }

        CycleOutcome finish(Instant finishedAt) {
            return new CycleOutcome(startedAt, finishedAt, admitted, duplicatesSkipped, releasedFromCooldown, processed,
                    awaitingApproval, completed, partial, rejected, requeued, deferred, alertsResolved, alertsDismissed,
                    cancelled);
        }
    }
}
