package io.taskvault.escalation;

import io.taskvault.approval.ApprovalGate;
import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.Priority;
import io.taskvault.model.RiskRow;

import java.time.Clock;
import java.util.List;

/**
 * Raises the human-facing alert for a deferred action. Each deferral gets a fresh alert id so
 * a re-deferred entry is never hidden behind an already decided alert.
 */
public final class AlertWriter {
    private final ApprovalGate gate;
    private final Clock clock;

    public AlertWriter(ApprovalGate gate, Clock clock) {
        this.gate = gate;
        this.clock = clock;
    }

    public String raise(DeferredEntry entry, String reason) {
        String id = nextAlertId(entry.id());
        String details = "Action `" + entry.action() + "` for task `" + entry.payload().task()
                + "` was deferred after it failed.\n\n"
                + "- Service: " + entry.service() + "\n"
                + "- Error: " + entry.error() + "\n"
                + "- Reason: " + reason + "\n"
                + "- Deferred entry: " + entry.id() + "\n\n"
                + "The full payload is kept in `deferred_queue.json`; nothing was lost.";
        ApprovalRequest alert = new ApprovalRequest(
                id,
                ApprovalRequest.CRITICAL_FAILURE_ACTION,
                entry.payload().task(),
                entry.payload().planId(),
                Priority.HIGH,
                ApprovalStatus.PENDING,
                details,
                List.of(
                        new RiskRow("Data Loss", "Low", "Payload stored in the deferred queue"),
                        new RiskRow("Service Impact", "High", entry.service() + " unavailable for " + entry.action()),
                        new RiskRow("Irreversibility", "Medium", "Approving replays the action once"),
                        new RiskRow("Financial", "payment".equals(entry.action()) ? "High" : "Low", "Action " + entry.action())
                ),
                entry.id(),
                clock.instant()
        );
        return gate.create(alert);
    }

    private String nextAlertId(String entryId) {
        int n = 1;
        while (gate.find(alertId(entryId, n)).isPresent()) {
            n++;
        }
        return alertId(entryId, n);
    }

    static String alertId(String entryId, int n) {
        return "ALERT_" + entryId + "_" + n;
    }
}
