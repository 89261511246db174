package io.taskvault.approval;

import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.RiskRow;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Human checkpoint. The gate writes a request once and afterwards only reads: approval and
 * rejection happen outside, through the {@link ApprovalSignalSource}.
 */
public final class ApprovalGate {
    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);
    private static final String ACTOR = "approval_gate";

    private final ApprovalSignalSource signals;
    private final DraftComposer drafts;
    private final AuditLog audit;
    private final Clock clock;

    public ApprovalGate(ApprovalSignalSource signals, DraftComposer drafts, AuditLog audit, Clock clock) {
        this.signals = signals;
        this.drafts = drafts;
        this.audit = audit;
        this.clock = clock;
    }

    public static String approvalId(String planId) {
        return "APPROVAL_" + planId;
    }

    /**
     * Creates the request unless one with the same id already exists in any pool.
     */
    public String create(ApprovalRequest request) {
        if (signals.find(request.id()).isPresent()) {
            log.debug("Approval {} already exists", request.id());
            return request.id();
        }
        ApprovalRequest pending = request.observedAs(ApprovalStatus.PENDING);
        signals.publish(pending, ApprovalMarkdown.render(pending));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("action", request.action());
        params.put("source_task", request.sourceTask());
        params.put("plan_ref", request.planRef());
        params.put("priority", request.priority().wireName());
        audit.log(AuditEvent.success(AuditActions.APPROVAL_REQUESTED, ACTOR, request.id(), params)
                .withApproval(ApprovalStatus.PENDING));
        log.info("Approval requested {} for {}", request.id(), request.sourceTask());
        return request.id();
    }

    public String requestForPlan(PlanRecord plan, String action) {
        ApprovalRequest request = new ApprovalRequest(
                approvalId(plan.id()),
                action,
                plan.task(),
                plan.id(),
                plan.priority(),
                ApprovalStatus.PENDING,
                drafts.compose(plan, action),
                riskTable(plan, action),
                null,
                clock.instant()
        );
        return create(request);
    }

    public ApprovalPollResult poll() {
        List<ApprovalRequest> approved = new ArrayList<>();
        List<ApprovalRequest> rejected = new ArrayList<>();
        for (ApprovalRequest request : signals.observe()) {
            if (request.status() == ApprovalStatus.APPROVED) {
                approved.add(request);
            } else if (request.status() == ApprovalStatus.REJECTED) {
                rejected.add(request);
            }
        }
        return new ApprovalPollResult(approved, rejected);
    }

    public List<ApprovalRequest> pending() {
        return signals.observe().stream()
                .filter(request -> request.status() == ApprovalStatus.PENDING)
                .toList();
    }

    public List<ApprovalRequest> all() {
        return signals.observe();
    }

    public Optional<ApprovalRequest> find(String id) {
        return signals.find(id);
    }

    private static List<RiskRow> riskTable(PlanRecord plan, String action) {
        List<RiskRow> rows = new ArrayList<>();
        rows.add(new RiskRow("Irreversibility", plan.sensitive() ? "High" : "Medium",
                "Action '" + action + "' reaches an outside party once executed"));
        rows.add(new RiskRow("Financial", "payment".equals(plan.category()) ? "High" : "Low",
                "Category " + plan.category()));
        rows.add(new RiskRow("Reputation", plan.source() != null && plan.source().isExternal() ? "Medium" : "Low",
                "Source " + (plan.source() == null ? "unknown" : plan.source().wireName())));
        return rows;
    }
}
