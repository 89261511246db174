package io.taskvault.plan;

import io.taskvault.classify.Classification;
import io.taskvault.model.ChecklistItem;
import io.taskvault.model.Domain;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.PlanStatus;
import io.taskvault.model.Priority;
import io.taskvault.model.TaskRecord;
import io.taskvault.rules.LedgerCheck;
import io.taskvault.rules.RoutingDecision;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a routed task into one plan per domain. Checklist items are prefixed so later steps can
 * tick them off with {@link PlanRecord#withChecklistDone(String, Instant)}.
 */
public final class PlanBuilder {
    public static final String ITEM_READ = "Read and understand task content";
    public static final String ITEM_CONFIRM_DOMAIN = "Confirm domain";
    public static final String ITEM_RULE = "Rule applied";
    public static final String ITEM_LEDGER = "Cross-check";
    public static final String ITEM_SPLIT = "Handle";
    public static final String ITEM_MONETARY = "Confirm amount and recipient";
    public static final String ITEM_APPROVAL = "Route to approval";
    public static final String ITEM_PRIORITY = "Flag as high priority";
    public static final String ITEM_EXECUTE = "Execute";
    public static final String ITEM_DASHBOARD = "Update dashboard";
    public static final String ITEM_DONE = "Move to done";

    private final Clock clock;

    public PlanBuilder(Clock clock) {
        this.clock = clock;
    }

    public static String planId(String taskName, Domain domain, boolean split) {
        return split ? "PLAN_" + taskName + "_" + domain.wireName() : "PLAN_" + taskName;
    }

    /**
     * @param domains the domains still to plan; a requeued task carries only those not yet executed
     */
    public List<PlanRecord> build(TaskRecord task, String content, Classification classification, RoutingDecision decision,
                                  List<Domain> domains, List<LedgerFinding> findings) {
        Instant now = clock.instant();
        boolean approvalRequired = classification.sensitive() || decision.requireApproval();
        String notes = notes(content, classification, decision, findings);
        List<PlanRecord> plans = new ArrayList<>();
        for (Domain domain : domains) {
            List<ChecklistItem> checklist = checklist(task, classification, decision, domain, approvalRequired, findings);
            plans.add(new PlanRecord(
                    planId(task.name(), domain, decision.split()),
                    task.name(),
                    domain,
                    classification.category(),
                    task.source(),
                    classification.sensitive(),
                    decision.priority(),
                    decision.ruleId(),
                    PlanStatus.OPEN,
                    checklist,
                    content,
                    notes,
                    null,
                    now,
                    now
            ));
        }
        return plans;
    }

    private static List<ChecklistItem> checklist(TaskRecord task, Classification classification, RoutingDecision decision,
                                                 Domain domain, boolean approvalRequired, List<LedgerFinding> findings) {
        List<ChecklistItem> items = new ArrayList<>();
        items.add(ChecklistItem.open(ITEM_READ).markDone());
        items.add(ChecklistItem.open(ITEM_CONFIRM_DOMAIN + ": " + domain.wireName()).markDone());
        if (decision.matched()) {
            items.add(ChecklistItem.open(ITEM_RULE + ": " + decision.ruleLabel()).markDone());
        }
        for (LedgerCheck check : decision.ledgerChecks()) {
            boolean consulted = findings.stream().anyMatch(f -> f.check() == check && f.available());
            ChecklistItem item = ChecklistItem.open(ITEM_LEDGER + " " + ledgerLabel(check));
            items.add(consulted ? item.markDone() : item);
        }
        if (decision.split()) {
            items.add(ChecklistItem.open(ITEM_SPLIT + " " + domain.wireName() + " portion separately (split from " + task.name() + ")"));
        }
        if (classification.monetary()) {
            items.add(ChecklistItem.open(ITEM_MONETARY));
        }
        if (approvalRequired) {
            items.add(ChecklistItem.open(ITEM_APPROVAL + " (sensitive action)"));
        }
        if (decision.priority() == Priority.HIGH) {
            items.add(ChecklistItem.open(ITEM_PRIORITY).markDone());
        }
        items.add(ChecklistItem.open(ITEM_EXECUTE + " " + classification.category() + " action"));
        items.add(ChecklistItem.open(ITEM_DASHBOARD));
        items.add(ChecklistItem.open(ITEM_DONE));
        return items;
    }

    private static String ledgerLabel(LedgerCheck check) {
        return switch (check) {
            case INVOICE -> "invoice ledger for matching invoice";
            case BANK_BALANCE -> "bank balance covers the amount";
            case CONTACT_HISTORY -> "contact history for the sender";
        };
    }

    private static String notes(String content, Classification classification, RoutingDecision decision,
                                List<LedgerFinding> findings) {
        TaskAnalysis analysis = TaskAnalysis.of(content);
        StringBuilder sb = new StringBuilder();
        sb.append("Words: ").append(analysis.words())
                .append(", lines: ").append(analysis.lines()).append('\n');
        if (!analysis.keyPhrases().isEmpty()) {
            sb.append("Key phrases: ").append(String.join(", ", analysis.keyPhrases())).append('\n');
        }
        sb.append("Signals: business=").append(describe(classification.businessSignals()))
                .append(" personal=").append(describe(classification.personalSignals())).append('\n');
        sb.append("Flags: monetary=").append(classification.monetary())
                .append(" urgent=").append(classification.urgent())
                .append(" action_verb=").append(classification.actionVerb()).append('\n');
        sb.append("Routing: ").append(decision.ruleLabel()).append('\n');
        for (LedgerFinding finding : findings) {
            sb.append("Ledger ").append(finding.check().wireName()).append(": ").append(finding.summary()).append('\n');
        }
        return sb.toString().strip();
    }

    private static String describe(Map<String, List<String>> signals) {
        if (signals.isEmpty()) {
            return "none";
        }
        List<String> parts = new ArrayList<>();
        signals.forEach((category, keywords) -> parts.add(category + "(" + String.join("/", keywords) + ")"));
        return String.join(",", parts).toLowerCase(Locale.ROOT);
    }
}
