package io.taskvault.rules;

import io.taskvault.model.Domain;
import io.taskvault.model.Priority;

import java.util.List;

/**
 * @param ruleId null when no rule matched and the task proceeds by sensitivity alone
 */
public record RoutingDecision(
        String ruleId,
        String ruleName,
        Domain domain,
        Priority priority,
        boolean requireApproval,
        List<LedgerCheck> ledgerChecks,
        boolean split
) {
    public RoutingDecision {
        ledgerChecks = ledgerChecks == null ? List.of() : List.copyOf(ledgerChecks);
    }

    public boolean matched() {
        return ruleId != null;
    }

    public String ruleLabel() {
        if (ruleId == null) {
            return "none";
        }
        return ruleName == null ? ruleId : ruleId + " " + ruleName;
    }

    /**
     * Domains that get their own plan: personal and business under a split, otherwise the
     * routed domain.
     */
    public List<Domain> planDomains() {
        if (split) {
            return List.of(Domain.PERSONAL, Domain.BUSINESS);
        }
        return List.of(domain);
    }
}
