package io.taskvault.rules;

import io.taskvault.classify.Classification;
import io.taskvault.model.Domain;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;

import java.util.Locale;
import java.util.Map;

/**
 * Evaluates the routing table in order; the first matching rule decides. Without a match the
 * classifier's domain stands and priority follows urgency.
 */
public final class RuleEngine {
    private final RuleTable table;

    public RuleEngine(RuleTable table) {
        this.table = table;
    }

    public RoutingDecision evaluate(Classification classification, SourceTag source, Map<String, String> metadata, String content) {
        String lowered = content == null ? "" : content.toLowerCase(Locale.ROOT);
        Priority fallbackPriority = classification.urgent() ? Priority.HIGH : Priority.MEDIUM;
        for (RoutingRule rule : table.rules()) {
            if (!rule.matches(classification, source, metadata, lowered)) {
                continue;
            }
            RoutingRule.Effect effect = rule.then();
            boolean split = Boolean.TRUE.equals(effect.split());
            return new RoutingDecision(
                    rule.id(),
                    rule.name(),
                    split ? Domain.BOTH : effect.domain() == null ? classification.domain() : effect.domain(),
                    effect.priority() == null ? fallbackPriority : effect.priority(),
                    Boolean.TRUE.equals(effect.requireApproval()),
                    effect.ledgerChecks(),
                    split
            );
        }
        return new RoutingDecision(null, null, classification.domain(), fallbackPriority, false, null, false);
    }

    public int tableVersion() {
        return table.version();
    }
}
