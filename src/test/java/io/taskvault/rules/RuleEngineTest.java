package io.taskvault.rules;

import io.taskvault.classify.Classification;
import io.taskvault.classify.DomainClassifier;
import io.taskvault.classify.SignalTable;
import io.taskvault.model.Domain;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

final class RuleEngineTest {
    private final DomainClassifier classifier = new DomainClassifier(SignalTable.bundled());
    private final RuleEngine engine = new RuleEngine(RuleTable.bundled());

    private RoutingDecision route(String content, SourceTag source) {
        Classification classification = classifier.classify(content, source, Map.of());
        return engine.evaluate(classification, source, Map.of(), content);
    }

    @Test
    void urgentWireRequestEscalatesWithoutFinanceRule() {
        RoutingDecision decision = route("Please wire $500 to vendor X, urgent", SourceTag.BUSINESS_MESSAGING);

        Assertions.assertEquals("CD-6", decision.ruleId());
        Assertions.assertEquals("urgent-escalation", decision.ruleName());
        Assertions.assertEquals(Domain.BUSINESS, decision.domain());
        Assertions.assertEquals(Priority.HIGH, decision.priority());
        Assertions.assertTrue(decision.requireApproval());
        Assertions.assertFalse(decision.split());
    }

    @Test
    void pluralInvoicesStillTriggerMessagingPaymentRule() {
        RoutingDecision decision = route("pay the invoices $500", SourceTag.BUSINESS_MESSAGING);

        Assertions.assertEquals("CD-1", decision.ruleId());
        Assertions.assertTrue(decision.requireApproval());
    }

    @Test
    void messagingPaymentRequestRunsLedgerChecks() {
        RoutingDecision decision = route("Please settle invoice 42, $1,200 due", SourceTag.BUSINESS_MESSAGING);

        Assertions.assertEquals("CD-1", decision.ruleId());
        Assertions.assertEquals(Priority.HIGH, decision.priority());
        Assertions.assertEquals(List.of(LedgerCheck.INVOICE, LedgerCheck.BANK_BALANCE), decision.ledgerChecks());
    }

    @Test
    void personalMoneyOverMessagingIsSplit() {
        RoutingDecision decision = route("Can you send $50 for the kids school trip", SourceTag.BUSINESS_MESSAGING);

        Assertions.assertEquals("CD-2", decision.ruleId());
        Assertions.assertEquals(Domain.BOTH, decision.domain());
        Assertions.assertTrue(decision.split());
        Assertions.assertEquals(List.of(Domain.PERSONAL, Domain.BUSINESS), decision.planDomains());
    }

    @Test
    void socialContactLooksUpHistoryOnly() {
        RoutingDecision decision = route("Great to connect, let's talk sometime", SourceTag.EXTERNAL_SOCIAL);

        Assertions.assertEquals("CD-3", decision.ruleId());
        Assertions.assertEquals(List.of(LedgerCheck.CONTACT_HISTORY), decision.ledgerChecks());
        Assertions.assertFalse(decision.requireApproval());
    }

    @Test
    void emailedContractIsBusinessAndNeedsApproval() {
        RoutingDecision decision = route("Attached is the signed contract for review", SourceTag.EXTERNAL_EMAIL);

        Assertions.assertEquals("CD-4", decision.ruleId());
        Assertions.assertEquals(Domain.BUSINESS, decision.domain());
        Assertions.assertEquals(Priority.MEDIUM, decision.priority());
        Assertions.assertTrue(decision.requireApproval());
        Assertions.assertEquals(List.of(LedgerCheck.INVOICE), decision.ledgerChecks());
    }

    @Test
    void agreementWithoutLedgerSignalSkipsInvoiceRule() {
        RoutingDecision decision = route("Attached is the signed agreement for review", SourceTag.EXTERNAL_EMAIL);

        Assertions.assertNotEquals("CD-4", decision.ruleId());
    }

    @Test
    void personalMoneyKeepsMediumPriorityEvenWhenUrgent() {
        RoutingDecision decision = route("Urgent: can you send $50 for the kids school trip", SourceTag.BUSINESS_MESSAGING);

        Assertions.assertEquals("CD-2", decision.ruleId());
        Assertions.assertEquals(Priority.MEDIUM, decision.priority());
    }

    @Test
    void dualDomainInboxItemIsSplit() {
        RoutingDecision decision = route("Plan the client review and my birthday dinner", SourceTag.INBOX);

        Assertions.assertEquals("CD-5", decision.ruleId());
        Assertions.assertTrue(decision.split());
        Assertions.assertEquals(Priority.MEDIUM, decision.priority());
    }

    @Test
    void noMatchKeepsClassifierDomainAndUrgencyPriority() {
        RoutingDecision calm = route("Water the plants", SourceTag.INBOX);
        RoutingDecision urgent = route("Call the doctor asap", SourceTag.INBOX);

        Assertions.assertFalse(calm.matched());
        Assertions.assertEquals("none", calm.ruleLabel());
        Assertions.assertEquals(Priority.MEDIUM, calm.priority());
        Assertions.assertFalse(urgent.matched());
        Assertions.assertEquals(Domain.PERSONAL, urgent.domain());
        Assertions.assertEquals(Priority.HIGH, urgent.priority());
    }

    @Test
    void firstMatchWins() {
        RoutingRule broad = new RoutingRule("X-1", "everything", null,
                new RoutingRule.Effect(null, Priority.LOW, null, null, null));
        RoutingRule later = new RoutingRule("X-2", "never", null,
                new RoutingRule.Effect(null, Priority.HIGH, true, null, null));
        RuleEngine custom = new RuleEngine(new RuleTable(7, List.of(broad, later)));
        Classification classification = classifier.classify("anything", SourceTag.INBOX, Map.of());

        RoutingDecision decision = custom.evaluate(classification, SourceTag.INBOX, Map.of(), "anything");

        Assertions.assertEquals("X-1", decision.ruleId());
        Assertions.assertEquals(Priority.LOW, decision.priority());
        Assertions.assertEquals(7, custom.tableVersion());
    }

    @Test
    void duplicateRuleIdsAreRejected() {
        RoutingRule rule = new RoutingRule("X-1", null, null, null);
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RuleTable(1, List.of(rule, rule)));
    }
}
