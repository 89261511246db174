package io.taskvault.runtime;

import io.taskvault.approval.ApprovalGate;
import io.taskvault.approval.ApprovalPollResult;
import io.taskvault.approval.ApprovalSignalSource;
import io.taskvault.approval.DraftComposer;
import io.taskvault.approval.FileApprovalSignalSource;
import io.taskvault.approval.TemplateDraftComposer;
import io.taskvault.classify.Classification;
import io.taskvault.classify.DomainClassifier;
import io.taskvault.classify.SignalTable;
import io.taskvault.config.TaskVaultConfig;
import io.taskvault.config.VaultSettings;
import io.taskvault.dashboard.DashboardProjector;
import io.taskvault.dashboard.DashboardRenderer;
import io.taskvault.dashboard.DashboardView;
import io.taskvault.escalation.AlertWriter;
import io.taskvault.escalation.DeferredQueue;
import io.taskvault.escalation.EscalationLadder;
import io.taskvault.escalation.LadderOutcome;
import io.taskvault.escalation.LadderState;
import io.taskvault.escalation.Sleeper;
import io.taskvault.executor.ExecutorRegistry;
import io.taskvault.executor.TimeLimitedExecution;
import io.taskvault.ingest.AdmitOutcome;
import io.taskvault.ingest.InboxScanner;
import io.taskvault.ingest.IncomingItem;
import io.taskvault.ingest.Ingestor;
import io.taskvault.model.ActionPayload;
import io.taskvault.model.ApprovalRequest;
import io.taskvault.model.ApprovalStatus;
import io.taskvault.model.DeferredEntry;
import io.taskvault.model.DeferredStatus;
import io.taskvault.model.Domain;
import io.taskvault.model.PlanRecord;
import io.taskvault.model.PlanStatus;
import io.taskvault.model.TaskRecord;
import io.taskvault.model.TaskStatus;
import io.taskvault.observability.AuditActions;
import io.taskvault.observability.AuditEntry;
import io.taskvault.observability.AuditEvent;
import io.taskvault.observability.AuditLog;
import io.taskvault.plan.LedgerClient;
import io.taskvault.plan.LedgerFinding;
import io.taskvault.plan.OfflineLedgerClient;
import io.taskvault.plan.PlanActions;
import io.taskvault.plan.PlanBuilder;
import io.taskvault.rules.LedgerCheck;
import io.taskvault.rules.RoutingDecision;
import io.taskvault.rules.RuleEngine;
import io.taskvault.rules.RuleTable;
import io.taskvault.storage.RunLock;
import io.taskvault.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public final class TaskVaultRuntime {
    private static final Logger log = LoggerFactory.getLogger(TaskVaultRuntime.class);
    private static final String ACTOR = "runtime";

    private final TaskVaultConfig config;
    private final VaultSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;
    private final StateStore store;
    private final AuditLog audit;
    private final Ingestor ingestor;
    private final InboxScanner inboxScanner;
    private final DomainClassifier classifier;
    private final RuleEngine ruleEngine;
    private final PlanBuilder planBuilder;
    private final LedgerClient ledger;
    private final ApprovalGate gate;
    private final TaskStateMachine stateMachine;
    private final ExecutorRegistry executors;
    private final DeferredQueue deferredQueue;
    private final AlertWriter alerts;
    private final DashboardProjector projector;
    private final DashboardRenderer renderer;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private TaskVaultRuntime(Builder builder) {
        this.config = builder.config;
        this.settings = builder.settings == null ? VaultSettings.load(config.settingsFile()) : builder.settings;
        this.clock = builder.clock;
        this.sleeper = builder.sleeper;
        this.store = new StateStore(config);
        this.audit = new AuditLog(config.auditDir(), clock);
        this.ingestor = new Ingestor(store, audit, clock);
        this.inboxScanner = new InboxScanner(config, ingestor, audit);
        this.classifier = new DomainClassifier(builder.signalTable == null
                ? SignalTable.load(config.signalTableFile()) : builder.signalTable);
        this.ruleEngine = new RuleEngine(builder.ruleTable == null
                ? RuleTable.load(config.routingRulesFile()) : builder.ruleTable);
        this.planBuilder = new PlanBuilder(clock);
        this.ledger = builder.ledger;
        ApprovalSignalSource signals = builder.signals == null ? new FileApprovalSignalSource(config) : builder.signals;
        this.gate = new ApprovalGate(signals, builder.drafts, audit, clock);
        this.stateMachine = new TaskStateMachine(store, audit, clock);
        this.executors = builder.executors == null ? ExecutorRegistry.fromSettings(config, settings) : builder.executors;
        this.deferredQueue = new DeferredQueue(config.deferredQueueFile());
        this.alerts = new AlertWriter(gate, clock);
        this.projector = new DashboardProjector(store, gate, deferredQueue, audit, settings.recentActivityLimit(), clock);
        this.renderer = new DashboardRenderer();
    }

    public static Builder builder(TaskVaultConfig config) {
        return new Builder(config);
    }

    public static TaskVaultRuntime open(TaskVaultConfig config) {
        return builder(config).build();
    }

    public TaskVaultConfig config() {
        return config;
    }

    public VaultSettings settings() {
        return settings;
    }

    public void init() {
        store.init();
    }

    /**
     * Admits one item under the run lock, so submissions never race a running cycle.
     */
    public AdmitOutcome submit(IncomingItem item) {
        store.init();
        try (RunLock ignored = RunLock.acquire(config.lockFile())) {
            return ingestor.admit(item);
        }
    }

    public void requestCancel() {
        cancelRequested.set(true);
    }

    /**
     * One pass over the vault: ingest, release cooled-down retries, route and plan pending work,
     * execute what may run, apply human decisions, and rebuild the dashboard.
     */
    public CycleOutcome runCycle() {
        store.init();
        cancelRequested.set(false);
        try (RunLock ignored = RunLock.acquire(config.lockFile());
             TimeLimitedExecution execution = new TimeLimitedExecution()) {
            CycleOutcome.Counters counters = new CycleOutcome.Counters(clock.instant());
            audit.log(AuditEvent.success(AuditActions.CYCLE_START, ACTOR, config.rootDir().toString(), Map.of()));
            EscalationLadder ladder = new EscalationLadder(settings, sleeper, execution, store, deferredQueue, alerts,
                    audit, clock);

            for (AdmitOutcome outcome : inboxScanner.scan()) {
                if (outcome.accepted()) {
                    counters.admitted++;
                } else {
                    counters.duplicatesSkipped++;
                }
            }
            releaseCooledDown(counters);
            for (TaskRecord task : store.listActive(TaskStatus.PENDING)) {
                if (cancelled(counters)) {
                    break;
                }
                processPending(task, ladder, counters);
            }
            if (!cancelled(counters)) {
                applyDecisions(ladder, counters);
            }
            rebuildDashboard();

            CycleOutcome outcome = counters.finish(clock.instant());
            audit.log(AuditEvent.success(AuditActions.CYCLE_END, ACTOR, config.rootDir().toString(), Map.of(
                    "processed", outcome.processed(),
                    "completed", outcome.completed(),
                    "requeued", outcome.requeued(),
                    "deferred", outcome.deferred(),
                    "cancelled", outcome.cancelled())));
            log.info("Cycle finished: processed={} completed={} awaiting={} requeued={} deferred={}",
                    outcome.processed(), outcome.completed(), outcome.awaitingApproval(), outcome.requeued(),
                    outcome.deferred());
            return outcome;
        }
    }

    public DashboardView rebuildDashboard() {
        DashboardView view = projector.project();
        renderer.write(view, config.dashboardFile());
        audit.log(AuditEvent.success(AuditActions.DASHBOARD_UPDATE, ACTOR, config.dashboardFile().getFileName().toString(),
                Map.of("active", view.activeCounts().values().stream().mapToInt(Integer::intValue).sum())));
        return view;
    }

    public String renderDashboard() {
        return renderer.render(projector.project());
    }

    public List<TaskRecord> tasks(boolean includeArchived) {
        List<TaskRecord> out = new ArrayList<>(store.listActive());
        if (includeArchived) {
            out.addAll(store.listArchived());
        }
        return out;
    }

    public Optional<TaskRecord> task(String name) {
        return store.find(name);
    }

    public List<PlanRecord> plansFor(TaskRecord task) {
        return task.planRefs().stream().map(store::findPlan).flatMap(Optional::stream).toList();
    }

    public List<ApprovalRequest> approvals() {
        return gate.all();
    }

    public List<DeferredEntry> deferredEntries() {
        return deferredQueue.list();
    }

    public List<AuditEntry> auditTail(int limit) {
        return audit.recent(limit);
    }

    private boolean cancelled(CycleOutcome.Counters counters) {
        if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
            if (!counters.cancelled) {
                log.warn("Cycle cancellation requested; stopping after the current task");
            }
            counters.cancelled = true;
        }
        return counters.cancelled;
    }

    private void releaseCooledDown(CycleOutcome.Counters counters) {
        Instant now = clock.instant();
        for (TaskRecord task : store.listActive(TaskStatus.RETRY_QUEUED)) {
            if (cancelled(counters)) {
                return;
            }
            if (task.coolingDown(now)) {
                log.debug("Task {} cooling down until {}", task.name(), task.retryAfter());
                continue;
            }
            stateMachine.transition(task, TaskStatus.PENDING, "cooldown elapsed");
            counters.releasedFromCooldown++;
        }
    }

    private void processPending(TaskRecord task, EscalationLadder ladder, CycleOutcome.Counters counters) {
        String content = store.readContent(task.name());
        Classification classification = classifier.classify(content, task.source(), task.metadata());
        Map<String, Object> classParams = new LinkedHashMap<>();
        classParams.put("domain", classification.domain().wireName());
        classParams.put("sensitive", classification.sensitive());
        classParams.put("category", classification.category());
        classParams.put("monetary", classification.monetary());
        classParams.put("urgent", classification.urgent());
        classParams.put("table_version", classification.tableVersion());
        audit.log(AuditEvent.success(AuditActions.CLASSIFICATION, "classifier", task.name(), classParams));

        RoutingDecision decision = ruleEngine.evaluate(classification, task.source(), task.metadata(), content);
        Map<String, Object> ruleParams = new LinkedHashMap<>();
        ruleParams.put("rule", decision.ruleLabel());
        ruleParams.put("domain", decision.domain().wireName());
        ruleParams.put("priority", decision.priority().wireName());
        ruleParams.put("require_approval", decision.requireApproval());
        ruleParams.put("split", decision.split());
        ruleParams.put("table_version", ruleEngine.tableVersion());
        audit.log(decision.matched()
                ? AuditEvent.success(AuditActions.RULE_APPLIED, "rule_engine", task.name(), ruleParams)
                : AuditEvent.skip(AuditActions.RULE_APPLIED, "rule_engine", task.name(), ruleParams));

        List<LedgerFinding> findings = new ArrayList<>();
        for (LedgerCheck check : decision.ledgerChecks()) {
            LedgerFinding finding = ledger.check(check, new LedgerClient.LedgerQuery(task.name(), content, task.metadata()));
            findings.add(finding);
            audit.log(AuditEvent.success(AuditActions.LEDGER_CHECK, "ledger", task.name(), Map.of(
                    "check", check.wireName(),
                    "available", finding.available(),
                    "summary", finding.summary())));
        }

        List<Domain> domains = task.pendingDomains().isEmpty() ? decision.planDomains() : task.pendingDomains();
        List<PlanRecord> plans = planBuilder.build(task, content, classification, decision, domains, findings);
        for (PlanRecord plan : plans) {
            store.savePlan(plan);
            audit.log(AuditEvent.success(AuditActions.PLAN_CREATED, "planner", plan.id(), Map.of(
                    "task", task.name(),
                    "domain", plan.domain().wireName(),
                    "checklist_items", plan.checklist().size())));
        }

        TaskRecord routed = task.withRouting(decision.domain(), classification.sensitive(), decision.priority(),
                classification.category(), decision.ruleId(), plans.stream().map(PlanRecord::id).toList(), clock.instant());
        store.saveTask(routed);
        TaskRecord processing = stateMachine.transition(routed, TaskStatus.PROCESSING, "classified and planned");
        counters.processed++;

        boolean approvalRequired = classification.sensitive() || decision.requireApproval();
        if (approvalRequired) {
            for (PlanRecord plan : plans) {
                String approvalId = gate.requestForPlan(plan, PlanActions.actionFor(plan));
                store.savePlan(plan.withApprovalRef(approvalId, clock.instant())
                        .withChecklistDone(PlanBuilder.ITEM_APPROVAL, clock.instant()));
            }
            String reason = decision.requireApproval() ? "rule " + decision.ruleLabel() : "sensitive";
            stateMachine.transition(processing, TaskStatus.AWAITING_APPROVAL, reason);
            counters.awaitingApproval++;
            return;
        }
        TaskRecord ready = stateMachine.transition(processing, TaskStatus.READY_TO_EXECUTE, "not sensitive");
        execute(ready, plans, ladder, counters);
    }

    /**
     * Applies human decisions. Plan approvals are handled once every plan of the task has been
     * decided; alert decisions replay or dismiss the deferred entry they point at.
     */
    private void applyDecisions(EscalationLadder ladder, CycleOutcome.Counters counters) {
        ApprovalPollResult poll = gate.poll();
        Map<String, ApprovalStatus> decided = new HashMap<>();
        List<ApprovalRequest> alertDecisions = new ArrayList<>();
        for (ApprovalRequest request : poll.approved()) {
            if (request.isAlert()) {
                alertDecisions.add(request);
            } else {
                decided.put(request.id(), ApprovalStatus.APPROVED);
            }
        }
        for (ApprovalRequest request : poll.rejected()) {
            if (request.isAlert()) {
                alertDecisions.add(request);
            } else {
                decided.put(request.id(), ApprovalStatus.REJECTED);
            }
        }

        for (TaskRecord task : store.listActive(TaskStatus.AWAITING_APPROVAL)) {
            if (cancelled(counters)) {
                return;
            }
            List<PlanRecord> plans = plansFor(task);
            boolean allDecided = plans.stream().allMatch(plan -> plan.status() != PlanStatus.OPEN
                    || (plan.approvalRef() != null && decided.containsKey(plan.approvalRef())));
            if (!allDecided) {
                continue;
            }
            List<PlanRecord> approved = new ArrayList<>();
            for (PlanRecord plan : plans) {
                if (plan.status() != PlanStatus.OPEN) {
                    continue;
                }
                ApprovalStatus status = decided.get(plan.approvalRef());
                audit.log(AuditEvent.success(AuditActions.APPROVAL_OBSERVED, "approval_gate", plan.approvalRef(),
                        Map.of("plan", plan.id(), "task", task.name())).withApproval(status));
                if (status == ApprovalStatus.REJECTED) {
                    store.savePlan(plan.withStatus(PlanStatus.REJECTED, clock.instant()));
                } else {
                    approved.add(plan);
                }
            }
            execute(task, approved, ladder, counters);
        }

        for (ApprovalRequest alert : alertDecisions) {
            if (cancelled(counters)) {
                return;
            }
            resolveAlert(alert, ladder, counters);
        }
    }

    private void resolveAlert(ApprovalRequest alert, EscalationLadder ladder, CycleOutcome.Counters counters) {
        Optional<DeferredEntry> found = deferredQueue.find(alert.deferredEntryId());
        if (found.isEmpty()) {
            log.warn("Alert {} points at unknown deferred entry {}", alert.id(), alert.deferredEntryId());
            return;
        }
        DeferredEntry entry = found.get();
        if (entry.status() != DeferredStatus.DEFERRED || !alert.id().equals(entry.alertRef())) {
            return;
        }
        if (alert.status() == ApprovalStatus.APPROVED) {
            LadderOutcome outcome = ladder.replay(entry, executors.forAction(entry.action()));
            if (outcome.state() == LadderState.FATAL) {
                throw new TaskVaultLogicException("Logic failure replaying " + entry.id() + ": "
                        + outcome.describeFailure());
            }
            if (!outcome.succeeded()) {
                return;
            }
            counters.alertsResolved++;
            store.findPlan(entry.payload().planId()).ifPresent(plan -> store.savePlan(
                    plan.withChecklistDone(PlanBuilder.ITEM_EXECUTE, clock.instant())
                            .withStatus(PlanStatus.COMPLETE, clock.instant())));
        } else {
            ladder.dismiss(entry);
            counters.alertsDismissed++;
        }
        settleDeferredTask(entry.payload().task(), counters);
    }

    /**
     * A deferred task leaves the active set once none of its entries wait on a human. When every
     * entry resolved it settles like any executed task (partial if a sibling plan was rejected);
     * when any was dismissed it is archived as deferred.
     */
    private void settleDeferredTask(String taskName, CycleOutcome.Counters counters) {
        Optional<TaskRecord> found = store.findActive(taskName);
        if (found.isEmpty() || found.get().status() != TaskStatus.DEFERRED) {
            return;
        }
        TaskRecord task = found.get();
        List<DeferredEntry> entries = deferredQueue.forTask(taskName);
        boolean waiting = entries.stream().anyMatch(entry -> entry.status() == DeferredStatus.DEFERRED
                || entry.status() == DeferredStatus.RETRIED);
        if (waiting) {
            return;
        }
        boolean dismissed = entries.stream().anyMatch(entry -> entry.status() == DeferredStatus.DISMISSED);
        if (dismissed) {
            stateMachine.archive(task, "deferred entry dismissed");
            return;
        }
        TaskStatus terminal = terminalStatus(plansFor(task));
        TaskRecord done = stateMachine.transition(task, terminal, "deferred action replayed");
        finishPlans(done);
        stateMachine.archive(done, terminal.wireName());
        if (terminal == TaskStatus.PARTIAL) {
            counters.partial++;
        } else {
            counters.completed++;
        }
    }

    private void execute(TaskRecord task, List<PlanRecord> plans, EscalationLadder ladder, CycleOutcome.Counters counters) {
        String content = store.readContent(task.name());
        List<Domain> requeueDomains = new ArrayList<>();
        LadderOutcome requeueFailure = null;
        boolean deferred = false;
        for (PlanRecord plan : plans) {
            ActionPayload payload = payloadFor(plan, content);
            LadderOutcome outcome = ladder.run(task, payload, executors.forAction(payload.action()));
            switch (outcome.state()) {
                case SUCCEEDED -> store.savePlan(plan.withChecklistDone(PlanBuilder.ITEM_EXECUTE, clock.instant())
                        .withStatus(PlanStatus.COMPLETE, clock.instant()));
                case REQUEUE -> {
                    requeueDomains.add(plan.domain());
                    requeueFailure = outcome;
                }
                case DEFER -> {
                    deferred = true;
                    store.savePlan(plan.withNotes(plan.agentNotes() + "\nDeferred: " + outcome.deferredEntryId(), clock.instant()));
                }
                case FATAL -> throw new TaskVaultLogicException("Logic failure executing " + plan.id() + ": "
                        + outcome.describeFailure());
                default -> throw new IllegalStateException("Ladder ended in non-final state " + outcome.state());
            }
        }

        if (requeueFailure != null) {
            TaskRecord followUp = ladder.requeue(task, requeueDomains, requeueFailure);
            TaskRecord queued = stateMachine.transition(task, TaskStatus.RETRY_QUEUED, requeueFailure.describeFailure());
            stateMachine.archive(queued.withRequeuedAs(followUp.name(), requeueFailure.describeFailure(), clock.instant()),
                    "requeued as " + followUp.name());
            counters.requeued++;
            return;
        }
        if (deferred) {
            stateMachine.transition(task, TaskStatus.DEFERRED, "action deferred for human follow-up");
            counters.deferred++;
            return;
        }
        TaskStatus terminal = terminalStatus(plansFor(task));
        TaskRecord done = stateMachine.transition(task, terminal, "all plans settled");
        finishPlans(done);
        stateMachine.archive(done, terminal.wireName());
        switch (terminal) {
            case COMPLETE -> counters.completed++;
            case PARTIAL -> counters.partial++;
            default -> counters.rejected++;
        }
    }

    static TaskStatus terminalStatus(List<PlanRecord> plans) {
        boolean anyComplete = plans.stream().anyMatch(plan -> plan.status() == PlanStatus.COMPLETE);
        boolean anyRejected = plans.stream().anyMatch(plan -> plan.status() == PlanStatus.REJECTED);
        if (anyComplete && anyRejected) {
            return TaskStatus.PARTIAL;
        }
        if (anyRejected) {
            return TaskStatus.REJECTED;
        }
        return TaskStatus.COMPLETE;
    }

    private void finishPlans(TaskRecord task) {
        Instant now = clock.instant();
        for (PlanRecord plan : plansFor(task)) {
            store.savePlan(plan.withChecklistDone(PlanBuilder.ITEM_DASHBOARD, now).withChecklistDone(PlanBuilder.ITEM_DONE, now));
        }
    }

    private static ActionPayload payloadFor(PlanRecord plan, String content) {
        return new ActionPayload(
                PlanActions.actionFor(plan),
                plan.task(),
                plan.id(),
                plan.domain(),
                plan.source(),
                plan.category(),
                plan.priority(),
                plan.sensitive(),
                content,
                plan.approvalRef()
        );
    }

    public static final class Builder {
        private final TaskVaultConfig config;
        private VaultSettings settings;
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.SYSTEM;
        private LedgerClient ledger = new OfflineLedgerClient();
        private DraftComposer drafts = new TemplateDraftComposer();
        private ApprovalSignalSource signals;
        private ExecutorRegistry executors;
        private SignalTable signalTable;
        private RuleTable ruleTable;

        private Builder(TaskVaultConfig config) {
            this.config = config;
        }

        public Builder settings(VaultSettings value) {
            this.settings = value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public Builder sleeper(Sleeper value) {
            this.sleeper = value;
            return this;
        }

        public Builder ledger(LedgerClient value) {
            this.ledger = value;
            return this;
        }

        public Builder drafts(DraftComposer value) {
            this.drafts = value;
            return this;
        }

        public Builder signals(ApprovalSignalSource value) {
            this.signals = value;
            return this;
        }

        public Builder executors(ExecutorRegistry value) {
            this.executors = value;
            return this;
        }

        public Builder signalTable(SignalTable value) {
            this.signalTable = value;
            return this;
        }

        public Builder ruleTable(RuleTable value) {
            this.ruleTable = value;
            return this;
        }

        public TaskVaultRuntime build() {
            return new TaskVaultRuntime(this);
        }
    }
}
