package io.taskvault.observability;

/**
 * Action types written to the audit log.
 */
public final class AuditActions {
    public static final String FILE_WRITE = "file_write";
    public static final String DEDUP_SKIP = "dedup_skip";
    public static final String INBOX_CONSUMED = "inbox_consumed";
    public static final String STATUS_TRANSITION = "status_transition";
    public static final String CLASSIFICATION = "classification";
    public static final String RULE_APPLIED = "rule_applied";
    public static final String LEDGER_CHECK = "ledger_check";
    public static final String PLAN_CREATED = "plan_created";
    public static final String APPROVAL_REQUESTED = "approval_requested";
    public static final String APPROVAL_OBSERVED = "approval_observed";
    public static final String EXECUTION_ATTEMPT = "execution_attempt";
    public static final String REQUEUE = "requeue";
    public static final String DEFERRED = "deferred";
    public static final String ALERT_CREATED = "alert_created";
    public static final String DEFERRED_RESOLUTION = "deferred_resolution";
    public static final String ARCHIVE = "archive";
    public static final String CYCLE_START = "cycle_start";
    public static final String CYCLE_END = "cycle_end";
    public static final String DASHBOARD_UPDATE = "dashboard_update";

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_FAIL = "fail";
    public static final String RESULT_SKIP = "skip";

    public static final String APPROVAL_NOT_APPLICABLE = "n_a";

    private AuditActions() {
    }
}
