package io.taskvault.observability;

import io.taskvault.model.ApprovalStatus;

import java.util.Map;

/**
 * What a component asks the audit log to record. The log stamps time and the hash chain.
 */
public record AuditEvent(
        String actionType,
        String actor,
        String target,
        Map<String, Object> parameters,
        String approvalStatus,
        String result,
        String error
) {
    public AuditEvent {
        parameters = parameters == null ? Map.of() : parameters;
        approvalStatus = approvalStatus == null ? AuditActions.APPROVAL_NOT_APPLICABLE : approvalStatus;
    }

    public static AuditEvent success(String actionType, String actor, String target, Map<String, Object> parameters) {
        return new AuditEvent(actionType, actor, target, parameters, null, AuditActions.RESULT_SUCCESS, null);
    }

    public static AuditEvent skip(String actionType, String actor, String target, Map<String, Object> parameters) {
        return new AuditEvent(actionType, actor, target, parameters, null, AuditActions.RESULT_SKIP, null);
    }

    public static AuditEvent fail(String actionType, String actor, String target, Map<String, Object> parameters, String error) {
        return new AuditEvent(actionType, actor, target, parameters, null, AuditActions.RESULT_FAIL, error);
    }

    public AuditEvent withApproval(ApprovalStatus status) {
        return new AuditEvent(actionType, actor, target, parameters,
                status == null ? AuditActions.APPROVAL_NOT_APPLICABLE : status.poolName(), result, error);
    }
}
