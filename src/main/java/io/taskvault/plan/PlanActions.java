package io.taskvault.plan;

import io.taskvault.model.PlanRecord;
import io.taskvault.model.SourceTag;

/**
 * Name of the outside action a plan performs. Executors and the critical-action list are keyed on it.
 */
public final class PlanActions {
    public static final String PAYMENT = "payment";
    public static final String SEND_EMAIL = "send_email";
    public static final String SOCIAL_POST = "social_post";
    public static final String SEND_MESSAGE = "send_message";
    public static final String PROCESS_TASK = "process_task";

    private PlanActions() {
    }

    public static String actionFor(PlanRecord plan) {
        if (PAYMENT.equals(plan.category())) {
            return PAYMENT;
        }
        SourceTag source = plan.source() == null ? SourceTag.INBOX : plan.source();
        return switch (source) {
            case EXTERNAL_EMAIL -> SEND_EMAIL;
            case EXTERNAL_SOCIAL -> SOCIAL_POST;
            case BUSINESS_MESSAGING -> SEND_MESSAGE;
            case INBOX -> PROCESS_TASK;
        };
    }
}
