package io.taskvault.approval;

import io.taskvault.model.PlanRecord;

/**
 * Produces the draft a human reviews before approving an action (email reply, post, payment note).
 */
public interface DraftComposer {
    String compose(PlanRecord plan, String action);
}
