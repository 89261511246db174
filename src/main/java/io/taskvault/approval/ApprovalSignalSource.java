package io.taskvault.approval;

import io.taskvault.model.ApprovalRequest;

import java.util.List;
import java.util.Optional;

/**
 * Where human decisions are observed. Implementations report; they never decide.
 */
public interface ApprovalSignalSource {
    /**
     * Every known request, with {@code status} set to what the human has signalled so far.
     */
    List<ApprovalRequest> observe();

    Optional<ApprovalRequest> find(String id);

    /**
     * Persists a newly created request into the pending pool.
     */
    void publish(ApprovalRequest request, String markdown);
}
