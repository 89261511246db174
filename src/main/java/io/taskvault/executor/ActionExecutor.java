package io.taskvault.executor;

/**
 * Performs one side-effecting action against an outside system. Failures are reported as
 * {@link ActionResult#fail(String, String)} or by throwing {@link ActionFailureException};
 * the error class decides how the failure is escalated.
 */
public interface ActionExecutor {
    String id();

    ActionResult execute(ActionRequest request) throws Exception;
}
