package io.taskvault.executor;

import io.taskvault.model.ActionPayload;
import io.taskvault.model.Domain;
import io.taskvault.model.Priority;
import io.taskvault.model.SourceTag;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

final class TimeLimitedExecutionTest {

    private static ActionRequest request(Duration timeout) {
        ActionPayload payload = new ActionPayload("process_task", "INBOX_T", "PLAN_INBOX_T", Domain.PERSONAL,
                SourceTag.INBOX, "general", Priority.LOW, false, "Water the plants", null);
        return new ActionRequest(payload, 1, timeout);
    }

    private static ActionExecutor executor(String id, ActionExecutorBody body) {
        return new ActionExecutor() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public ActionResult execute(ActionRequest request) throws Exception {
                return body.run();
            }
        };
    }

    @FunctionalInterface
    private interface ActionExecutorBody {
        ActionResult run() throws Exception;
    }

    @Test
    void slowExecutorTimesOut() throws Exception {
        try (TimeLimitedExecution execution = new TimeLimitedExecution()) {
            ActionResult result = execution.run(executor("slow", () -> {
                Thread.sleep(5_000);
                return ActionResult.ok("late");
            }), request(Duration.ofMillis(100)));

            Assertions.assertFalse(result.success());
            Assertions.assertEquals("timeout", result.errorClass());
        }
    }

    @Test
    void executorIgnoringInterruptDoesNotBlockTheNextCall() throws Exception {
        try (TimeLimitedExecution execution = new TimeLimitedExecution()) {
            ActionResult stuck = execution.run(executor("stubborn", () -> {
                long until = System.nanoTime() + Duration.ofMillis(1_500).toNanos();
                long spins = 0;
                while (System.nanoTime() < until) {
                    spins++;
                }
                return ActionResult.ok("spun " + spins);
            }), request(Duration.ofMillis(200)));
            ActionResult next = execution.run(executor("fast", () -> ActionResult.ok("done")),
                    request(Duration.ofMillis(500)));

            Assertions.assertEquals("timeout", stuck.errorClass());
            Assertions.assertTrue(next.success());
            Assertions.assertEquals("done", next.output());
        }
    }

    @Test
    void classifiedFailuresKeepTheirClass() throws Exception {
        try (TimeLimitedExecution execution = new TimeLimitedExecution()) {
            ActionResult result = execution.run(executor("smtp", () -> {
                throw new ActionFailureException("auth_failure", "bad credentials");
            }), request(Duration.ofSeconds(5)));

            Assertions.assertEquals("auth_failure", result.errorClass());
            Assertions.assertEquals("bad credentials", result.error());
        }
    }

    @Test
    void otherExceptionsBecomeUnexpected() throws Exception {
        try (TimeLimitedExecution execution = new TimeLimitedExecution()) {
            ActionResult thrown = execution.run(executor("broken", () -> {
                throw new IllegalStateException("boom");
            }), request(Duration.ofSeconds(5)));
            ActionResult empty = execution.run(executor("silent", () -> null), request(Duration.ofSeconds(5)));
            ActionResult ok = execution.run(executor("fine", () -> ActionResult.ok("done")), request(Duration.ofSeconds(5)));

            Assertions.assertEquals(TimeLimitedExecution.UNEXPECTED, thrown.errorClass());
            Assertions.assertTrue(thrown.error().contains("boom"));
            Assertions.assertEquals(TimeLimitedExecution.UNEXPECTED, empty.errorClass());
            Assertions.assertTrue(ok.success());
        }
    }
}
