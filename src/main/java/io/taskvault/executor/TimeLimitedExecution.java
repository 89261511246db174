package io.taskvault.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs executor calls on a worker thread and gives up after the caller's timeout. Every
 * outcome, including exceptions thrown by the executor, comes back as an {@link ActionResult}.
 * A timed-out worker is abandoned and replaced, so an executor that ignores interruption cannot
 * hold up the calls after it.
 */
public final class TimeLimitedExecution implements AutoCloseable {
    public static final String UNEXPECTED = "unexpected_exception";
    private static final Logger log = LoggerFactory.getLogger(TimeLimitedExecution.class);

    private ExecutorService worker;

    public TimeLimitedExecution() {
        this.worker = newWorker();
    }

    private static ExecutorService newWorker() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "taskvault-executor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized ActionResult run(ActionExecutor executor, ActionRequest request) throws InterruptedException {
        Future<ActionResult> future = worker.submit(() -> executor.execute(request));
        Duration timeout = request.timeout();
        try {
            ActionResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ActionResult.fail(UNEXPECTED, executor.id() + " returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            worker.shutdownNow();
            worker = newWorker();
            log.warn("Executor {} timed out after {}; worker replaced", executor.id(), timeout);
            return ActionResult.fail("timeout", executor.id() + " timed out after " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof ActionFailureException failure) {
                return ActionResult.fail(failure.errorClass(), failure.getMessage());
            }
            log.warn("Executor {} threw {}", executor.id(), cause.toString());
            return ActionResult.fail(UNEXPECTED, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public synchronized void close() {
        worker.shutdownNow();
    }
}
