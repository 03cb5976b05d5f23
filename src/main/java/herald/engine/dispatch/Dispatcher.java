package herald.engine.dispatch;

import herald.engine.model.DispatchOutcome;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TransitionResult;
import herald.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes a fired task against its platform publisher and records the
 * terminal outcome.
 *
 * Guarantees for every task passed to {@link #execute(ScheduledTask)}:
 * - the publisher is called at most once, and waited on for at most the timeout
 * - the publisher is never called for a task that is no longer RUNNING
 * - {@code markTerminal} is called exactly once after a publish attempt
 * - nothing is retried; a failed task stays FAILED
 */
public class Dispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final TaskRepository taskRepository;
    private final PublisherRegistry publishers;
    private final Duration timeout;
    private final ExecutorService callExecutor;

    public Dispatcher(TaskRepository taskRepository, PublisherRegistry publishers, Duration timeout) {
        this.taskRepository = taskRepository;
        this.publishers = publishers;
        this.timeout = timeout;
        AtomicInteger seq = new AtomicInteger();
        // publisher calls run here so the dispatching thread can stop waiting on timeout
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "herald-publish-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Publish the task and write its terminal status.
     * Never throws for publisher faults; they become FAILED outcomes.
     *
     * @param task a task already moved to RUNNING
     * @return the outcome that was recorded, or a FAILED outcome describing
     *         why the task was skipped when it had already left RUNNING
     */
    public DispatchOutcome execute(ScheduledTask task) {
        long startNanos = System.nanoTime();

        TransitionResult started;
        try {
            started = taskRepository.beginDispatch(task.id());
        } catch (RuntimeException e) {
            log.error("Could not start dispatch of task {}", task.id(), e);
            DispatchOutcome outcome = DispatchOutcome.failed("could not start dispatch: " + describe(e));
            record(task, outcome, (System.nanoTime() - startNanos) / 1_000_000);
            return outcome;
        }
        if (started != TransitionResult.APPLIED) {
            // reaped while waiting for a dispatch thread, or deleted
            log.warn("Task {} no longer RUNNING ({}), not published", task.id(), started);
            return DispatchOutcome.failed("task no longer running; not published");
        }

        DispatchOutcome outcome;
        boolean interrupted = false;

        try {
            outcome = invoke(task);
        } catch (InterruptedException e) {
            interrupted = true;
            outcome = DispatchOutcome.failed("dispatch interrupted before the publisher answered");
        } catch (Throwable t) {
            log.error("Unexpected error dispatching task {}", task.id(), t);
            outcome = DispatchOutcome.failed("unexpected dispatch error: " + t.getClass().getSimpleName());
        }

        record(task, outcome, (System.nanoTime() - startNanos) / 1_000_000);

        if (interrupted) {
            // restored only after the outcome is stored
            Thread.currentThread().interrupt();
        }
        return outcome;
    }

    private DispatchOutcome invoke(ScheduledTask task) throws InterruptedException {
        String platform = task.platform().name();
        Optional<PlatformPublisher> publisher = publishers.find(platform);
        if (publisher.isEmpty()) {
            log.warn("No publisher for platform '{}' (task {})", platform, task.id());
            return DispatchOutcome.failed("no publisher registered for platform '" + platform + "'");
        }

        PublishRequest request = PublishRequest.from(task);
        Future<PublishResult> call = callExecutor.submit(() -> publisher.get().publish(request));

        try {
            PublishResult result = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return DispatchOutcome.failed("publisher for '" + platform + "' returned no result");
            }
            return result.isSuccess()
                    ? DispatchOutcome.succeeded(result.response())
                    : DispatchOutcome.failed(result.error());
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Publish of task {} to '{}' timed out after {}ms", task.id(), platform, timeout.toMillis());
            return DispatchOutcome.failed("publish to '" + platform + "' timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Publisher for '{}' threw on task {}: {}", platform, task.id(), cause.toString());
            return DispatchOutcome.failed("publish to '" + platform + "' failed: " + describe(cause));
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    private void record(ScheduledTask task, DispatchOutcome outcome, long elapsedMs) {
        try {
            TransitionResult res = taskRepository.markTerminal(task.id(), outcome);
            if (res == TransitionResult.APPLIED) {
                log.info("Task {} {} on '{}' in {}ms", task.id(), outcome.status(), task.platform().name(), elapsedMs);
            } else {
                // the reaper may already have closed a dispatch that outlived its threshold
                log.warn("Task {} outcome {} not recorded: {}", task.id(), outcome.status(), res);
            }
        } catch (RuntimeException e) {
            // left RUNNING; TaskReaper closes it once it passes the stuck threshold
            log.error("Failed to record outcome {} for task {}", outcome.status(), task.id(), e);
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank()
                ? t.getClass().getSimpleName()
                : t.getClass().getSimpleName() + ": " + message;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
