package herald.engine.scheduler;

import herald.engine.dispatch.Dispatcher;
import herald.engine.model.DispatchOutcome;
import herald.engine.model.JobTrigger;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TransitionResult;
import herald.engine.repository.TaskRepository;
import herald.engine.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One poll cycle of the scheduler: fire every trigger that is due.
 *
 * For each due trigger, in (fireAt, taskId) order:
 * 1. markRunning - the compare-and-set that lets only one poller win
 * 2. winner: remove the trigger, then hand the task to the dispatch executor
 * 3. loser (CONFLICT / NOT_FOUND): remove the stale trigger, do nothing else
 *
 * Dispatch is asynchronous; a cycle never waits for a publisher.
 */
public class TriggerPoller {

    private static final Logger log = LoggerFactory.getLogger(TriggerPoller.class);

    private final TaskRepository taskRepository;
    private final TriggerRepository triggerRepository;
    private final Dispatcher dispatcher;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final int batchSize;

    private final AtomicBoolean polling = new AtomicBoolean(false);

    public TriggerPoller(TaskRepository taskRepository,
            TriggerRepository triggerRepository,
            Dispatcher dispatcher,
            Executor dispatchExecutor,
            Clock clock,
            int batchSize) {
        this.taskRepository = taskRepository;
        this.triggerRepository = triggerRepository;
        this.dispatcher = dispatcher;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    /**
     * Run one cycle. Not reentrant: a call made while another cycle is in
     * progress returns 0 immediately.
     *
     * @return number of tasks handed to the dispatcher
     */
    public int pollOnce() {
        if (!polling.compareAndSet(false, true)) {
            log.debug("Poll cycle already in progress, skipping");
            return 0;
        }
        try {
            return fireDue(clock.instant());
        } finally {
            polling.set(false);
        }
    }

    private int fireDue(Instant now) {
        List<JobTrigger> due = new ArrayList<>(triggerRepository.due(now, batchSize));
        if (due.isEmpty()) {
            log.debug("No due triggers at {}", now);
            return 0;
        }
        due.sort(JobTrigger.FIRING_ORDER);

        int fired = 0;
        for (JobTrigger trigger : due) {
            try {
                if (fire(trigger)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                // trigger stays in the store; the next cycle retries it
                log.error("Failed to fire trigger for task {}", trigger.taskId(), e);
            }
        }

        log.debug("Poll cycle: {} due, {} dispatched", due.size(), fired);
        return fired;
    }

    private boolean fire(JobTrigger trigger) {
        String taskId = trigger.taskId();
        TransitionResult claim = taskRepository.markRunning(taskId);

        if (claim != TransitionResult.APPLIED) {
            triggerRepository.remove(taskId);
            log.info("Dropped stale trigger for task {} ({})", taskId, claim);
            return false;
        }

        // the task is ours from here on: whatever fails below must still end in a terminal status
        removeQuietly(taskId);

        Optional<ScheduledTask> task;
        try {
            task = taskRepository.findById(taskId);
        } catch (RuntimeException e) {
            log.error("Task {} claimed but could not be loaded", taskId, e);
            failClaimed(taskId, "task record could not be loaded: " + e.getMessage());
            return false;
        }
        if (task.isEmpty()) {
            log.warn("Task {} vanished after being claimed", taskId);
            return false;
        }

        long lateMs = clock.millis() - trigger.fireAt().toEpochMilli();
        if (lateMs > 1000) {
            log.info("Firing task {} {}ms late", taskId, lateMs);
        }

        ScheduledTask claimed = task.get();
        try {
            dispatchExecutor.execute(() -> dispatcher.execute(claimed));
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch pool rejected task {} (shutting down)", taskId);
            failClaimed(taskId, "scheduler shut down before dispatch");
            return false;
        }
        return true;
    }

    private void removeQuietly(String taskId) {
        try {
            triggerRepository.remove(taskId);
        } catch (RuntimeException e) {
            // a leftover trigger is harmless: markRunning will report CONFLICT next cycle
            log.warn("Could not remove trigger of claimed task {}: {}", taskId, e.getMessage());
        }
    }

    private void failClaimed(String taskId, String error) {
        try {
            taskRepository.markTerminal(taskId, DispatchOutcome.failed(error));
        } catch (RuntimeException e) {
            log.error("Could not mark task {} FAILED; the reaper will close it", taskId, e);
        }
    }
}
