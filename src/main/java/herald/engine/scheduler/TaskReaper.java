package herald.engine.scheduler;

import herald.engine.model.DispatchOutcome;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TransitionResult;
import herald.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that closes out dispatches lost to a crash.
 *
 * A task can be left RUNNING if the process dies between markRunning and
 * markTerminal. Its trigger is already gone, so it will never fire again.
 * The reaper marks such tasks FAILED once their startedAt is older than the
 * threshold. The dispatcher restamps startedAt when it picks a task up, and
 * the FAILED update re-checks the stamp, so a dispatch that began after the
 * scan is never closed under it. Reaped tasks are never re-dispatched.
 */
public class TaskReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskReaper.class);

    static final String REAPED_ERROR = "dispatch interrupted: task exceeded running threshold";

    private final TaskRepository taskRepository;
    private final Duration threshold;
    private final Clock clock;

    public TaskReaper(TaskRepository taskRepository, Duration threshold, Clock clock) {
        this.taskRepository = taskRepository;
        this.threshold = threshold;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckTasks();
        } catch (Exception e) {
            log.error("Task reaper error", e);
        }
    }

    /**
     * Find RUNNING tasks older than the threshold and mark them FAILED.
     *
     * @return number of tasks closed
     */
    public int reapStuckTasks() {
        Instant cutoff = clock.instant().minus(threshold);

        List<ScheduledTask> stuck = taskRepository.findStuckRunning(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck tasks found");
            return 0;
        }

        int failed = 0;
        for (ScheduledTask task : stuck) {
            try {
                TransitionResult res = taskRepository.failStuck(task.id(), cutoff, DispatchOutcome.failed(REAPED_ERROR));
                if (res == TransitionResult.APPLIED) {
                    failed++;
                    log.warn("Task {} stuck in RUNNING since {}, marked FAILED", task.id(), task.startedAt());
                } else {
                    log.debug("Task {} finished or restarted dispatch before it was reaped ({})", task.id(), res);
                }
            } catch (Exception e) {
                log.error("Failed to reap task {}", task.id(), e);
            }
        }

        log.info("Task reaper: {} failed, {} total stuck", failed, stuck.size());

        return failed;
    }
}
