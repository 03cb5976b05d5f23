package herald.engine.scheduler;

import herald.engine.config.HeraldConfig;
import herald.engine.dispatch.Dispatcher;
import herald.engine.repository.TaskRepository;
import herald.engine.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives the background work of the engine:
 * - TriggerPoller: fires due triggers every poll interval
 * - TaskReaper: fails tasks left RUNNING by a crash
 *
 * Both run on one scheduler thread, so a poll cycle never overlaps another.
 * Dispatches run on a separate bounded pool.
 */
public class SchedulerEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    private final ScheduledExecutorService executor;
    private final ExecutorService dispatchPool;
    private final TriggerPoller poller;
    private final TaskReaper taskReaper;
    private final HeraldConfig config;

    private volatile boolean running = false;

    public SchedulerEngine(TaskRepository taskRepository,
            TriggerRepository triggerRepository,
            Dispatcher dispatcher,
            HeraldConfig config,
            Clock clock) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "herald-scheduler");
            t.setDaemon(true);
            return t;
        });
        AtomicInteger seq = new AtomicInteger();
        this.dispatchPool = Executors.newFixedThreadPool(config.dispatchThreads(), r -> {
            Thread t = new Thread(r, "herald-dispatch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.poller = new TriggerPoller(taskRepository, triggerRepository, dispatcher, dispatchPool, clock,
                config.pollBatchSize());
        this.taskReaper = new TaskReaper(taskRepository, config.stuckRunningThreshold(), clock);
        this.config = config;
    }

    /**
     * Start polling. The first cycle runs immediately, so triggers that came
     * due while the process was down fire on startup.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long pollIntervalMs = config.pollInterval().toMillis();
        executor.scheduleWithFixedDelay(
                wrapRunnable("trigger-poller", poller::pollOnce),
                0,
                pollIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Trigger poller scheduled every {}ms", pollIntervalMs);

        long reaperIntervalMs = config.reaperInterval().toMillis();
        executor.scheduleWithFixedDelay(
                taskReaper,
                reaperIntervalMs,
                reaperIntervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Task reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started ({} dispatch threads)", config.dispatchThreads());
    }

    /**
     * Stop polling, then give in-flight dispatches up to one dispatch timeout
     * to record their outcome.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();
        dispatchPool.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler thread forcefully stopped");
            }
            long graceMs = config.dispatchTimeout().toMillis() + 5_000;
            if (!dispatchPool.awaitTermination(graceMs, TimeUnit.MILLISECONDS)) {
                dispatchPool.shutdownNow();
                log.warn("Dispatch pool forcefully stopped; unfinished tasks are left for the reaper");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one poll cycle on the calling thread (tests, manual trigger).
     */
    public int pollNow() {
        return poller.pollOnce();
    }

    public TaskReaper taskReaper() {
        return taskReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
