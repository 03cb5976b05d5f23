package herald.engine.scheduler;

import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskStatus;
import herald.engine.model.TransitionResult;
import herald.engine.store.Database;
import herald.engine.store.JdbcTaskRepository;
import herald.engine.support.MutableClock;
import herald.engine.support.Tasks;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskReaper functionality.
 */
class TaskReaperTest {

    private static final Instant T0 = Instant.parse("2026-03-01T09:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(Tasks.h2Url("test-reaper"), 4);
        clock = new MutableClock(T0);
        repo = new JdbcTaskRepository(db, 200, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        clock.set(T0);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM scheduled_tasks");
            conn.commit();
        }
    }

    @Test
    void reapsTaskRunningLongerThanThreshold() {
        repo.insert(Tasks.scheduled("stuck", "x", T0));
        repo.markRunning("stuck");
        clock.advance(Duration.ofMinutes(11));

        TaskReaper reaper = new TaskReaper(repo, Duration.ofMinutes(10), clock);
        assertEquals(1, reaper.reapStuckTasks());

        ScheduledTask reaped = repo.findById("stuck").orElseThrow();
        assertEquals(TaskStatus.FAILED, reaped.status());
        assertEquals(TaskReaper.REAPED_ERROR, reaped.result().get("error"));
    }

    @Test
    void leavesRecentAndScheduledTasksAlone() {
        repo.insert(Tasks.scheduled("recent", "x", T0));
        repo.insert(Tasks.scheduled("waiting", "x", T0));
        clock.advance(Duration.ofMinutes(5));
        repo.markRunning("recent");
        clock.advance(Duration.ofMinutes(6));

        TaskReaper reaper = new TaskReaper(repo, Duration.ofMinutes(10), clock);
        assertEquals(0, reaper.reapStuckTasks());

        assertEquals(TaskStatus.RUNNING, repo.findById("recent").orElseThrow().status());
        assertEquals(TaskStatus.SCHEDULED, repo.findById("waiting").orElseThrow().status());
    }

    @Test
    void thresholdCountsFromDispatchStartNotFromClaim() {
        repo.insert(Tasks.scheduled("queued", "x", T0));
        repo.markRunning("queued");
        clock.advance(Duration.ofMinutes(11));
        // sat in the dispatch queue, then a dispatch thread picked it up
        assertEquals(TransitionResult.APPLIED, repo.beginDispatch("queued"));
        clock.advance(Duration.ofMinutes(1));

        TaskReaper reaper = new TaskReaper(repo, Duration.ofMinutes(10), clock);
        assertEquals(0, reaper.reapStuckTasks());
        assertEquals(TaskStatus.RUNNING, repo.findById("queued").orElseThrow().status());
    }

    @Test
    void dispatchStartingAfterScanWinsOverReaper() {
        // the dispatcher restamps each task between the reaper's scan and its update
        JdbcTaskRepository racing = new JdbcTaskRepository(db, 200, clock) {
            @Override
            public List<ScheduledTask> findStuckRunning(Instant startedBefore) {
                List<ScheduledTask> stuck = super.findStuckRunning(startedBefore);
                stuck.forEach(t -> beginDispatch(t.id()));
                return stuck;
            }
        };
        repo.insert(Tasks.scheduled("late-start", "x", T0));
        repo.markRunning("late-start");
        clock.advance(Duration.ofMinutes(11));

        TaskReaper reaper = new TaskReaper(racing, Duration.ofMinutes(10), clock);
        assertEquals(0, reaper.reapStuckTasks());

        ScheduledTask task = repo.findById("late-start").orElseThrow();
        assertEquals(TaskStatus.RUNNING, task.status());
        assertEquals(T0.plus(Duration.ofMinutes(11)), task.startedAt());
    }

    @Test
    void runWithNothingStuckIsNoop() {
        TaskReaper reaper = new TaskReaper(repo, Duration.ofMinutes(10), clock);
        assertDoesNotThrow(reaper::run);
    }
}
