package herald.engine.dispatch;

import herald.engine.model.DispatchOutcome;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskStatus;
import herald.engine.store.Database;
import herald.engine.store.JdbcTaskRepository;
import herald.engine.support.RecordingPublisher;
import herald.engine.support.Tasks;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatcher turns every publisher behaviour into exactly one terminal status.
 */
class DispatcherTest {

    private static final Instant FIRE_AT = Instant.parse("2026-03-01T09:00:00Z");

    private static Database db;
    private static JdbcTaskRepository repo;

    private PublisherRegistry registry;
    private Dispatcher dispatcher;

    @BeforeAll
    static void setupDb() {
        db = new Database(Tasks.h2Url("test-dispatcher"), 4);
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardownDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM scheduled_tasks");
            conn.commit();
        }
        registry = new PublisherRegistry();
        dispatcher = new Dispatcher(repo, registry, Duration.ofMillis(300));
    }

    @AfterEach
    void closeDispatcher() {
        dispatcher.close();
    }

    private ScheduledTask runningTask(String platform) {
        ScheduledTask task = Tasks.scheduled(platform, FIRE_AT);
        repo.insert(task);
        repo.markRunning(task.id());
        return repo.findById(task.id()).orElseThrow();
    }

    @Test
    void successIsRecordedWithPublisherResponse() {
        RecordingPublisher publisher = RecordingPublisher.succeeding();
        registry.register("linkedin", publisher);
        ScheduledTask task = runningTask("linkedin");

        DispatchOutcome outcome = dispatcher.execute(task);

        assertTrue(outcome.isSuccess());
        assertEquals(1, publisher.callCount());
        PublishRequest sent = publisher.requests().get(0);
        assertEquals(task.id(), sent.taskId());
        assertEquals(task.payload(), sent.payload());
        assertEquals(Map.of("token", "secret"), sent.credentials());

        ScheduledTask stored = repo.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.SUCCEEDED, stored.status());
        assertEquals(Map.of("postId", "post-" + task.id()), stored.result());
    }

    @Test
    void failureResultIsRecordedAsFailed() {
        registry.register("linkedin", RecordingPublisher.failing("account suspended"));
        ScheduledTask task = runningTask("linkedin");

        DispatchOutcome outcome = dispatcher.execute(task);

        assertEquals(TaskStatus.FAILED, outcome.status());
        ScheduledTask stored = repo.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("account suspended", stored.result().get("error"));
    }

    @Test
    void thrownExceptionBecomesFailedOutcome() {
        registry.register("linkedin", RecordingPublisher.throwing(new IllegalStateException("boom")));
        ScheduledTask task = runningTask("linkedin");

        DispatchOutcome outcome = dispatcher.execute(task);

        assertEquals(TaskStatus.FAILED, outcome.status());
        String error = (String) repo.findById(task.id()).orElseThrow().result().get("error");
        assertTrue(error.contains("IllegalStateException: boom"), error);
    }

    @Test
    void slowPublisherTimesOut() {
        RecordingPublisher slow = RecordingPublisher.slow(Duration.ofSeconds(5));
        registry.register("linkedin", slow);
        ScheduledTask task = runningTask("linkedin");

        long start = System.nanoTime();
        DispatchOutcome outcome = dispatcher.execute(task);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertTrue(elapsedMs < 3000, "dispatcher waited " + elapsedMs + "ms");
        String error = (String) repo.findById(task.id()).orElseThrow().result().get("error");
        assertTrue(error.contains("timed out after 300ms"), error);
    }

    @Test
    void unknownPlatformFailsWithoutCallingAnything() {
        ScheduledTask task = runningTask("myspace");

        DispatchOutcome outcome = dispatcher.execute(task);

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertTrue(((String) outcome.result().get("error")).contains("no publisher registered"));
        assertEquals(TaskStatus.FAILED, repo.findById(task.id()).orElseThrow().status());
    }

    @Test
    void taskNoLongerRunningIsNotPublished() {
        RecordingPublisher publisher = RecordingPublisher.succeeding();
        registry.register("linkedin", publisher);
        ScheduledTask task = runningTask("linkedin");
        repo.markTerminal(task.id(), DispatchOutcome.failed("reaped"));

        DispatchOutcome outcome = dispatcher.execute(task);

        assertEquals(0, publisher.callCount());
        assertEquals(TaskStatus.FAILED, outcome.status());
        ScheduledTask stored = repo.findById(task.id()).orElseThrow();
        assertEquals(TaskStatus.FAILED, stored.status());
        assertEquals("reaped", stored.result().get("error"));
    }

    @Test
    void startedAtIsRestampedWhenDispatchBegins() {
        registry.register("linkedin", RecordingPublisher.succeeding());
        ScheduledTask task = runningTask("linkedin");
        Instant claimedAt = task.startedAt();

        DispatchOutcome outcome = dispatcher.execute(task);

        assertTrue(outcome.isSuccess());
        ScheduledTask stored = repo.findById(task.id()).orElseThrow();
        assertFalse(stored.startedAt().isBefore(claimedAt));
        assertFalse(stored.finishedAt().isBefore(stored.startedAt()));
    }
}
