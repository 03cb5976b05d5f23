package herald.engine.service;

import herald.engine.dispatch.PublisherRegistry;
import herald.engine.error.StorageException;
import herald.engine.error.TaskConflictException;
import herald.engine.error.TaskNotFoundException;
import herald.engine.error.ValidationException;
import herald.engine.model.CreateTaskCommand;
import herald.engine.model.JobTrigger;
import herald.engine.model.PlatformRef;
import herald.engine.model.TaskFilter;
import herald.engine.model.TaskStatus;
import herald.engine.model.TaskView;
import herald.engine.repository.TriggerRepository;
import herald.engine.store.Database;
import herald.engine.store.JdbcTaskRepository;
import herald.engine.store.JdbcTriggerRepository;
import herald.engine.support.MutableClock;
import herald.engine.support.RecordingPublisher;
import herald.engine.support.Tasks;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private static Database db;
    private static MutableClock clock;
    private static JdbcTaskRepository tasks;
    private static JdbcTriggerRepository triggers;
    private static PublisherRegistry registry;

    private TaskService service;

    @BeforeAll
    static void setupDb() {
        db = new Database(Tasks.h2Url("test-task-service"), 4);
        clock = new MutableClock(NOW);
        tasks = new JdbcTaskRepository(db, 200, clock);
        triggers = new JdbcTriggerRepository(db);
        registry = new PublisherRegistry()
                .register("linkedin", RecordingPublisher.succeeding())
                .register("twitter", RecordingPublisher.succeeding());
    }

    @AfterAll
    static void teardownDb() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setup() throws Exception {
        clock.set(NOW);
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_triggers");
            st.execute("DELETE FROM scheduled_tasks");
            conn.commit();
        }
        service = new TaskService(tasks, triggers, registry, clock);
    }

    private static CreateTaskCommand command(String platform, Instant at) {
        return command("user-7", platform, at);
    }

    private static CreateTaskCommand command(String userId, String platform, Instant at) {
        return new CreateTaskCommand(userId, PlatformRef.of(platform, "acct-7"),
                Map.of("text", "Launch day"), Map.of("token", "t"), at);
    }

    @Test
    void createStoresScheduledTaskAndTrigger() {
        Instant at = NOW.plus(Duration.ofHours(2));
        String id = service.createTask(command("linkedin", at));

        TaskView view = service.getTask(id);
        assertEquals(TaskStatus.SCHEDULED, view.status());
        assertEquals("user-7", view.userId());
        assertEquals("linkedin", view.platform());
        assertEquals("acct-7", view.accountId());
        assertEquals(Map.of("text", "Launch day"), view.payload());
        assertEquals(at, view.scheduledAt());
        assertEquals(NOW, view.createdAt());

        assertEquals(at, triggers.findByTaskId(id).orElseThrow().fireAt());
    }

    @Test
    void pastOrPresentTimeIsRejectedAndNothingPersisted() {
        assertThrows(ValidationException.class, () -> service.createTask(command("linkedin", NOW)));
        assertThrows(ValidationException.class,
                () -> service.createTask(command("linkedin", NOW.minusSeconds(1))));

        assertEquals(0, count(service.listTasks(TaskFilter.all())));
        assertEquals(0, triggers.countPending());
    }

    @Test
    void malformedCommandsAreRejected() {
        Instant at = NOW.plusSeconds(60);
        assertThrows(ValidationException.class, () -> service.createTask(command("myspace", at)));
        assertThrows(ValidationException.class, () -> service.createTask(command(" ", at)));
        assertThrows(ValidationException.class, () -> service.createTask(new CreateTaskCommand(
                "u", PlatformRef.of("linkedin", ""), Map.of("text", "x"), Map.of(), at)));
        assertThrows(ValidationException.class, () -> service.createTask(new CreateTaskCommand(
                "u", PlatformRef.of("linkedin", "a"), Map.of(), Map.of(), at)));
        assertThrows(ValidationException.class, () -> service.createTask(new CreateTaskCommand(
                "u", PlatformRef.of("linkedin", "a"), Map.of("text", "x"), Map.of(), null)));
        assertThrows(ValidationException.class, () -> service.createTask(command(null, "linkedin", at)));
        assertThrows(ValidationException.class, () -> service.createTask(command("  ", "linkedin", at)));
        assertThrows(ValidationException.class, () -> service.createTask(null));

        assertEquals(0, count(service.listTasks(TaskFilter.all())));
    }

    @Test
    void missingPlatformNameIsValidationError() {
        ValidationException e = assertThrows(ValidationException.class, () -> service.createTask(
                new CreateTaskCommand("u", PlatformRef.of(null, "acct"), Map.of("text", "x"), Map.of(),
                        NOW.plusSeconds(60))));
        assertEquals("platform name is required", e.getMessage());

        assertThrows(ValidationException.class, () -> PlatformRef.of("linkedin", null));
    }

    @Test
    void listFiltersByOwningUser() {
        String mine = service.createTask(command("alice", "linkedin", NOW.plusSeconds(60)));
        service.createTask(command("bob", "linkedin", NOW.plusSeconds(30)));

        List<String> ids = new ArrayList<>();
        service.listTasks(TaskFilter.all().withUser("alice")).forEach(v -> ids.add(v.id()));

        assertEquals(List.of(mine), ids);
    }

    @Test
    void getUnknownTaskIsNotFound() {
        TaskNotFoundException e = assertThrows(TaskNotFoundException.class, () -> service.getTask("nope"));
        assertEquals("nope", e.taskId());
    }

    @Test
    void cancelOnlyWhileScheduled() {
        String id = service.createTask(command("linkedin", NOW.plusSeconds(60)));

        service.cancelTask(id);
        assertEquals(TaskStatus.CANCELLED, service.getTask(id).status());
        assertTrue(triggers.findByTaskId(id).isEmpty());

        TaskConflictException again = assertThrows(TaskConflictException.class, () -> service.cancelTask(id));
        assertEquals(TaskStatus.CANCELLED, again.currentStatus());

        String running = service.createTask(command("linkedin", NOW.plusSeconds(60)));
        tasks.markRunning(running);
        TaskConflictException conflict = assertThrows(TaskConflictException.class,
                () -> service.cancelTask(running));
        assertEquals(TaskStatus.RUNNING, conflict.currentStatus());

        assertThrows(TaskNotFoundException.class, () -> service.cancelTask("missing"));
    }

    @Test
    void listAppliesFilterInScheduleOrder() {
        String b = service.createTask(command("linkedin", NOW.plusSeconds(120)));
        String a = service.createTask(command("linkedin", NOW.plusSeconds(60)));
        service.createTask(command("twitter", NOW.plusSeconds(90)));

        List<String> ids = new ArrayList<>();
        service.listTasks(TaskFilter.all().withPlatform("linkedin")).forEach(v -> ids.add(v.id()));

        assertEquals(List.of(a, b), ids);
    }

    @Test
    void failedTriggerRegistrationRemovesTheRecord() {
        TriggerRepository broken = new TriggerRepository() {
            @Override
            public void register(String taskId, Instant fireAt) {
                throw new StorageException("disk full", null);
            }

            @Override
            public List<JobTrigger> due(Instant before, int limit) {
                return List.of();
            }

            @Override
            public boolean remove(String taskId) {
                return false;
            }

            @Override
            public Optional<JobTrigger> findByTaskId(String taskId) {
                return Optional.empty();
            }

            @Override
            public int countPending() {
                return 0;
            }
        };
        TaskService failing = new TaskService(tasks, broken, registry, clock);

        ValidationException e = assertThrows(ValidationException.class,
                () -> failing.createTask(command("linkedin", NOW.plusSeconds(60))));

        assertEquals("task could not be scheduled", e.getMessage());
        assertInstanceOf(StorageException.class, e.getCause());
        assertEquals(0, count(service.listTasks(TaskFilter.all())));
    }

    private static int count(Iterable<?> items) {
        int n = 0;
        for (Object ignored : items) {
            n++;
        }
        return n;
    }
}
