package herald.engine.store;

import herald.engine.error.DataIntegrityException;
import herald.engine.error.StorageException;
import herald.engine.model.DispatchOutcome;
import herald.engine.model.PlatformRef;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskFilter;
import herald.engine.model.TaskStatus;
import herald.engine.model.TransitionResult;
import herald.engine.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Status transitions are single conditional UPDATEs ({@code WHERE status = ?}),
 * so the database row is the only arbiter between racing pollers.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final int DEFAULT_PAGE_SIZE = 200;

    private final Database db;
    private final int pageSize;
    private final Clock clock;

    public JdbcTaskRepository(Database db) {
        this(db, DEFAULT_PAGE_SIZE, Clock.systemUTC());
    }

    public JdbcTaskRepository(Database db, int pageSize, Clock clock) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.db = db;
        this.pageSize = pageSize;
        this.clock = clock;
    }

    @Override
    public void insert(ScheduledTask task) {
        if (task.status() != TaskStatus.SCHEDULED) {
            throw new IllegalArgumentException("new tasks must be SCHEDULED, got " + task.status());
        }

        String sql = """
                    INSERT INTO scheduled_tasks (id, user_id, platform_name, account_id, payload, credentials,
                                                 scheduled_at, status, result, created_at, updated_at,
                                                 started_at, finished_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, NULL, ?, ?, NULL, NULL)
                """;

        // encode before borrowing a connection so a bad payload never touches the store
        String payload = JsonCodec.encode(task.payload());
        String credentials = JsonCodec.encode(task.credentials());
        Instant now = clock.instant();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.userId());
            ps.setString(3, task.platform().name());
            ps.setString(4, task.platform().accountId());
            ps.setString(5, payload);
            ps.setString(6, credentials);
            SqlInstants.bind(ps, 7, task.scheduledAt());
            ps.setString(8, TaskStatus.SCHEDULED.name());
            SqlInstants.bind(ps, 9, task.createdAt() != null ? task.createdAt() : now);
            SqlInstants.bind(ps, 10, task.updatedAt() != null ? task.updatedAt() : now);

            ps.executeUpdate();
            conn.commit();

            log.debug("Inserted task {} for {} at {}", task.id(), task.platform().name(), task.scheduledAt());
        } catch (SQLException e) {
            throw new StorageException("Failed to insert task: " + task.id(), e);
        }
    }

    @Override
    public Optional<ScheduledTask> findById(String taskId) {
        String sql = "SELECT * FROM scheduled_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StorageException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public Iterable<ScheduledTask> list(TaskFilter filter) {
        TaskFilter criteria = filter != null ? filter : TaskFilter.all();
        return () -> new KeysetIterator(criteria);
    }

    @Override
    public TransitionResult cancel(String taskId) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'CANCELLED', updated_at = ?, finished_at = ?
                    WHERE id = ? AND status = 'SCHEDULED'
                """;

        return transition(taskId, "cancel", sql, (ps, now) -> {
            ps.setObject(1, now);
            ps.setObject(2, now);
            ps.setString(3, taskId);
        });
    }

    @Override
    public TransitionResult markRunning(String taskId) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = 'RUNNING', updated_at = ?, started_at = ?
                    WHERE id = ? AND status = 'SCHEDULED'
                """;

        return transition(taskId, "mark running", sql, (ps, now) -> {
            ps.setObject(1, now);
            ps.setObject(2, now);
            ps.setString(3, taskId);
        });
    }

    @Override
    public TransitionResult beginDispatch(String taskId) {
        // started_at moves from claim time to the moment a dispatch thread picks the task up
        String sql = """
                    UPDATE scheduled_tasks
                    SET updated_at = ?, started_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        return transition(taskId, "begin dispatch", sql, (ps, now) -> {
            ps.setObject(1, now);
            ps.setObject(2, now);
            ps.setString(3, taskId);
        });
    }

    @Override
    public TransitionResult markTerminal(String taskId, DispatchOutcome outcome) {
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = ?, result = ?, updated_at = ?, finished_at = ?
                    WHERE id = ? AND status = 'RUNNING'
                """;

        String result = JsonCodec.encode(outcome.result());

        return transition(taskId, "mark " + outcome.status(), sql, (ps, now) -> {
            ps.setString(1, outcome.status().name());
            ps.setString(2, result);
            ps.setObject(3, now);
            ps.setObject(4, now);
            ps.setString(5, taskId);
        });
    }

    @Override
    public TransitionResult failStuck(String taskId, Instant startedBefore, DispatchOutcome outcome) {
        // a beginDispatch that committed first moves started_at past the cutoff, so this one misses
        String sql = """
                    UPDATE scheduled_tasks
                    SET status = ?, result = ?, updated_at = ?, finished_at = ?
                    WHERE id = ? AND status = 'RUNNING' AND started_at < ?
                """;

        String result = JsonCodec.encode(outcome.result());

        return transition(taskId, "reap", sql, (ps, now) -> {
            ps.setString(1, outcome.status().name());
            ps.setString(2, result);
            ps.setObject(3, now);
            ps.setObject(4, now);
            ps.setString(5, taskId);
            SqlInstants.bind(ps, 6, startedBefore);
        });
    }

    @Override
    public boolean delete(String taskId) {
        String sql = "DELETE FROM scheduled_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public List<ScheduledTask> findStuckRunning(Instant startedBefore) {
        String sql = """
                    SELECT * FROM scheduled_tasks
                    WHERE status = 'RUNNING' AND started_at < ?
                    ORDER BY started_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlInstants.bind(ps, 1, startedBefore);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to find stuck tasks", e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM scheduled_tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to count tasks", e);
        }
    }

    // Transition plumbing

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps, OffsetDateTime now) throws SQLException;
    }

    /**
     * Run a conditional UPDATE. When no row matched, the same transaction tells
     * a missing task apart from one in the wrong state.
     */
    private TransitionResult transition(String taskId, String operation, String sql, Binder binder) {
        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    binder.bind(ps, SqlInstants.utc(clock.instant()));
                    updated = ps.executeUpdate();
                }

                if (updated > 0) {
                    conn.commit();
                    log.debug("Task {}: {} applied", taskId, operation);
                    return TransitionResult.APPLIED;
                }

                TransitionResult miss = existsIn(conn, taskId) ? TransitionResult.CONFLICT : TransitionResult.NOT_FOUND;
                conn.rollback();
                log.debug("Task {}: {} rejected ({})", taskId, operation, miss);
                return miss;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to " + operation + " task: " + taskId, e);
        }
    }

    private static boolean existsIn(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM scheduled_tasks WHERE id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    // Keyset pagination

    /**
     * Reads one page per round trip, resuming after the last (scheduled_at, id)
     * seen. Holds no connection between pages.
     */
    private final class KeysetIterator implements Iterator<ScheduledTask> {
        private final TaskFilter filter;
        private final Deque<ScheduledTask> buffer = new ArrayDeque<>();
        private Instant lastScheduledAt;
        private String lastId;
        private boolean exhausted;

        KeysetIterator(TaskFilter filter) {
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<ScheduledTask> page = fetchPage(filter, lastScheduledAt, lastId);
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                if (!page.isEmpty()) {
                    ScheduledTask last = page.get(page.size() - 1);
                    lastScheduledAt = last.scheduledAt();
                    lastId = last.id();
                    buffer.addAll(page);
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public ScheduledTask next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }
    }

    private List<ScheduledTask> fetchPage(TaskFilter filter, Instant afterScheduledAt, String afterId) {
        StringBuilder sql = new StringBuilder("SELECT * FROM scheduled_tasks WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (filter.userId() != null) {
            sql.append(" AND user_id = ?");
            params.add(filter.userId());
        }
        if (filter.platform() != null) {
            sql.append(" AND platform_name = ?");
            params.add(filter.platform());
        }
        if (filter.status() != null) {
            sql.append(" AND status = ?");
            params.add(filter.status().name());
        }
        if (filter.from() != null) {
            sql.append(" AND scheduled_at >= ?");
            params.add(SqlInstants.utc(filter.from()));
        }
        if (filter.to() != null) {
            sql.append(" AND scheduled_at < ?");
            params.add(SqlInstants.utc(filter.to()));
        }
        if (afterScheduledAt != null) {
            OffsetDateTime after = SqlInstants.utc(afterScheduledAt);
            sql.append(" AND (scheduled_at > ? OR (scheduled_at = ? AND id > ?))");
            params.add(after);
            params.add(after);
            params.add(afterId);
        }
        sql.append(" ORDER BY scheduled_at, id LIMIT ?");
        params.add(pageSize);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StorageException("Failed to list tasks", e);
        }
    }

    // Helper methods

    private List<ScheduledTask> executeQuery(PreparedStatement ps) throws SQLException {
        List<ScheduledTask> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private ScheduledTask mapRow(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        return ScheduledTask.builder()
                .id(id)
                .userId(rs.getString("user_id"))
                .platform(PlatformRef.of(rs.getString("platform_name"), rs.getString("account_id")))
                .payload(JsonCodec.decode(rs.getString("payload"), "payload", id))
                .credentials(JsonCodec.decode(rs.getString("credentials"), "credentials", id))
                .scheduledAt(SqlInstants.read(rs, "scheduled_at"))
                .status(parseStatus(rs.getString("status"), id))
                .result(JsonCodec.decode(rs.getString("result"), "result", id))
                .createdAt(SqlInstants.read(rs, "created_at"))
                .updatedAt(SqlInstants.read(rs, "updated_at"))
                .startedAt(SqlInstants.read(rs, "started_at"))
                .finishedAt(SqlInstants.read(rs, "finished_at"))
                .build();
    }

    private static TaskStatus parseStatus(String value, String taskId) {
        try {
            return TaskStatus.valueOf(value);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DataIntegrityException("Stored status of task " + taskId + " is invalid: " + value, e);
        }
    }
}
