package herald.engine.store;

import herald.engine.error.StorageException;
import herald.engine.model.JobTrigger;
import herald.engine.repository.TriggerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TriggerRepository.
 * One row per pending task; the primary key makes registration idempotent.
 */
public class JdbcTriggerRepository implements TriggerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTriggerRepository.class);

    private final Database db;

    public JdbcTriggerRepository(Database db) {
        this.db = db;
    }

    @Override
    public void register(String taskId, Instant fireAt) {
        // upsert on the primary key: a repeat registration moves fire_at, never duplicates
        String sql = "MERGE INTO job_triggers (task_id, fire_at) KEY (task_id) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            SqlInstants.bind(ps, 2, fireAt);
            ps.executeUpdate();
            conn.commit();

            log.debug("Trigger registered for task {} at {}", taskId, fireAt);
        } catch (SQLException e) {
            throw new StorageException("Failed to register trigger for task: " + taskId, e);
        }
    }

    @Override
    public List<JobTrigger> due(Instant before, int limit) {
        String sql = """
                    SELECT task_id, fire_at FROM job_triggers
                    WHERE fire_at <= ?
                    ORDER BY fire_at, task_id
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            SqlInstants.bind(ps, 1, before);
            ps.setInt(2, limit);

            List<JobTrigger> due = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    due.add(mapRow(rs));
                }
            }
            // read-only, but release the snapshot
            conn.commit();
            return due;
        } catch (SQLException e) {
            throw new StorageException("Failed to read due triggers", e);
        }
    }

    @Override
    public boolean remove(String taskId) {
        String sql = "DELETE FROM job_triggers WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            int removed = ps.executeUpdate();
            conn.commit();

            if (removed > 0) {
                log.debug("Trigger removed for task {}", taskId);
            }
            return removed > 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to remove trigger for task: " + taskId, e);
        }
    }

    @Override
    public Optional<JobTrigger> findByTaskId(String taskId) {
        String sql = "SELECT task_id, fire_at FROM job_triggers WHERE task_id = ?";

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
            throw new StorageException("Failed to find trigger for task: " + taskId, e);
        }
    }

    @Override
    public int countPending() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM job_triggers");
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to count triggers", e);
        }
    }

    private static JobTrigger mapRow(ResultSet rs) throws SQLException {
        return new JobTrigger(rs.getString("task_id"), SqlInstants.read(rs, "fire_at"));
    }
}
