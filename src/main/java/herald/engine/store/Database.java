package herald.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import herald.engine.config.HeraldConfig;
import herald.engine.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit off; every caller commits or rolls back its own unit of work.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(HeraldConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("herald-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:") && !jdbcUrl.contains("MODE=")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASK RECORDS ----------
            // instants are stored with an offset so the JVM default zone never shifts them
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS scheduled_tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            user_id         VARCHAR(128) NOT NULL,
                            platform_name   VARCHAR(64) NOT NULL,
                            account_id      VARCHAR(256) NOT NULL,
                            payload         CLOB NOT NULL,
                            credentials     CLOB NOT NULL,
                            scheduled_at    TIMESTAMP WITH TIME ZONE NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            result          CLOB,
                            created_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                            updated_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                            started_at      TIMESTAMP WITH TIME ZONE,
                            finished_at     TIMESTAMP WITH TIME ZONE
                        );
                    """);

            // ---------- JOB TRIGGERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_triggers (
                            task_id         VARCHAR(64) PRIMARY KEY,
                            fire_at         TIMESTAMP WITH TIME ZONE NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_scheduled ON scheduled_tasks(status, scheduled_at, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_platform_scheduled ON scheduled_tasks(platform_name, scheduled_at, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_user_scheduled ON scheduled_tasks(user_id, scheduled_at, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_scheduled ON scheduled_tasks(scheduled_at, id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_triggers_fire_at ON job_triggers(fire_at, task_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StorageException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
