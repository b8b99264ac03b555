package taskchain.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import taskchain.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("taskchain-db-pool");
        hikariConfig.setAutoCommit(false);

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

            // ---------- WORKFLOWS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflows (
                            id              VARCHAR(64) PRIMARY KEY,
                            client_id       VARCHAR(128),
                            name            VARCHAR(256) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'INITIAL',
                            final_result    CLOB,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            finished_at     TIMESTAMP
                        );
                    """);

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            workflow_id     VARCHAR(64) NOT NULL,
                            client_id       VARCHAR(128),
                            step_number     INT NOT NULL,
                            task_type       VARCHAR(128) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'QUEUED',
                            depends_on      INT,
                            payload         CLOB,
                            progress        VARCHAR(512),
                            result_id       VARCHAR(64),
                            claimed_by      VARCHAR(64),
                            claimed_at      TIMESTAMP,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP,
                            CONSTRAINT uq_tasks_workflow_step UNIQUE (workflow_id, step_number)
                        );
                    """);

            // ---------- RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS results (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64) NOT NULL,
                            data_json       CLOB NOT NULL,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_created ON tasks(status, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_workflow_status ON tasks(workflow_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_results_task ON results(task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workflows_status ON workflows(status);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
