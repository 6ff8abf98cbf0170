package deckhand.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import deckhand.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Connection pool and schema for the run history store.
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
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("deckhand-history-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.debug("History database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

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

            // ---------- WORKFLOW RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workflow_runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            project         VARCHAR(253) NOT NULL,
                            namespace       VARCHAR(63) NOT NULL,
                            repo_url        VARCHAR(1024),
                            branch          VARCHAR(256),
                            state           VARCHAR(20) NOT NULL,
                            failed_stage    VARCHAR(253),
                            failed_step     INT,
                            cancelled       BOOLEAN DEFAULT FALSE,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP
                        );
                    """);

            // ---------- STAGE RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS stage_runs (
                            run_id          VARCHAR(64) NOT NULL,
                            seq             INT NOT NULL,
                            step_index      INT NOT NULL,
                            stage_name      VARCHAR(253) NOT NULL,
                            kind            VARCHAR(20) NOT NULL,
                            state           VARCHAR(20) NOT NULL,
                            attempts        INT DEFAULT 0,
                            message         VARCHAR(2048),
                            last_status     VARCHAR(512),
                            submitted_at    TIMESTAMP,
                            finished_at     TIMESTAMP,
                            PRIMARY KEY (run_id, seq)
                        );
                    """);

            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_project_started ON workflow_runs(project, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_stage_runs_run ON stage_runs(run_id);");

            st.executeBatch();
            conn.commit();

            log.debug("History schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.debug("History database pool closed");
        }
    }
}
