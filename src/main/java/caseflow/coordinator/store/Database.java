package caseflow.coordinator.store;

import caseflow.coordinator.config.CoordinatorConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * autoCommit off; callers commit or roll back explicitly.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("caseflow-db-pool");
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

            // ---------- QUEUE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            queue_name      VARCHAR(128) NOT NULL,
                            data            CLOB NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING',
                            priority        INT DEFAULT 0,
                            max_attempts    INT DEFAULT 3,
                            attempts        INT DEFAULT 0,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            scheduled_for   TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            started_at      TIMESTAMP,
                            completed_at    TIMESTAMP,
                            failed_at       TIMESTAMP,
                            error           VARCHAR(4000),
                            result          CLOB
                        );
                    """);

            // ---------- CASES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS cases (
                            id                        VARCHAR(64) PRIMARY KEY,
                            user_id                   VARCHAR(64) NOT NULL,
                            case_name                 VARCHAR(512),
                            case_narrative            CLOB,
                            case_type                 VARCHAR(128),
                            jurisdiction              VARCHAR(256),
                            legal_issues              CLOB,
                            enhanced_summary          CLOB,
                            processing_status         VARCHAR(20) DEFAULT 'PENDING',
                            processing_error          VARCHAR(2048),
                            outcome_prediction_score  INT,
                            risk_level                VARCHAR(20),
                            ai_processed              BOOLEAN DEFAULT FALSE,
                            last_update               TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            created_at                TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS case_documents (
                            id                VARCHAR(64) PRIMARY KEY,
                            case_id           VARCHAR(64) NOT NULL,
                            file_name         VARCHAR(512),
                            file_type         VARCHAR(128),
                            storage_path      VARCHAR(1024),
                            extracted_text    CLOB,
                            extraction_error  VARCHAR(2048),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- PIPELINE ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS case_stages (
                            case_id       VARCHAR(64) NOT NULL,
                            stage         VARCHAR(64) NOT NULL,
                            stage_order   INT NOT NULL,
                            status        VARCHAR(20) NOT NULL,
                            output        CLOB,
                            started_at    TIMESTAMP,
                            completed_at  TIMESTAMP,
                            error         VARCHAR(4000),
                            PRIMARY KEY (case_id, stage)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS precedent_cases (
                            id                VARCHAR(64) PRIMARY KEY,
                            case_id           VARCHAR(64) NOT NULL,
                            external_id       VARCHAR(128),
                            case_name         VARCHAR(1024),
                            citation          VARCHAR(512),
                            court             VARCHAR(512),
                            jurisdiction      VARCHAR(256),
                            outcome           VARCHAR(1024),
                            summary           CLOB,
                            similarity_score  DOUBLE,
                            source            VARCHAR(64),
                            created_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS case_predictions (
                            case_id        VARCHAR(64) PRIMARY KEY,
                            prediction     CLOB NOT NULL,
                            supplementary  CLOB,
                            created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS processing_errors (
                            id             VARCHAR(64) PRIMARY KEY,
                            case_id        VARCHAR(64) NOT NULL,
                            stage          VARCHAR(64),
                            error_type     VARCHAR(256),
                            error_message  VARCHAR(4000) NOT NULL,
                            error_stack    CLOB,
                            created_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- RATE LIMITER ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS rate_windows (
                            resource_key      VARCHAR(128) PRIMARY KEY,
                            window_start      BIGINT NOT NULL,
                            request_count     INT NOT NULL DEFAULT 0,
                            token_count       BIGINT NOT NULL DEFAULT 0,
                            last_admitted_at  BIGINT NOT NULL DEFAULT 0
                        );
                    """);

            // ---------- INBOUND EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS webhook_events (
                            id           VARCHAR(64) PRIMARY KEY,
                            event_type   VARCHAR(20),
                            table_name   VARCHAR(128),
                            record_id    VARCHAR(64),
                            source       VARCHAR(32),
                            outcome      VARCHAR(32) NOT NULL,
                            created_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch(
                    "CREATE INDEX IF NOT EXISTS idx_jobs_claim ON jobs(queue_name, status, priority DESC, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_status_started ON jobs(status, started_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_case_documents_case ON case_documents(case_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_precedent_cases_case ON precedent_cases(case_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_processing_errors_case ON processing_errors(case_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_cases_type ON cases(case_type, jurisdiction);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
