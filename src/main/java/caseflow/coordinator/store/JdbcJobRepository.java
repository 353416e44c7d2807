package caseflow.coordinator.store;

import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobCompleteResult;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.model.QueueStats;
import caseflow.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * JDBC implementation of JobRepository.
 * Claims use compare-and-set updates ({@code WHERE status = 'PENDING'}) and
 * check the affected row count; a lost race moves on to the next candidate.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    /** Candidates read per claim round */
    private static final int CLAIM_CANDIDATES = 5;
    /** Re-query limit when every candidate of a round was taken by someone else */
    private static final int MAX_CLAIM_ROUNDS = 3;

    private static final String SELECT_COLUMNS = """
                id, queue_name, data, status, priority, max_attempts, attempts, created_at, scheduled_for,
                started_at, completed_at, failed_at, error, result
            """;

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Job job) {
        String sql = """
                    INSERT INTO jobs (id, queue_name, data, status, priority, max_attempts, attempts, created_at,
                                      scheduled_for, started_at, completed_at, failed_at, error, result)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Instant createdAt = job.createdAt() != null ? job.createdAt() : Instant.now();
            Instant scheduledFor = job.scheduledFor() != null ? job.scheduledFor() : createdAt;

            ps.setString(1, job.id());
            ps.setString(2, job.queueName());
            ps.setString(3, job.data());
            ps.setString(4, job.status().name());
            ps.setInt(5, job.priority());
            ps.setInt(6, job.maxAttempts());
            ps.setInt(7, job.attempts());
            setTimestamp(ps, 8, createdAt);
            setTimestamp(ps, 9, scheduledFor);
            setTimestamp(ps, 10, job.startedAt());
            setTimestamp(ps, 11, job.completedAt());
            setTimestamp(ps, 12, job.failedAt());
            ps.setString(13, job.error());
            ps.setString(14, job.result());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT " + SELECT_COLUMNS + " FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);

            try (ResultSet rs = ps.executeQuery()) {
                Optional<Job> job = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return job;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findByStatus(String queueName, JobStatus status, int limit) {
        String sql = "SELECT " + SELECT_COLUMNS
                + " FROM jobs WHERE queue_name = ? AND status = ? ORDER BY created_at, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            ps.setString(2, status.name());
            ps.setInt(3, limit);

            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs by status", e);
        }
    }

    @Override
    public Optional<Job> claimNext(String queueName, Instant now) {
        String selectSql = """
                    SELECT id FROM jobs
                    WHERE queue_name = ? AND status = 'PENDING' AND scheduled_for <= ?
                    ORDER BY priority DESC, created_at, id
                    LIMIT ?
                """;

        String claimSql = """
                    UPDATE jobs
                    SET status = 'PROCESSING', started_at = ?
                    WHERE id = ? AND status = 'PENDING' AND scheduled_for <= ?
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement claimPs = conn.prepareStatement(claimSql)) {

                Timestamp nowTs = Timestamp.from(now);

                for (int round = 0; round < MAX_CLAIM_ROUNDS; round++) {
                    List<String> candidates = new ArrayList<>();
                    selectPs.setString(1, queueName);
                    selectPs.setTimestamp(2, nowTs);
                    selectPs.setInt(3, CLAIM_CANDIDATES);
                    try (ResultSet rs = selectPs.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(rs.getString("id"));
                        }
                    }
                    conn.commit();

                    if (candidates.isEmpty()) {
                        return Optional.empty();
                    }

                    for (String id : candidates) {
                        claimPs.setTimestamp(1, nowTs);
                        claimPs.setString(2, id);
                        claimPs.setTimestamp(3, nowTs);

                        int updated;
                        try {
                            updated = claimPs.executeUpdate();
                        } catch (SQLException e) {
                            if (!isLockConflict(e)) {
                                throw e;
                            }
                            log.debug("Lock conflict claiming job {}, trying next candidate", id);
                            updated = 0;
                        }

                        if (updated == 1) {
                            conn.commit();
                            log.debug("Claimed job {} from queue {}", id, queueName);
                            return findById(id);
                        }
                        // Another worker got it first
                        conn.rollback();
                    }

                    if (candidates.size() < CLAIM_CANDIDATES) {
                        return Optional.empty();
                    }
                }

                log.debug("Gave up claiming from queue {} after {} contended rounds", queueName, MAX_CLAIM_ROUNDS);
                return Optional.empty();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim job from queue: " + queueName, e);
        }
    }

    @Override
    public JobCompleteResult complete(String jobId, String result, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET status = 'COMPLETED', result = ?, completed_at = ?
                    WHERE id = ? AND status = 'PROCESSING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result);
            ps.setTimestamp(2, Timestamp.from(now));
            ps.setString(3, jobId);

            int updated = ps.executeUpdate();
            if (updated == 1) {
                conn.commit();
                return JobCompleteResult.COMPLETED;
            }
            conn.rollback();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete job: " + jobId, e);
        }

        Optional<Job> current = findById(jobId);
        if (current.isEmpty()) {
            return JobCompleteResult.NOT_FOUND;
        }
        return current.get().isTerminal() ? JobCompleteResult.ALREADY_TERMINAL : JobCompleteResult.NOT_PROCESSING;
    }

    @Override
    public JobFailResult fail(String jobId, String error, Instant now, IntFunction<Duration> retryDelay) {
        String selectSql = "SELECT status, attempts, max_attempts FROM jobs WHERE id = ?";

        String retrySql = """
                    UPDATE jobs
                    SET status = 'PENDING', attempts = ?, scheduled_for = ?, error = ?
                    WHERE id = ? AND status = 'PROCESSING' AND attempts = ?
                """;

        String failSql = """
                    UPDATE jobs
                    SET status = 'FAILED', attempts = ?, failed_at = ?, error = ?
                    WHERE id = ? AND status = 'PROCESSING' AND attempts = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                String status;
                int attempts;
                int maxAttempts;
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, jobId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return JobFailResult.NOT_FOUND;
                        }
                        status = rs.getString("status");
                        attempts = rs.getInt("attempts");
                        maxAttempts = rs.getInt("max_attempts");
                    }
                }

                if (!JobStatus.PROCESSING.name().equals(status)) {
                    conn.rollback();
                    return JobFailResult.NOT_PROCESSING;
                }

                int nextAttempts = Math.min(attempts + 1, maxAttempts);
                boolean retry = nextAttempts < maxAttempts;
                String truncated = truncate(error, 4000);

                int updated;
                if (retry) {
                    Instant scheduledFor = now.plus(retryDelay.apply(nextAttempts));
                    try (PreparedStatement ps = conn.prepareStatement(retrySql)) {
                        ps.setInt(1, nextAttempts);
                        ps.setTimestamp(2, Timestamp.from(scheduledFor));
                        ps.setString(3, truncated);
                        ps.setString(4, jobId);
                        ps.setInt(5, attempts);
                        updated = ps.executeUpdate();
                    }
                } else {
                    try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                        ps.setInt(1, nextAttempts);
                        ps.setTimestamp(2, Timestamp.from(now));
                        ps.setString(3, truncated);
                        ps.setString(4, jobId);
                        ps.setInt(5, attempts);
                        updated = ps.executeUpdate();
                    }
                }

                if (updated == 0) {
                    // Reaped or failed concurrently
                    conn.rollback();
                    return JobFailResult.NOT_PROCESSING;
                }

                conn.commit();
                return retry ? JobFailResult.RETRIED : JobFailResult.FAILED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record failure of job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findStuckProcessing(Instant startedBefore) {
        String sql = "SELECT " + SELECT_COLUMNS
                + " FROM jobs WHERE status = 'PROCESSING' AND started_at < ? ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(startedBefore));

            List<Job> jobs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapRow(rs));
                }
            }
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck jobs", e);
        }
    }

    @Override
    public QueueStats stats(String queueName) {
        String sql = "SELECT status, COUNT(*) AS cnt FROM jobs WHERE queue_name = ? GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);

            int pending = 0;
            int processing = 0;
            int completed = 0;
            int failed = 0;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int count = rs.getInt("cnt");
                    switch (JobStatus.valueOf(rs.getString("status"))) {
                        case PENDING -> pending = count;
                        case PROCESSING -> processing = count;
                        case COMPLETED -> completed = count;
                        case FAILED -> failed = count;
                    }
                }
            }
            conn.commit();
            return new QueueStats(queueName, pending, processing, completed, failed);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read stats of queue: " + queueName, e);
        }
    }

    @Override
    public int deleteFailedBefore(String queueName, Instant cutoff) {
        String sql = "DELETE FROM jobs WHERE queue_name = ? AND status = 'FAILED' AND failed_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, queueName);
            ps.setTimestamp(2, Timestamp.from(cutoff));

            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clean up queue: " + queueName, e);
        }
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .queueName(rs.getString("queue_name"))
                .data(rs.getString("data"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .maxAttempts(rs.getInt("max_attempts"))
                .attempts(rs.getInt("attempts"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .scheduledFor(toInstant(rs.getTimestamp("scheduled_for")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .failedAt(toInstant(rs.getTimestamp("failed_at")))
                .error(rs.getString("error"))
                .result(rs.getString("result"))
                .build();
    }

    /** Row lock wait timed out (H2 50200, PostgreSQL 55P03) or serialization conflict */
    private static boolean isLockConflict(SQLException e) {
        String state = e.getSQLState();
        return e.getErrorCode() == 50200 || "HYT00".equals(state) || "55P03".equals(state) || "40001".equals(state);
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
