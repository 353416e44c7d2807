package caseflow.coordinator.store;

import caseflow.coordinator.model.StageRecord;
import caseflow.coordinator.model.StageStatus;
import caseflow.coordinator.pipeline.StageKind;
import caseflow.coordinator.repository.StageRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static caseflow.coordinator.store.JdbcJobRepository.setTimestamp;
import static caseflow.coordinator.store.JdbcJobRepository.toInstant;
import static caseflow.coordinator.store.JdbcJobRepository.truncate;

/**
 * JDBC implementation of StageRepository.
 * One row per (case, stage); each write commits on its own so a checkpoint
 * survives whatever happens to later stages.
 */
public class JdbcStageRepository implements StageRepository {

    private final Database db;

    public JdbcStageRepository(Database db) {
        this.db = db;
    }

    @Override
    public void clear(String caseId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM case_stages WHERE case_id = ?")) {
            ps.setString(1, caseId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear stages of case: " + caseId, e);
        }
    }

    @Override
    public void markRunning(String caseId, StageKind stage, Instant now) {
        write(caseId, stage, StageStatus.RUNNING, null, now, null, null);
    }

    @Override
    public void markCompleted(String caseId, StageKind stage, String outputJson, Instant now) {
        Instant startedAt = find(caseId, stage).map(StageRecord::startedAt).orElse(now);
        write(caseId, stage, StageStatus.COMPLETED, outputJson, startedAt, now, null);
    }

    @Override
    public void markFailed(String caseId, StageKind stage, String error, Instant now) {
        Instant startedAt = find(caseId, stage).map(StageRecord::startedAt).orElse(now);
        write(caseId, stage, StageStatus.FAILED, null, startedAt, now, truncate(error, 4000));
    }

    private void write(String caseId, StageKind stage, StageStatus status, String output, Instant startedAt,
            Instant completedAt, String error) {
        String updateSql = """
                    UPDATE case_stages
                    SET status = ?, output = ?, started_at = ?, completed_at = ?, error = ?
                    WHERE case_id = ? AND stage = ?
                """;
        String insertSql = """
                    INSERT INTO case_stages (case_id, stage, stage_order, status, output, started_at, completed_at, error)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, status.name());
                    ps.setString(2, output);
                    setTimestamp(ps, 3, startedAt);
                    setTimestamp(ps, 4, completedAt);
                    ps.setString(5, error);
                    ps.setString(6, caseId);
                    ps.setString(7, stage.name());
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, caseId);
                        ps.setString(2, stage.name());
                        ps.setInt(3, stage.step());
                        ps.setString(4, status.name());
                        ps.setString(5, output);
                        setTimestamp(ps, 6, startedAt);
                        setTimestamp(ps, 7, completedAt);
                        ps.setString(8, error);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record stage " + stage + " of case " + caseId, e);
        }
    }

    @Override
    public Optional<StageRecord> find(String caseId, StageKind stage) {
        String sql = "SELECT * FROM case_stages WHERE case_id = ? AND stage = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);
            ps.setString(2, stage.name());

            try (ResultSet rs = ps.executeQuery()) {
                Optional<StageRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stage " + stage + " of case " + caseId, e);
        }
    }

    @Override
    public List<StageRecord> findByCase(String caseId) {
        String sql = "SELECT * FROM case_stages WHERE case_id = ? ORDER BY stage_order";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);

            List<StageRecord> records = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(mapRow(rs));
                }
            }
            conn.commit();
            return records;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list stages of case: " + caseId, e);
        }
    }

    private StageRecord mapRow(ResultSet rs) throws SQLException {
        return new StageRecord(
                rs.getString("case_id"),
                StageKind.valueOf(rs.getString("stage")),
                StageStatus.valueOf(rs.getString("status")),
                rs.getString("output"),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("completed_at")),
                rs.getString("error"));
    }
}
