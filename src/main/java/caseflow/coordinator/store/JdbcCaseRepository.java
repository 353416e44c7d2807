package caseflow.coordinator.store;

import caseflow.coordinator.model.CaseDocument;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.PrecedentCase;
import caseflow.coordinator.model.ProcessingErrorRecord;
import caseflow.coordinator.model.ProcessingStatus;
import caseflow.coordinator.repository.CaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static caseflow.coordinator.store.JdbcJobRepository.setTimestamp;
import static caseflow.coordinator.store.JdbcJobRepository.toInstant;
import static caseflow.coordinator.store.JdbcJobRepository.truncate;

/**
 * JDBC implementation of CaseRepository.
 */
public class JdbcCaseRepository implements CaseRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCaseRepository.class);

    private final Database db;

    public JdbcCaseRepository(Database db) {
        this.db = db;
    }

    @Override
    public void upsert(CaseRecord c) {
        String updateSql = """
                    UPDATE cases
                    SET user_id = ?, case_name = ?, case_narrative = ?,
                        case_type = COALESCE(?, case_type), jurisdiction = COALESCE(?, jurisdiction)
                    WHERE id = ?
                """;
        String insertSql = """
                    INSERT INTO cases (id, user_id, case_name, case_narrative, case_type, jurisdiction,
                                       processing_status, last_update, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, c.userId());
                    ps.setString(2, c.caseName());
                    ps.setString(3, c.narrative());
                    ps.setString(4, c.caseType());
                    ps.setString(5, c.jurisdiction());
                    ps.setString(6, c.id());
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    Instant now = Instant.now();
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, c.id());
                        ps.setString(2, c.userId());
                        ps.setString(3, c.caseName());
                        ps.setString(4, c.narrative());
                        ps.setString(5, c.caseType());
                        ps.setString(6, c.jurisdiction());
                        ps.setString(7, c.processingStatus().name());
                        setTimestamp(ps, 8, c.lastUpdate() != null ? c.lastUpdate() : now);
                        setTimestamp(ps, 9, c.createdAt() != null ? c.createdAt() : now);
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save case: " + c.id(), e);
        }
    }

    @Override
    public Optional<CaseRecord> findById(String caseId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM cases WHERE id = ?")) {
            ps.setString(1, caseId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<CaseRecord> found = rs.next() ? Optional.of(mapCase(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find case: " + caseId, e);
        }
    }

    @Override
    public boolean updateStatus(String caseId, ProcessingStatus expected, ProcessingStatus status, String error,
            Instant now) {
        String sql = status == ProcessingStatus.COMPLETED
                ? """
                    UPDATE cases
                    SET processing_status = ?, processing_error = ?, last_update = ?, ai_processed = TRUE
                    WHERE id = ? AND processing_status = ?
                """
                : """
                    UPDATE cases
                    SET processing_status = ?, processing_error = ?, last_update = ?
                    WHERE id = ? AND processing_status = ?
                """;
        return executeUpdate(sql, "update status of case " + caseId, ps -> {
            ps.setString(1, status.name());
            ps.setString(2, status == ProcessingStatus.FAILED ? truncate(error, 2048) : null);
            ps.setTimestamp(3, Timestamp.from(now));
            ps.setString(4, caseId);
            ps.setString(5, expected.name());
        }) > 0;
    }

    @Override
    public boolean resetToPending(String caseId, Instant now) {
        String sql = """
                    UPDATE cases
                    SET processing_status = 'PENDING', processing_error = NULL, last_update = ?
                    WHERE id = ? AND processing_status <> 'PROCESSING'
                """;
        return executeUpdate(sql, "reset case " + caseId, ps -> {
            ps.setTimestamp(1, Timestamp.from(now));
            ps.setString(2, caseId);
        }) > 0;
    }

    @Override
    public void updateIntake(String caseId, String caseType, String legalIssuesJson) {
        executeUpdate("UPDATE cases SET case_type = ?, legal_issues = ? WHERE id = ?",
                "store intake of case " + caseId, ps -> {
                    ps.setString(1, caseType);
                    ps.setString(2, legalIssuesJson);
                    ps.setString(3, caseId);
                });
    }

    @Override
    public void updateEnhancement(String caseId, String jurisdiction, String enhancedSummary) {
        executeUpdate("UPDATE cases SET jurisdiction = COALESCE(?, jurisdiction), enhanced_summary = ? WHERE id = ?",
                "store enhancement of case " + caseId, ps -> {
                    ps.setString(1, jurisdiction);
                    ps.setString(2, enhancedSummary);
                    ps.setString(3, caseId);
                });
    }

    @Override
    public void updatePrediction(String caseId, int outcomePredictionScore, String riskLevel) {
        executeUpdate("UPDATE cases SET outcome_prediction_score = ?, risk_level = ? WHERE id = ?",
                "store prediction of case " + caseId, ps -> {
                    ps.setInt(1, outcomePredictionScore);
                    ps.setString(2, riskLevel);
                    ps.setString(3, caseId);
                });
    }

    @Override
    public List<CaseRecord> findSimilar(String caseId, String caseType, String jurisdiction, int limit) {
        String sql = """
                    SELECT * FROM cases
                    WHERE id <> ? AND (case_type = ? OR jurisdiction = ?)
                    ORDER BY created_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);
            ps.setString(2, caseType);
            ps.setString(3, jurisdiction);
            ps.setInt(4, limit);

            List<CaseRecord> cases = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    cases.add(mapCase(rs));
                }
            }
            conn.commit();
            return cases;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find cases similar to: " + caseId, e);
        }
    }

    // ---------- documents ----------

    @Override
    public void upsertDocument(CaseDocument d) {
        String updateSql = """
                    UPDATE case_documents SET case_id = ?, file_name = ?, file_type = ?, storage_path = ?
                    WHERE id = ?
                """;
        String insertSql = """
                    INSERT INTO case_documents (id, case_id, file_name, file_type, storage_path, extracted_text,
                                                extraction_error, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, d.caseId());
                    ps.setString(2, d.fileName());
                    ps.setString(3, d.fileType());
                    ps.setString(4, d.storagePath());
                    ps.setString(5, d.id());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, d.id());
                        ps.setString(2, d.caseId());
                        ps.setString(3, d.fileName());
                        ps.setString(4, d.fileType());
                        ps.setString(5, d.storagePath());
                        ps.setString(6, d.extractedText());
                        ps.setString(7, d.extractionError());
                        ps.setTimestamp(8, Timestamp.from(Instant.now()));
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save document: " + d.id(), e);
        }
    }

    @Override
    public List<CaseDocument> findDocuments(String caseId) {
        String sql = "SELECT * FROM case_documents WHERE case_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);

            List<CaseDocument> documents = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    documents.add(new CaseDocument(
                            rs.getString("id"),
                            rs.getString("case_id"),
                            rs.getString("file_name"),
                            rs.getString("file_type"),
                            rs.getString("storage_path"),
                            rs.getString("extracted_text"),
                            rs.getString("extraction_error")));
                }
            }
            conn.commit();
            return documents;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list documents of case: " + caseId, e);
        }
    }

    @Override
    public void updateDocumentExtraction(String documentId, String extractedText, String extractionError) {
        executeUpdate("UPDATE case_documents SET extracted_text = ?, extraction_error = ? WHERE id = ?",
                "store extraction of document " + documentId, ps -> {
                    ps.setString(1, extractedText);
                    ps.setString(2, truncate(extractionError, 2048));
                    ps.setString(3, documentId);
                });
    }

    // ---------- precedents ----------

    @Override
    public void replacePrecedents(String caseId, List<PrecedentCase> precedents) {
        String insertSql = """
                    INSERT INTO precedent_cases (id, case_id, external_id, case_name, citation, court, jurisdiction,
                                                 outcome, summary, similarity_score, source, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM precedent_cases WHERE case_id = ?")) {
                    ps.setString(1, caseId);
                    ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    Timestamp now = Timestamp.from(Instant.now());
                    for (PrecedentCase p : precedents) {
                        ps.setString(1, UUID.randomUUID().toString());
                        ps.setString(2, caseId);
                        ps.setString(3, p.externalId());
                        ps.setString(4, truncate(p.caseName(), 1024));
                        ps.setString(5, truncate(p.citation(), 512));
                        ps.setString(6, truncate(p.court(), 512));
                        ps.setString(7, truncate(p.jurisdiction(), 256));
                        ps.setString(8, truncate(p.outcome(), 1024));
                        ps.setString(9, p.summary());
                        ps.setDouble(10, p.similarityScore());
                        ps.setString(11, p.source());
                        ps.setTimestamp(12, now);
                        ps.addBatch();
                    }
                    if (!precedents.isEmpty()) {
                        ps.executeBatch();
                    }
                }
                conn.commit();
                log.debug("Stored {} precedents for case {}", precedents.size(), caseId);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store precedents of case: " + caseId, e);
        }
    }

    @Override
    public List<PrecedentCase> findPrecedents(String caseId) {
        String sql = "SELECT * FROM precedent_cases WHERE case_id = ? ORDER BY similarity_score DESC, case_name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);

            List<PrecedentCase> precedents = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    precedents.add(new PrecedentCase(
                            rs.getString("external_id"),
                            rs.getString("case_name"),
                            rs.getString("citation"),
                            rs.getString("court"),
                            rs.getString("jurisdiction"),
                            rs.getString("outcome"),
                            rs.getString("summary"),
                            rs.getDouble("similarity_score"),
                            rs.getString("source")));
                }
            }
            conn.commit();
            return precedents;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list precedents of case: " + caseId, e);
        }
    }

    // ---------- predictions ----------

    @Override
    public void savePrediction(String caseId, String predictionJson, String supplementaryJson, Instant now) {
        String updateSql = "UPDATE case_predictions SET prediction = ?, supplementary = ?, created_at = ? WHERE case_id = ?";
        String insertSql = """
                    INSERT INTO case_predictions (case_id, prediction, supplementary, created_at)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, predictionJson);
                    ps.setString(2, supplementaryJson);
                    ps.setTimestamp(3, Timestamp.from(now));
                    ps.setString(4, caseId);
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, caseId);
                        ps.setString(2, predictionJson);
                        ps.setString(3, supplementaryJson);
                        ps.setTimestamp(4, Timestamp.from(now));
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store prediction of case: " + caseId, e);
        }
    }

    @Override
    public Optional<String> findPrediction(String caseId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT prediction FROM case_predictions WHERE case_id = ?")) {
            ps.setString(1, caseId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<String> found = rs.next() ? Optional.ofNullable(rs.getString("prediction")) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read prediction of case: " + caseId, e);
        }
    }

    // ---------- diagnostics ----------

    @Override
    public void recordError(ProcessingErrorRecord error) {
        String sql = """
                    INSERT INTO processing_errors (id, case_id, stage, error_type, error_message, error_stack, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        executeUpdate(sql, "record processing error of case " + error.caseId(), ps -> {
            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, error.caseId());
            ps.setString(3, error.stage());
            ps.setString(4, truncate(error.errorType(), 256));
            ps.setString(5, truncate(error.message() != null ? error.message() : "unknown error", 4000));
            ps.setString(6, error.stackTrace());
            setTimestamp(ps, 7, error.createdAt() != null ? error.createdAt() : Instant.now());
        });
    }

    @Override
    public List<ProcessingErrorRecord> findErrors(String caseId) {
        String sql = "SELECT * FROM processing_errors WHERE case_id = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, caseId);

            List<ProcessingErrorRecord> errors = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    errors.add(new ProcessingErrorRecord(
                            rs.getString("case_id"),
                            rs.getString("stage"),
                            rs.getString("error_type"),
                            rs.getString("error_message"),
                            rs.getString("error_stack"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            conn.commit();
            return errors;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list processing errors of case: " + caseId, e);
        }
    }

    // ---------- inbound events ----------

    @Override
    public void recordWebhookEvent(String eventType, String tableName, String recordId, String source,
            String outcome) {
        String sql = """
                    INSERT INTO webhook_events (id, event_type, table_name, record_id, source, outcome, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        executeUpdate(sql, "record webhook event", ps -> {
            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, truncate(eventType, 20));
            ps.setString(3, truncate(tableName, 128));
            ps.setString(4, truncate(recordId, 64));
            ps.setString(5, source);
            ps.setString(6, outcome);
            ps.setTimestamp(7, Timestamp.from(Instant.now()));
        });
    }

    @Override
    public int countWebhookEvents(String outcome) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT COUNT(*) FROM webhook_events WHERE outcome = ?")) {
            ps.setString(1, outcome);
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count webhook events", e);
        }
    }

    private CaseRecord mapCase(ResultSet rs) throws SQLException {
        int score = rs.getInt("outcome_prediction_score");
        Integer outcomeScore = rs.wasNull() ? null : score;
        return CaseRecord.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .caseName(rs.getString("case_name"))
                .narrative(rs.getString("case_narrative"))
                .caseType(rs.getString("case_type"))
                .jurisdiction(rs.getString("jurisdiction"))
                .legalIssues(rs.getString("legal_issues"))
                .enhancedSummary(rs.getString("enhanced_summary"))
                .processingStatus(ProcessingStatus.valueOf(rs.getString("processing_status")))
                .processingError(rs.getString("processing_error"))
                .outcomePredictionScore(outcomeScore)
                .riskLevel(rs.getString("risk_level"))
                .aiProcessed(rs.getBoolean("ai_processed"))
                .lastUpdate(toInstant(rs.getTimestamp("last_update")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private int executeUpdate(String sql, String description, StatementBinder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + description, e);
        }
    }
}
