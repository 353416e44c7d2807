package caseflow.coordinator.repository;

import caseflow.coordinator.model.CaseDocument;
import caseflow.coordinator.model.CaseRecord;
import caseflow.coordinator.model.PrecedentCase;
import caseflow.coordinator.model.ProcessingErrorRecord;
import caseflow.coordinator.model.ProcessingStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for cases and the records hanging off them
 * (documents, precedents, predictions, diagnostics, inbound event log).
 */
public interface CaseRepository {

    /**
     * Insert the case or update its content fields.
     * An existing case keeps its processing status and enrichment results.
     */
    void upsert(CaseRecord caseRecord);

    Optional<CaseRecord> findById(String caseId);

    /**
     * Durable status write, applied only while the case is still in the expected status.
     *
     * @param expected the status the caller read and checked the transition from
     * @return false if the case does not exist or is no longer in {@code expected}
     */
    boolean updateStatus(String caseId, ProcessingStatus expected, ProcessingStatus status, String error,
            Instant now);

    /**
     * Put a case back to PENDING ahead of a manual reprocess.
     *
     * @return false if the case does not exist or is currently PROCESSING
     */
    boolean resetToPending(String caseId, Instant now);

    void updateIntake(String caseId, String caseType, String legalIssuesJson);

    void updateEnhancement(String caseId, String jurisdiction, String enhancedSummary);

    void updatePrediction(String caseId, int outcomePredictionScore, String riskLevel);

    /**
     * Other cases with the same case type or jurisdiction, newest first.
     */
    List<CaseRecord> findSimilar(String caseId, String caseType, String jurisdiction, int limit);

    // Documents

    void upsertDocument(CaseDocument document);

    List<CaseDocument> findDocuments(String caseId);

    void updateDocumentExtraction(String documentId, String extractedText, String extractionError);

    // Precedents

    /**
     * Replace the precedent set of a case in one transaction.
     */
    void replacePrecedents(String caseId, List<PrecedentCase> precedents);

    List<PrecedentCase> findPrecedents(String caseId);

    // Predictions

    void savePrediction(String caseId, String predictionJson, String supplementaryJson, Instant now);

    Optional<String> findPrediction(String caseId);

    // Diagnostics

    void recordError(ProcessingErrorRecord error);

    List<ProcessingErrorRecord> findErrors(String caseId);

    // Inbound change events

    void recordWebhookEvent(String eventType, String tableName, String recordId, String source, String outcome);

    int countWebhookEvents(String outcome);
}
