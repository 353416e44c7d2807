package caseflow.coordinator.repository;

import caseflow.coordinator.model.StageRecord;
import caseflow.coordinator.pipeline.StageKind;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stage records, keyed by (case id, stage). Written only by the orchestrator.
 */
public interface StageRepository {

    /**
     * Drop the stage records of a case before a new run.
     */
    void clear(String caseId);

    void markRunning(String caseId, StageKind stage, Instant now);

    /**
     * Checkpoint: store the stage output and mark it COMPLETED.
     */
    void markCompleted(String caseId, StageKind stage, String outputJson, Instant now);

    void markFailed(String caseId, StageKind stage, String error, Instant now);

    Optional<StageRecord> find(String caseId, StageKind stage);

    /**
     * All stage records of a case in pipeline order.
     */
    List<StageRecord> findByCase(String caseId);
}
