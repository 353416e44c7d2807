package caseflow.coordinator.model;

import caseflow.coordinator.pipeline.StageKind;

import java.time.Instant;

/**
 * Persisted state of one pipeline stage for one case.
 * Output is the stage's checkpoint (JSON), present once COMPLETED.
 */
public record StageRecord(
        String caseId,
        StageKind stage,
        StageStatus status,
        String output,
        Instant startedAt,
        Instant completedAt,
        String error) {

    public boolean isCompleted() {
        return status == StageStatus.COMPLETED;
    }
}
