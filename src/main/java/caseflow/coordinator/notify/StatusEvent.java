package caseflow.coordinator.notify;

import caseflow.coordinator.model.ProcessingStatus;

import java.time.Instant;

/**
 * A case changed processing status.
 */
public record StatusEvent(
        String caseId,
        String userId,
        ProcessingStatus status,
        String error,
        Instant timestamp) {
}
