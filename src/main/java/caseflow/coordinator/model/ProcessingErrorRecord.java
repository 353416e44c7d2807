package caseflow.coordinator.model;

import java.time.Instant;

/**
 * Operator-facing diagnostic for a failed pipeline run.
 */
public record ProcessingErrorRecord(
        String caseId,
        String stage,
        String errorType,
        String message,
        String stackTrace,
        Instant createdAt) {
}
