package caseflow.coordinator.model;

/**
 * Result of completing a job.
 */
public enum JobCompleteResult {
    /** Job moved from PROCESSING to COMPLETED */
    COMPLETED,

    /** Job was already COMPLETED or FAILED */
    ALREADY_TERMINAL,

    /** Job is PENDING again (lease expired and was reaped) */
    NOT_PROCESSING,

    /** Job not found */
    NOT_FOUND
}
