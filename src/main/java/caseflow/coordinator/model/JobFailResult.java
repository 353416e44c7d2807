package caseflow.coordinator.model;

/**
 * Result of failing a job.
 */
public enum JobFailResult {
    /** Attempt recorded, job back to PENDING with a later scheduled_for */
    RETRIED,

    /** Attempts exhausted, job permanently FAILED */
    FAILED,

    /** Job exists but is not PROCESSING (lease lost or already terminal) */
    NOT_PROCESSING,

    /** Job not found */
    NOT_FOUND
}
