package caseflow.coordinator.service;

/**
 * Result of one worker tick. An empty queue is reported as not processed, not as an error.
 */
public record WorkerOutcome(boolean processed, String jobId, boolean succeeded, String error) {

    public static final String NO_ELIGIBLE_JOB = "no_eligible_job";

    public static WorkerOutcome noEligibleJob() {
        return new WorkerOutcome(false, null, false, null);
    }

    public static WorkerOutcome succeeded(String jobId) {
        return new WorkerOutcome(true, jobId, true, null);
    }

    public static WorkerOutcome failed(String jobId, String error) {
        return new WorkerOutcome(true, jobId, false, error);
    }
}
