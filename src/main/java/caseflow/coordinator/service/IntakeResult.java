package caseflow.coordinator.service;

/**
 * What an inbound change event (or reprocess request) led to.
 *
 * @param outcome {@code enqueued}, {@code stored}, {@code ignored} or {@code conflict}
 * @param jobId   the job created, when one was
 */
public record IntakeResult(String outcome, String caseId, String jobId, String message) {

    public static final String ENQUEUED = "enqueued";
    public static final String STORED = "stored";
    public static final String IGNORED = "ignored";
    public static final String CONFLICT = "conflict";

    public static IntakeResult enqueued(String caseId, String jobId) {
        return new IntakeResult(ENQUEUED, caseId, jobId, "Case processing initiated");
    }

    public static IntakeResult stored(String caseId, String message) {
        return new IntakeResult(STORED, caseId, null, message);
    }

    public static IntakeResult ignored(String caseId, String message) {
        return new IntakeResult(IGNORED, caseId, null, message);
    }

    public static IntakeResult conflict(String caseId, String message) {
        return new IntakeResult(CONFLICT, caseId, null, message);
    }

    public boolean isEnqueued() {
        return ENQUEUED.equals(outcome);
    }
}
