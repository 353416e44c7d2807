package caseflow.coordinator.model;

/**
 * Outcome of one claimBatch run.
 */
public record BatchResult(int processed, int succeeded, int failed) {

    public static BatchResult empty() {
        return new BatchResult(0, 0, 0);
    }
}
