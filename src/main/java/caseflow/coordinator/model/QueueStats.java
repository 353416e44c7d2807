package caseflow.coordinator.model;

/**
 * Job counts per status for one queue.
 */
public record QueueStats(String queueName, int pending, int processing, int completed, int failed) {

    public int total() {
        return pending + processing + completed + failed;
    }
}
