package caseflow.coordinator.scheduler;

import caseflow.coordinator.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically deletes old FAILED jobs of one queue.
 */
public class RetentionSweeper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final JobQueueService queue;
    private final String queueName;
    private final int maxAgeHours;

    public RetentionSweeper(JobQueueService queue, String queueName, int maxAgeHours) {
        this.queue = queue;
        this.queueName = queueName;
        this.maxAgeHours = maxAgeHours;
    }

    @Override
    public void run() {
        try {
            queue.cleanup(queueName, maxAgeHours);
        } catch (Exception e) {
            log.error("Retention sweep of {} failed", queueName, e);
        }
    }
}
