package caseflow.coordinator.scheduler;

import caseflow.coordinator.service.CaseProcessingWorker;
import caseflow.coordinator.service.WorkerOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process worker tick for long-lived deployments. Drains eligible jobs one
 * at a time, up to a bound per run.
 */
public class QueuePoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(QueuePoller.class);

    private final CaseProcessingWorker worker;
    private final String queueName;
    private final int maxJobsPerRun;

    public QueuePoller(CaseProcessingWorker worker, String queueName, int maxJobsPerRun) {
        this.worker = worker;
        this.queueName = queueName;
        this.maxJobsPerRun = maxJobsPerRun;
    }

    @Override
    public void run() {
        try {
            for (int i = 0; i < maxJobsPerRun; i++) {
                WorkerOutcome outcome = worker.tick(queueName);
                if (!outcome.processed()) {
                    return;
                }
            }
        } catch (Exception e) {
            log.error("Queue poller error on {}", queueName, e);
        }
    }
}
