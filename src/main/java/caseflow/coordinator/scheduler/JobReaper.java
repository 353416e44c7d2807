package caseflow.coordinator.scheduler;

import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.repository.JobRepository;
import caseflow.coordinator.service.JobQueueService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers jobs whose worker went away.
 *
 * A job left PROCESSING longer than the lease timeout is failed like any other
 * failure: it consumes an attempt and is either rescheduled with backoff or
 * marked FAILED for good.
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    static final String LEASE_EXPIRED = "lease expired";

    private final JobRepository jobRepository;
    private final JobQueueService queue;
    private final Duration leaseTimeout;
    private final Clock clock;
    private final LeaseExpiryListener listener;

    public JobReaper(JobRepository jobRepository, JobQueueService queue, Duration leaseTimeout, Clock clock,
            LeaseExpiryListener listener) {
        this.jobRepository = jobRepository;
        this.queue = queue;
        this.leaseTimeout = leaseTimeout;
        this.clock = clock;
        this.listener = listener;
    }

    @Override
    public void run() {
        try {
            reapExpiredLeases();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * @return number of jobs whose lease was expired
     */
    public int reapExpiredLeases() {
        Instant cutoff = clock.instant().minus(leaseTimeout);
        List<Job> stuck = jobRepository.findStuckProcessing(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No expired leases");
            return 0;
        }

        int retried = 0;
        int failed = 0;
        for (Job job : stuck) {
            try {
                JobFailResult result = queue.fail(job.id(), LEASE_EXPIRED);
                if (result == JobFailResult.RETRIED) {
                    retried++;
                } else if (result == JobFailResult.FAILED) {
                    failed++;
                } else {
                    // Finished or reaped elsewhere in the meantime
                    continue;
                }
                listener.onLeaseExpired(job);
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Job reaper: {} retried, {} failed, {} total stuck", retried, failed, stuck.size());
        return retried + failed;
    }
}
