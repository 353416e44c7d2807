package caseflow.coordinator.scheduler;

import caseflow.coordinator.config.CoordinatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background scheduled tasks:
 * - JobReaper: expires leases of stuck PROCESSING jobs
 * - RetentionSweeper: deletes old FAILED jobs
 * - QueuePoller: optional in-process worker tick
 *
 * Uses a single-threaded executor so the tasks never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final JobReaper jobReaper;
    private final RetentionSweeper retentionSweeper;
    private final QueuePoller queuePoller;
    private final CoordinatorConfig config;

    private volatile boolean running = false;

    /**
     * @param queuePoller null when in-process polling is disabled
     */
    public Scheduler(JobReaper jobReaper, RetentionSweeper retentionSweeper, QueuePoller queuePoller,
            CoordinatorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "caseflow-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.jobReaper = jobReaper;
        this.retentionSweeper = retentionSweeper;
        this.queuePoller = queuePoller;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        schedule("Job reaper", jobReaper, config.reaperInterval());
        schedule("Retention sweeper", retentionSweeper, config.retentionInterval());
        if (queuePoller != null) {
            schedule("Queue poller", queuePoller, config.pollInterval());
        }

        log.info("Scheduler started");
    }

    private void schedule(String name, Runnable task, Duration interval) {
        long ms = interval.toMillis();
        executor.scheduleAtFixedRate(task, ms, ms, TimeUnit.MILLISECONDS);
        log.info("{} scheduled every {}ms", name, ms);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public JobReaper jobReaper() {
        return jobReaper;
    }
}
