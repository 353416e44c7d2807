package caseflow.coordinator.service;

import caseflow.coordinator.config.CoordinatorConfig;
import caseflow.coordinator.model.BatchResult;
import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobCompleteResult;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.model.QueueStats;
import caseflow.coordinator.repository.JobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for the durable job queue.
 * Validates arguments, applies defaults and the backoff policy, and runs
 * claim-and-process batches.
 */
public class JobQueueService {

    private static final Logger log = LoggerFactory.getLogger(JobQueueService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

    private final JobRepository jobRepository;
    private final CoordinatorConfig config;
    private final BackoffPolicy backoff;
    private final Clock clock;

    public JobQueueService(JobRepository jobRepository, CoordinatorConfig config) {
        this(jobRepository, config, Clock.systemUTC());
    }

    public JobQueueService(JobRepository jobRepository, CoordinatorConfig config, Clock clock) {
        this.jobRepository = jobRepository;
        this.config = config;
        this.backoff = new BackoffPolicy(config.queueBackoffBase(), config.queueBackoffMax());
        this.clock = clock;
    }

    /**
     * Options for a new job. Null fields fall back to the defaults.
     */
    public record EnqueueOptions(Integer priority, Integer maxAttempts, Instant scheduledFor) {

        public static EnqueueOptions defaults() {
            return new EnqueueOptions(null, null, null);
        }

        public static EnqueueOptions withPriority(int priority) {
            return new EnqueueOptions(priority, null, null);
        }
    }

    /**
     * Enqueue a job with default options.
     *
     * @return the new job ID
     */
    public String enqueue(String queueName, Object payload) {
        return enqueue(queueName, payload, EnqueueOptions.defaults());
    }

    /**
     * Create a PENDING job. No deduplication of payloads.
     *
     * @param queueName target queue
     * @param payload   anything Jackson can serialize (a JSON string is stored as-is)
     * @param options   priority, max attempts and earliest run time
     * @return the new job ID
     */
    public String enqueue(String queueName, Object payload, EnqueueOptions options) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload is required");
        }
        EnqueueOptions opts = options != null ? options : EnqueueOptions.defaults();
        int maxAttempts = opts.maxAttempts() != null ? opts.maxAttempts() : config.defaultMaxAttempts();
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }

        Instant now = clock.instant();
        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .queueName(queueName)
                .data(toJson(payload))
                .status(JobStatus.PENDING)
                .priority(opts.priority() != null ? opts.priority() : 0)
                .maxAttempts(maxAttempts)
                .createdAt(now)
                .scheduledFor(opts.scheduledFor() != null ? opts.scheduledFor() : now)
                .build();

        jobRepository.save(job);
        log.info("Enqueued job {} on {} (priority {}, maxAttempts {})",
                job.id(), queueName, job.priority(), maxAttempts);
        return job.id();
    }

    /**
     * Lease the next eligible job of a queue.
     *
     * @return the claimed job, or empty when the queue has nothing eligible
     */
    public Optional<Job> claimNext(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        Optional<Job> claimed = jobRepository.claimNext(queueName, clock.instant());
        claimed.ifPresent(job -> log.info("Claimed job {} from {} (attempt {} of {})",
                job.id(), queueName, job.attempts() + 1, job.maxAttempts()));
        return claimed;
    }

    public JobCompleteResult complete(String jobId, String result) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }

        JobCompleteResult res = jobRepository.complete(jobId, result, clock.instant());

        if (res == JobCompleteResult.COMPLETED) {
            log.info("Job {} completed", jobId);
        } else {
            log.warn("Could not complete job {}: {}", jobId, res);
        }
        return res;
    }

    public JobFailResult fail(String jobId, String error) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required");
        }

        JobFailResult res = jobRepository.fail(jobId, error, clock.instant(), backoff::delay);

        if (res == JobFailResult.RETRIED) {
            log.info("Job {} failed, will retry: {}", jobId, error);
        } else if (res == JobFailResult.FAILED) {
            log.warn("Job {} permanently failed: {}", jobId, error);
        } else {
            log.warn("Could not record failure of job {}: {}", jobId, res);
        }
        return res;
    }

    /**
     * Claim and process up to batchSize jobs one after another.
     * A handler exception fails that job and the batch moves on.
     */
    public BatchResult claimBatch(String queueName, int batchSize, JobHandler handler) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }

        int limit = Math.min(batchSize, config.maxBatchSize());
        int processed = 0;
        int succeeded = 0;
        int failed = 0;

        for (int i = 0; i < limit; i++) {
            Optional<Job> claimed = claimNext(queueName);
            if (claimed.isEmpty()) {
                break;
            }
            Job job = claimed.get();
            processed++;

            try {
                String result = handler.handle(job);
                complete(job.id(), result);
                succeeded++;
            } catch (Exception e) {
                log.warn("Handler failed for job {}: {}", job.id(), e.getMessage(), e);
                fail(job.id(), describe(e));
                failed++;
            }
        }

        if (processed > 0) {
            log.info("Batch on {}: {} processed, {} succeeded, {} failed", queueName, processed, succeeded, failed);
        }
        return new BatchResult(processed, succeeded, failed);
    }

    public QueueStats stats(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        return jobRepository.stats(queueName);
    }

    /**
     * Delete FAILED jobs older than maxAgeHours.
     *
     * @return number of jobs removed
     */
    public int cleanup(String queueName, int maxAgeHours) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("queueName is required");
        }
        if (maxAgeHours < 0) {
            throw new IllegalArgumentException("maxAgeHours must be >= 0");
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        int removed = jobRepository.deleteFailedBefore(queueName, cutoff);
        if (removed > 0) {
            log.info("Removed {} failed jobs older than {}h from {}", removed, maxAgeHours, queueName);
        }
        return removed;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    public BackoffPolicy backoff() {
        return backoff;
    }

    static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    private static String toJson(Object payload) {
        if (payload instanceof String s) {
            return s;
        }
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
