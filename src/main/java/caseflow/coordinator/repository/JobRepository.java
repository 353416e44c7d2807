package caseflow.coordinator.repository;

import caseflow.coordinator.model.Job;
import caseflow.coordinator.model.JobCompleteResult;
import caseflow.coordinator.model.JobFailResult;
import caseflow.coordinator.model.JobStatus;
import caseflow.coordinator.model.QueueStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * Repository interface for queue jobs.
 * Every status change is a conditional update keyed on the prior status, so
 * independent worker processes sharing the store never double-claim a job.
 */
public interface JobRepository {

    /**
     * Insert a new job.
     *
     * @param job the job to save
     */
    void save(Job job);

    /**
     * Find a job by ID.
     *
     * @param jobId the job ID
     * @return the job if found
     */
    Optional<Job> findById(String jobId);

    /**
     * Find jobs of a queue in one status, oldest first.
     */
    List<Job> findByStatus(String queueName, JobStatus status, int limit);

    /**
     * Atomically claim the next eligible job of a queue.
     * Eligible: PENDING and scheduled_for at or before now. Order: priority
     * descending, then created_at ascending.
     *
     * @param queueName the queue
     * @param now       claim time, recorded as started_at
     * @return the claimed job (PROCESSING), or empty when none is eligible
     */
    Optional<Job> claimNext(String queueName, Instant now);

    /**
     * Move a PROCESSING job to COMPLETED.
     *
     * @param jobId  the job ID
     * @param result result JSON, may be null
     * @param now    completion time
     * @return outcome
     */
    JobCompleteResult complete(String jobId, String result, Instant now);

    /**
     * Record a failed attempt of a PROCESSING job.
     * Increments attempts; if attempts stays below max_attempts the job goes
     * back to PENDING with scheduled_for = now + retryDelay(attempts),
     * otherwise it becomes FAILED.
     *
     * @param jobId      the job ID
     * @param error      error text
     * @param now        failure time
     * @param retryDelay delay for a given (already incremented) attempt count
     * @return outcome
     */
    JobFailResult fail(String jobId, String error, Instant now, IntFunction<Duration> retryDelay);

    /**
     * Find PROCESSING jobs whose lease started before the given instant.
     */
    List<Job> findStuckProcessing(Instant startedBefore);

    /**
     * Count jobs per status.
     */
    QueueStats stats(String queueName);

    /**
     * Delete FAILED jobs of a queue whose failed_at is before the cutoff.
     *
     * @return number of rows removed
     */
    int deleteFailedBefore(String queueName, Instant cutoff);
}
