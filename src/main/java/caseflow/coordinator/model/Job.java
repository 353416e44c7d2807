package caseflow.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable queue job.
 * Status only moves through the queue's claim/complete/fail operations.
 */
public final class Job {
    private final String id;
    private final String queueName;
    private final String data; // JSON payload
    private final JobStatus status;
    private final int priority;
    private final int attempts;
    private final int maxAttempts;
    private final Instant createdAt;
    private final Instant scheduledFor;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant failedAt;
    private final String error;
    private final String result; // JSON

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.queueName = Objects.requireNonNull(builder.queueName, "queueName is required");
        this.data = Objects.requireNonNull(builder.data, "data is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.createdAt = builder.createdAt;
        this.scheduledFor = builder.scheduledFor;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.failedAt = builder.failedAt;
        this.error = builder.error;
        this.result = builder.result;
    }

    public String id() {
        return id;
    }

    public String queueName() {
        return queueName;
    }

    public String data() {
        return data;
    }

    public JobStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant scheduledFor() {
        return scheduledFor;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public String error() {
        return error;
    }

    public String result() {
        return result;
    }

    /** True if one more failure would still leave the job retryable */
    public boolean canRetry() {
        return attempts + 1 < maxAttempts;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Eligible for claiming at the given instant */
    public boolean isEligibleAt(Instant now) {
        return status == JobStatus.PENDING && (scheduledFor == null || !scheduledFor.isAfter(now));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .queueName(queueName)
                .data(data)
                .status(status)
                .priority(priority)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .createdAt(createdAt)
                .scheduledFor(scheduledFor)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .error(error)
                .result(result);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String queueName;
        private String data;
        private JobStatus status = JobStatus.PENDING;
        private int priority = 0;
        private int attempts = 0;
        private int maxAttempts = 3;
        private Instant createdAt;
        private Instant scheduledFor;
        private Instant startedAt;
        private Instant completedAt;
        private Instant failedAt;
        private String error;
        private String result;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder data(String data) {
            this.data = data;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', queue='" + queueName + "', status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
