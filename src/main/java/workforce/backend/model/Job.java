package workforce.backend.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A durable work item in the job queue.
 * The table only holds outstanding or dead work: a job that ran successfully is deleted.
 */
public final class Job {
    private final String id;
    private final String dedupKey;
    private final String queue;
    private final String payload; // JSON, decoded per queue into a JobPayload
    private final JobStatus status;
    private final int attempts;
    private final int maxAttempts;
    private final Instant runAt;
    private final Instant claimedAt;
    private final String claimToken; // issued per claim, fences complete/fail of a stale claimant
    private final Instant failedAt;
    private final String errorMessage;
    private final Instant createdAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.dedupKey = builder.dedupKey;
        this.queue = Objects.requireNonNull(builder.queue, "queue is required");
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attempts = builder.attempts;
        this.maxAttempts = builder.maxAttempts;
        this.runAt = builder.runAt;
        this.claimedAt = builder.claimedAt;
        this.claimToken = builder.claimToken;
        this.failedAt = builder.failedAt;
        this.errorMessage = builder.errorMessage;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String dedupKey() {
        return dedupKey;
    }

    public String queue() {
        return queue;
    }

    public String payload() {
        return payload;
    }

    public JobStatus status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Instant runAt() {
        return runAt;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public String claimToken() {
        return claimToken;
    }

    public Instant failedAt() {
        return failedAt;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** Check if another attempt is allowed */
    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String dedupKey;
        private String queue;
        private String payload;
        private JobStatus status = JobStatus.PENDING;
        private int attempts = 0;
        private int maxAttempts = 3;
        private Instant runAt;
        private Instant claimedAt;
        private String claimToken;
        private Instant failedAt;
        private String errorMessage;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder dedupKey(String dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
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

        public Builder runAt(Instant runAt) {
            this.runAt = runAt;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder claimToken(String claimToken) {
            this.claimToken = claimToken;
            return this;
        }

        public Builder failedAt(Instant failedAt) {
            this.failedAt = failedAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
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
        return "Job{id='" + id + "', queue='" + queue + "', key='" + dedupKey + "', status=" + status
                + ", attempts=" + attempts + "/" + maxAttempts + "}";
    }
}
