package workforce.backend.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.Job;

import java.time.Instant;

/**
 * Queue row as shown to operators. The payload is omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("id") String id,
        @JsonProperty("dedupKey") String dedupKey,
        @JsonProperty("queue") String queue,
        @JsonProperty("status") String status,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("maxAttempts") int maxAttempts,
        @JsonProperty("runAt") Instant runAt,
        @JsonProperty("failedAt") Instant failedAt,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("createdAt") Instant createdAt) {

    public static JobResponse from(Job job) {
        return new JobResponse(
                job.id(),
                job.dedupKey(),
                job.queue(),
                job.status().name(),
                job.attempts(),
                job.maxAttempts(),
                job.runAt(),
                job.failedAt(),
                job.errorMessage(),
                job.createdAt());
    }
}
