package workforce.backend.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.JobStatus;

import java.util.Map;

/**
 * GET /internal/v1/jobs/stats
 */
public record JobStatsResponse(
        @JsonProperty("queues") Map<String, Map<JobStatus, Integer>> queues,
        @JsonProperty("totals") Map<JobStatus, Integer> totals) {
}
