package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("pendingJobs") Integer pendingJobs,
        @JsonProperty("processingJobs") Integer processingJobs,
        @JsonProperty("failedJobs") Integer failedJobs,
        @JsonProperty("ledgerEnabled") Boolean ledgerEnabled) {

    public static HealthResponse healthy(String uptime, String version, int pendingJobs, int processingJobs,
            int failedJobs, boolean ledgerEnabled) {
        return new HealthResponse("healthy", "ok", uptime, version, pendingJobs, processingJobs, failedJobs,
                ledgerEnabled);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
