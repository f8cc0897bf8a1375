package workforce.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the scoring queue: recompute the score of one employee.
 */
public record ScoreJobPayload(
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("employeeId") String employeeId) implements JobPayload {

    public void validate() {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("employeeId is required");
        }
    }
}
