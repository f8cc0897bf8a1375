package workforce.backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the ledger queue: record one task completion on the ledger.
 */
public record LedgerJobPayload(
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("taskId") String taskId) implements JobPayload {

    public void validate() {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
    }
}
