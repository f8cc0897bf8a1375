package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.TaskStatus;

/**
 * Request DTO for a status change.
 * PATCH /api/v1/tasks/{id}/status
 */
public record UpdateStatusRequest(@JsonProperty("status") String status) {

    /**
     * @throws IllegalArgumentException if the status is missing or unknown
     */
    public TaskStatus parsedStatus() {
        return TaskStatus.parse(status);
    }
}
