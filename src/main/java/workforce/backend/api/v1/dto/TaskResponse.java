package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a task. The owning tenant is implied by the request and not echoed.
 */
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("assigneeId") String assigneeId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("complexity") int complexity,
        @JsonProperty("requiredSkills") List<String> requiredSkills,
        @JsonProperty("dueDate") Instant dueDate,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("active") boolean active,
        @JsonProperty("createdAt") Instant createdAt) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.assigneeId(),
                task.title(),
                task.description(),
                task.status().name(),
                task.priority().name(),
                task.complexity(),
                task.requiredSkills(),
                task.dueDate(),
                task.completedAt(),
                task.active(),
                task.createdAt());
    }
}
