package workforce.backend.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import workforce.backend.model.TaskPriority;
import workforce.backend.service.TaskDraft;

import java.time.Instant;
import java.util.List;

/**
 * Request DTO for creating a task.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("assigneeId") String assigneeId,
        @JsonProperty("priority") String priority,
        @JsonProperty("complexity") Integer complexity,
        @JsonProperty("requiredSkills") List<String> requiredSkills,
        @JsonProperty("dueDate") Instant dueDate) {

    /** Validate the request */
    public void validate() {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (complexity != null && (complexity < 1 || complexity > 5)) {
            throw new IllegalArgumentException("complexity must be between 1 and 5");
        }
    }

    public TaskDraft toDraft() {
        return new TaskDraft(
                title,
                description,
                assigneeId,
                TaskPriority.parseOrDefault(priority),
                complexity,
                requiredSkills,
                dueDate);
    }
}
