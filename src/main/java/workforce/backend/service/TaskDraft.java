package workforce.backend.service;

import workforce.backend.model.TaskPriority;

import java.time.Instant;
import java.util.List;

/**
 * Fields of a task to create. Status, id and timestamps are assigned by {@link TaskService}.
 */
public record TaskDraft(
        String title,
        String description,
        String assigneeId,
        TaskPriority priority,
        Integer complexity,
        List<String> requiredSkills,
        Instant dueDate) {
}
