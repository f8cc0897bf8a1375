package workforce.backend.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle status.
 * Status only moves forward: ASSIGNED -> IN_PROGRESS -> COMPLETED.
 */
public enum TaskStatus {
    /** Task created and handed to an assignee */
    ASSIGNED,
    /** Assignee started working on it */
    IN_PROGRESS,
    /** Terminal state, completedAt is stamped */
    COMPLETED;

    /**
     * Statuses this status may move to. Empty for terminal states.
     */
    public Set<TaskStatus> allowedNext() {
        return switch (this) {
            case ASSIGNED -> EnumSet.of(IN_PROGRESS);
            case IN_PROGRESS -> EnumSet.of(COMPLETED);
            case COMPLETED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return allowedNext().isEmpty();
    }

    /**
     * Lenient parse accepting "in_progress", "IN_PROGRESS" or "in-progress".
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return TaskStatus.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
