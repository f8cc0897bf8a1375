package workforce.backend.service;

import workforce.backend.model.TaskStatus;

/**
 * Rejected task status change. Mapped to HTTP 422 with code {@value #CODE}.
 */
public class InvalidTransitionException extends RuntimeException {

    public static final String CODE = "INVALID_TRANSITION";

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(TaskStatus from, TaskStatus to) {
        this(from, to, "Cannot move task from " + from + " to " + to
                + " (allowed: " + (from.isTerminal() ? "none, terminal" : from.allowedNext()) + ")");
    }

    public InvalidTransitionException(TaskStatus from, TaskStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
