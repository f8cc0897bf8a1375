package workforce.backend.service;

import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import workforce.backend.model.TransitionResult;
import workforce.backend.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;

/**
 * The only writer of task status.
 * Validates against {@link TaskStatus#allowedNext()} and persists with a
 * conditional update, so a concurrent change makes the second writer fail
 * instead of overwriting.
 */
public class TaskLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycle.class);

    private final TaskRepository taskRepository;
    private final Clock clock;

    public TaskLifecycle(TaskRepository taskRepository, Clock clock) {
        this.taskRepository = taskRepository;
        this.clock = clock;
    }

    /**
     * Move a task to the requested status on the caller's transaction.
     * Nothing is visible until the caller commits.
     *
     * @throws InvalidTransitionException if the move is not allowed or the task changed concurrently
     */
    public TransitionResult transition(Connection conn, Task task, TaskStatus requested) throws SQLException {
        TaskStatus current = task.status();
        if (!current.canTransitionTo(requested)) {
            throw new InvalidTransitionException(current, requested);
        }

        Instant completedAt = requested == TaskStatus.COMPLETED ? clock.instant() : null;

        boolean updated = taskRepository.updateStatus(conn, task.tenantId(), task.id(), current, requested,
                completedAt);
        if (!updated) {
            log.debug("Task {} was no longer {} when moving to {}", task.id(), current, requested);
            throw new InvalidTransitionException(current, requested,
                    "Task " + task.id() + " is no longer " + current + ", reload and retry");
        }

        Task moved = task.toBuilder()
                .status(requested)
                .completedAt(completedAt)
                .build();

        return new TransitionResult(moved, requested == TaskStatus.COMPLETED);
    }
}
