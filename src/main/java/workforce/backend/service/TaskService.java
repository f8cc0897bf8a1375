package workforce.backend.service;

import workforce.backend.model.DispatchResult;
import workforce.backend.model.StatusUpdateResult;
import workforce.backend.model.Task;
import workforce.backend.model.TaskPriority;
import workforce.backend.model.TaskStatus;
import workforce.backend.model.TransitionResult;
import workforce.backend.repository.TaskRepository;
import workforce.backend.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Service layer for task operations.
 * Status changes go through {@link TaskLifecycle}, follow-up work through {@link JobDispatcher}.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final int MAX_LIST_LIMIT = 500;

    private final TaskRepository taskRepository;
    private final TaskLifecycle lifecycle;
    private final JobDispatcher dispatcher;
    private final Database db;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, TaskLifecycle lifecycle, JobDispatcher dispatcher, Database db,
            Clock clock) {
        this.taskRepository = taskRepository;
        this.lifecycle = lifecycle;
        this.dispatcher = dispatcher;
        this.db = db;
        this.clock = clock;
    }

    /**
     * Create a task in status ASSIGNED.
     */
    public Task create(String tenantId, TaskDraft draft) {
        requireTenant(tenantId);
        if (draft.title() == null || draft.title().isBlank()) {
            throw new IllegalArgumentException("title is required");
        }

        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .tenantId(tenantId)
                .assigneeId(blankToNull(draft.assigneeId()))
                .title(draft.title().trim())
                .description(draft.description())
                .status(TaskStatus.ASSIGNED)
                .priority(draft.priority() != null ? draft.priority() : TaskPriority.MEDIUM)
                .complexity(draft.complexity() != null ? draft.complexity() : 3)
                .requiredSkills(draft.requiredSkills())
                .dueDate(draft.dueDate())
                .active(true)
                .createdAt(clock.instant())
                .build();

        taskRepository.save(task);
        log.info("Created task {} for tenant {} (assignee {})", task.id(), tenantId, task.assigneeId());
        return task;
    }

    /**
     * @throws NotFoundException if the tenant has no such task
     */
    public Task get(String tenantId, String taskId) {
        requireTenant(tenantId);
        return taskRepository.findById(tenantId, taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
    }

    public List<Task> list(String tenantId, TaskStatus status, String assigneeId, int limit) {
        requireTenant(tenantId);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return taskRepository.findByTenant(tenantId, status, blankToNull(assigneeId),
                Math.min(limit, MAX_LIST_LIMIT));
    }

    /**
     * Apply a status change and, when it completes the task, enqueue scoring and ledger jobs.
     * Status and jobs commit in one transaction: a failed enqueue leaves the task unchanged,
     * so the client can repeat the request. Returns as soon as the jobs are durably stored.
     *
     * @throws NotFoundException          if the task does not exist or was deactivated
     * @throws InvalidTransitionException if the change is not allowed
     */
    public StatusUpdateResult updateStatus(String tenantId, String taskId, TaskStatus requested) {
        Task task = get(tenantId, taskId);
        if (!task.active()) {
            throw new NotFoundException("Task not found: " + taskId);
        }

        StatusUpdateResult result = db.inTransaction("update status of task: " + taskId, conn -> {
            TransitionResult transition = lifecycle.transition(conn, task, requested);
            DispatchResult dispatched = dispatcher.dispatch(conn, transition);
            return new StatusUpdateResult(transition.task(), dispatched.scoringEnqueued());
        });

        log.info("Task {} {} -> {}", taskId, task.status(), requested);
        if (requested == TaskStatus.COMPLETED) {
            log.info("Task {} completed, scoring queued={}", taskId, result.scoringQueued());
        }

        return result;
    }

    /**
     * Soft delete. Deactivated tasks drop out of listings and scoring.
     *
     * @throws NotFoundException if there is no active task with this id
     */
    public void deactivate(String tenantId, String taskId) {
        requireTenant(tenantId);
        if (!taskRepository.deactivate(tenantId, taskId)) {
            throw new NotFoundException("Task not found: " + taskId);
        }
        log.info("Task {} deactivated", taskId);
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
