package workforce.backend.repository;

import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Status is written only through {@link #updateStatus}, which the lifecycle owns.
 */
public interface TaskRepository {

    void save(Task task);

    /**
     * Find an active or inactive task of a tenant.
     */
    Optional<Task> findById(String tenantId, String taskId);

    /**
     * List tasks of a tenant.
     *
     * @param status     optional status filter
     * @param assigneeId optional assignee filter
     * @param limit      maximum results
     */
    List<Task> findByTenant(String tenantId, TaskStatus status, String assigneeId, int limit);

    /**
     * Active tasks assigned to one employee, any status. Input of the scorer.
     */
    List<Task> findActiveByAssignee(String tenantId, String assigneeId);

    /**
     * Every task ever assigned to one of the given employees, including deactivated ones.
     */
    List<Task> findByAssignees(String tenantId, Collection<String> assigneeIds);

    /**
     * Active assigned tasks of a tenant counted per assignee and status.
     * Unassigned tasks are left out.
     */
    Map<String, Map<TaskStatus, Integer>> countByAssigneeAndStatus(String tenantId);

    /**
     * Conditional status write: succeeds only while the row still has the expected status.
     *
     * @param expected    status the caller validated against
     * @param next        new status
     * @param completedAt completion stamp, null unless next is COMPLETED
     * @return true if the row was updated
     */
    boolean updateStatus(String tenantId, String taskId, TaskStatus expected, TaskStatus next, Instant completedAt);

    /**
     * Same as {@link #updateStatus(String, String, TaskStatus, TaskStatus, Instant)} on the caller's
     * transaction, so the follow-up jobs commit or roll back together with the status. Does not commit.
     */
    boolean updateStatus(Connection conn, String tenantId, String taskId, TaskStatus expected, TaskStatus next,
            Instant completedAt) throws SQLException;

    /**
     * Soft delete.
     *
     * @return true if the task was active and is now inactive
     */
    boolean deactivate(String tenantId, String taskId);
}
