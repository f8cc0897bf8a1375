package workforce.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.model.DispatchResult;
import workforce.backend.model.JobPayload;
import workforce.backend.model.LedgerJobPayload;
import workforce.backend.model.Queue;
import workforce.backend.model.ScoreJobPayload;
import workforce.backend.model.Task;
import workforce.backend.model.TransitionResult;
import workforce.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Turns a completed task into durable background jobs.
 * Writes on the caller's transaction, so the jobs exist exactly when the
 * completion does. Never waits for execution.
 */
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final JobStore jobStore;
    private final ObjectMapper mapper;
    private final int maxAttempts;

    public JobDispatcher(JobStore jobStore, ObjectMapper mapper, int maxAttempts) {
        this.jobStore = jobStore;
        this.mapper = mapper;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Enqueue the follow-up work of a transition. Does nothing unless the
     * transition entered COMPLETED.
     */
    public DispatchResult dispatch(Connection conn, TransitionResult transition) throws SQLException {
        if (!transition.dispatchEligible()) {
            return DispatchResult.none();
        }
        return dispatchCompletion(conn, transition.task());
    }

    /**
     * Enqueue scoring of the assignee (when there is one) and the ledger record of the task.
     */
    public DispatchResult dispatchCompletion(Connection conn, Task task) throws SQLException {
        boolean scoringEnqueued = false;
        if (task.hasAssignee()) {
            scoringEnqueued = enqueue(conn, Queue.SCORING,
                    new ScoreJobPayload(task.tenantId(), task.id(), task.assigneeId()));
        } else {
            log.debug("Task {} has no assignee, scoring skipped", task.id());
        }

        boolean ledgerEnqueued = enqueue(conn, Queue.LEDGER, new LedgerJobPayload(task.tenantId(), task.id()));

        return new DispatchResult(scoringEnqueued, ledgerEnqueued);
    }

    /**
     * Insert-if-absent of one job keyed by the payload's task.
     *
     * @return true if a new job was created, false if an identical one already existed
     */
    public boolean enqueue(Connection conn, Queue queue, JobPayload payload) throws SQLException {
        if (!queue.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Queue " + queue.queueName() + " does not accept "
                    + payload.getClass().getSimpleName());
        }

        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload for queue " + queue.queueName(), e);
        }

        String dedupKey = queue.dedupKey(payload.taskId());
        boolean created = jobStore.enqueue(conn, queue.queueName(), dedupKey, json, maxAttempts);
        if (!created) {
            log.debug("Duplicate enqueue absorbed for key {}", dedupKey);
        }
        return created;
    }
}
