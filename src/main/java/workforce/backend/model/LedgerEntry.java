package workforce.backend.model;

import java.time.Instant;

/**
 * Local record of a task completion written to the external ledger.
 * At most one per task.
 */
public record LedgerEntry(
        String id,
        String tenantId,
        String taskId,
        String txReference,
        String eventKind,
        Instant loggedAt) {

    public static final String TASK_COMPLETED = "TASK_COMPLETED";
}
