package workforce.backend.repository;

import workforce.backend.model.LedgerEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface LedgerEntryRepository {

    /**
     * Insert the entry for a task.
     *
     * @return false if the task already has an entry
     */
    boolean insert(String tenantId, String taskId, String txReference, String eventKind);

    Optional<LedgerEntry> findByTaskId(String taskId);

    /**
     * Entries of a tenant, newest first.
     */
    List<LedgerEntry> findByTenant(String tenantId, int limit);

    int countAll();

    /**
     * Ledger entries of a tenant per assignee of the recorded task.
     */
    Map<String, Integer> countByAssignee(String tenantId);
}
