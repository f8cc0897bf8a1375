package workforce.backend.worker;

import workforce.backend.ledger.LedgerClient;
import workforce.backend.ledger.LedgerWriteFailedException;
import workforce.backend.model.LedgerEntry;
import workforce.backend.model.LedgerJobPayload;
import workforce.backend.model.Queue;
import workforce.backend.repository.LedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Records a task completion on the ledger and stores the local entry.
 * Idempotent per task through the unique task id of ledger entries.
 */
public class LedgerJobHandler implements JobHandler<LedgerJobPayload> {

    private static final Logger log = LoggerFactory.getLogger(LedgerJobHandler.class);

    private final LedgerClient ledgerClient;
    private final LedgerEntryRepository entryRepository;

    public LedgerJobHandler(LedgerClient ledgerClient, LedgerEntryRepository entryRepository) {
        this.ledgerClient = ledgerClient;
        this.entryRepository = entryRepository;
    }

    @Override
    public Queue queue() {
        return Queue.LEDGER;
    }

    @Override
    public Class<LedgerJobPayload> payloadType() {
        return LedgerJobPayload.class;
    }

    @Override
    public void handle(LedgerJobPayload payload) {
        payload.validate();

        if (entryRepository.findByTaskId(payload.taskId()).isPresent()) {
            log.debug("Task {} already on the ledger, skipping", payload.taskId());
            return;
        }

        if (!ledgerClient.isEnabled()) {
            log.debug("Ledger disabled, completion of task {} not recorded", payload.taskId());
            return;
        }

        Optional<String> txHash = ledgerClient.recordCompletion(payload.taskId());
        if (txHash.isEmpty()) {
            throw new LedgerWriteFailedException("Ledger did not confirm completion of task " + payload.taskId());
        }

        if (!entryRepository.insert(payload.tenantId(), payload.taskId(), txHash.get(), LedgerEntry.TASK_COMPLETED)) {
            log.info("Ledger entry for task {} was stored concurrently, keeping the existing one", payload.taskId());
        }
    }
}
