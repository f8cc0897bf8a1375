package workforce.backend.service;

import workforce.backend.ledger.LedgerClient;
import workforce.backend.model.LedgerEntry;
import workforce.backend.repository.LedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the completion ledger plus startup registration.
 */
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    public static final int MAX_ENTRIES_LIMIT = 500;

    private final LedgerClient ledgerClient;
    private final LedgerEntryRepository entryRepository;

    public LedgerService(LedgerClient ledgerClient, LedgerEntryRepository entryRepository) {
        this.ledgerClient = ledgerClient;
        this.entryRepository = entryRepository;
    }

    public List<LedgerEntry> entries(String tenantId, int limit) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return entryRepository.findByTenant(tenantId, Math.min(limit, MAX_ENTRIES_LIMIT));
    }

    public LedgerStatus status() {
        int localEntries = entryRepository.countAll();
        if (!ledgerClient.isEnabled()) {
            return new LedgerStatus(false, null, false, null, localEntries);
        }

        String signer = ledgerClient.signerAddress().orElse(null);
        boolean registered = signer != null && ledgerClient.isRegistered(signer);
        return new LedgerStatus(true, signer, registered, ledgerClient.totalLogged().orElse(null), localEntries);
    }

    /**
     * Register the signing wallet on the contract if the ledger is enabled
     * and the wallet is not registered yet. Failures are logged, startup continues.
     */
    public void registerOnStartup() {
        if (!ledgerClient.isEnabled()) {
            return;
        }
        Optional<String> signer = ledgerClient.signerAddress();
        if (signer.isPresent() && ledgerClient.isRegistered(signer.get())) {
            log.info("Ledger signer {} already registered", signer.get());
            return;
        }
        ledgerClient.registerTenant()
                .ifPresent(tx -> log.info("Ledger registration confirmed in tx {}", tx));
    }
}
