package workforce.backend.service;

import java.math.BigInteger;

/**
 * Ledger connection state.
 *
 * @param totalLogged on-chain completion count, null when unknown
 * @param localEntries completion records stored locally
 */
public record LedgerStatus(
        boolean enabled,
        String signerAddress,
        boolean registered,
        BigInteger totalLogged,
        int localEntries) {
}
