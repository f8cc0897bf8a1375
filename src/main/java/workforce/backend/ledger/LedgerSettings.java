package workforce.backend.ledger;

import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings of the completion ledger. The ledger is enabled only
 * when RPC endpoint, signing key and contract address are all present.
 *
 * @param rpcUrl          JSON-RPC endpoint
 * @param privateKey      hex key of the signing wallet
 * @param contractAddress deployed logger contract
 * @param chainId         optional chain id for EIP-155 signing, null for legacy signing
 */
public record LedgerSettings(String rpcUrl, String privateKey, String contractAddress, Long chainId) {

    public static LedgerSettings none() {
        return new LedgerSettings(null, null, null, null);
    }

    public boolean isComplete() {
        return missing().isEmpty();
    }

    /**
     * Environment variable names of the settings that are absent.
     */
    public List<String> missing() {
        List<String> missing = new ArrayList<>();
        if (isBlank(rpcUrl)) {
            missing.add("WEB3_RPC_URL");
        }
        if (isBlank(privateKey)) {
            missing.add("DEPLOYER_PRIVATE_KEY");
        }
        if (isBlank(contractAddress)) {
            missing.add("WORKFORCE_LOGGER_ADDRESS");
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        return "LedgerSettings{rpcUrl='" + rpcUrl + "', contractAddress='" + contractAddress
                + "', chainId=" + chainId + ", privateKeySet=" + !isBlank(privateKey) + "}";
    }
}
