package workforce.backend.ledger;

import java.math.BigInteger;

/**
 * Maps off-chain task ids to the uint256 ids the logger contract stores.
 */
public final class LedgerIds {

    private LedgerIds() {
    }

    /**
     * Strip the hyphens of a UUID and read the remaining 32 hex digits as an
     * unsigned integer, e.g. {@code 550e8400-e29b-41d4-a716-446655440000}
     * becomes {@code 113059749145936325402354257176981405696}.
     *
     * @throws IllegalArgumentException if the id is not hexadecimal
     */
    public static BigInteger toUint256(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        String hex = taskId.replace("-", "");
        if (hex.isEmpty() || hex.length() > 64) {
            throw new IllegalArgumentException("taskId does not fit in uint256: " + taskId);
        }
        try {
            return new BigInteger(hex, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("taskId is not hexadecimal: " + taskId, e);
        }
    }
}
