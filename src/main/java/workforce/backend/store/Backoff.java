package workforce.backend.store;

import java.time.Duration;

/**
 * Exponential retry delay: base * 2^(attempts - 1), capped.
 * With a 5s base: 5s, 10s, 20s, ...
 */
public record Backoff(Duration base, Duration cap) {

    public Backoff {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("base must be non-negative");
        }
        if (cap == null || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("cap must be >= base");
        }
    }

    /**
     * Delay before the next attempt after {@code attempts} attempts have been made.
     */
    public Duration delay(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        // 2^30 * any sane base already exceeds the cap
        if (exponent >= 30) {
            return cap;
        }
        // Compare before shifting, a shifted large base wraps around
        if (base.toMillis() > cap.toMillis() >> exponent) {
            return cap;
        }
        return Duration.ofMillis(base.toMillis() << exponent);
    }
}
