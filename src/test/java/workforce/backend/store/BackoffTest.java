package workforce.backend.store;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffTest {

    private final Backoff backoff = new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(1));

    @Test
    void doublesPerAttempt() {
        assertEquals(Duration.ofSeconds(5), backoff.delay(1));
        assertEquals(Duration.ofSeconds(10), backoff.delay(2));
        assertEquals(Duration.ofSeconds(20), backoff.delay(3));
        assertEquals(Duration.ofSeconds(40), backoff.delay(4));
    }

    @Test
    void cappedAndNeverOverflows() {
        assertEquals(Duration.ofMinutes(1), backoff.delay(5));
        assertEquals(Duration.ofMinutes(1), backoff.delay(63));
        assertEquals(Duration.ofMinutes(1), backoff.delay(Integer.MAX_VALUE));
    }

    @Test
    void hugeBaseIsCappedInsteadOfWrapping() {
        // base << 3 wraps around to 8ms in long arithmetic
        Duration base = Duration.ofMillis((1L << 61) + 1);
        Backoff huge = new Backoff(base, Duration.ofMillis(Long.MAX_VALUE));

        assertEquals(base, huge.delay(1));
        assertEquals(huge.cap(), huge.delay(4));
        assertEquals(huge.cap(), huge.delay(29));
    }

    @Test
    void exactlyReachingTheCapIsAllowed() {
        Backoff exact = new Backoff(Duration.ofSeconds(5), Duration.ofSeconds(20));

        assertEquals(Duration.ofSeconds(20), exact.delay(3));
        assertEquals(Duration.ofSeconds(20), exact.delay(4));
    }

    @Test
    void zeroAttemptsUsesBase() {
        assertEquals(Duration.ofSeconds(5), backoff.delay(0));
    }

    @Test
    void rejectsCapBelowBase() {
        assertThrows(IllegalArgumentException.class,
                () -> new Backoff(Duration.ofSeconds(10), Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new Backoff(Duration.ofSeconds(-1), Duration.ofSeconds(1)));
    }
}
