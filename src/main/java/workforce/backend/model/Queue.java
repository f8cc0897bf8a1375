package workforce.backend.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Known queues, each bound to its payload type and dedup key prefix.
 */
public enum Queue {
    SCORING("scoring", "score:task:", ScoreJobPayload.class),
    LEDGER("ledger", "ledger:task:", LedgerJobPayload.class);

    private final String queueName;
    private final String keyPrefix;
    private final Class<? extends JobPayload> payloadType;

    Queue(String queueName, String keyPrefix, Class<? extends JobPayload> payloadType) {
        this.queueName = queueName;
        this.keyPrefix = keyPrefix;
        this.payloadType = payloadType;
    }

    /** Name stored in the queue column */
    public String queueName() {
        return queueName;
    }

    public Class<? extends JobPayload> payloadType() {
        return payloadType;
    }

    /** Dedup key for work triggered by one task, e.g. {@code score:task:<taskId>} */
    public String dedupKey(String taskId) {
        return keyPrefix + taskId;
    }

    public static Optional<Queue> byName(String name) {
        return Arrays.stream(values())
                .filter(q -> q.queueName.equals(name))
                .findFirst();
    }
}
