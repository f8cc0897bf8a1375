package workforce.backend.worker;

import workforce.backend.model.JobPayload;
import workforce.backend.model.Queue;

/**
 * Executes the jobs of one queue. Delivery is at-least-once, so handlers
 * must tolerate running twice for the same payload.
 *
 * @param <P> payload type of the queue
 */
public interface JobHandler<P extends JobPayload> {

    Queue queue();

    Class<P> payloadType();

    /**
     * Run one job. Any exception marks the attempt as failed.
     */
    void handle(P payload) throws Exception;
}
