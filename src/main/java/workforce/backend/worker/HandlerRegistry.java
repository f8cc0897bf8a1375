package workforce.backend.worker;

import workforce.backend.model.Queue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Queue to handler mapping. One handler per queue.
 */
public final class HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<Queue, JobHandler<?>> handlers = new EnumMap<>(Queue.class);

    public HandlerRegistry register(JobHandler<?> handler) {
        Queue queue = handler.queue();
        if (handler.payloadType() != queue.payloadType()) {
            throw new IllegalArgumentException("Handler payload " + handler.payloadType().getSimpleName()
                    + " does not match queue " + queue.queueName());
        }
        if (handlers.putIfAbsent(queue, handler) != null) {
            throw new IllegalStateException("Handler already registered for queue " + queue.queueName());
        }
        log.info("Registered handler {} for queue {}", handler.getClass().getSimpleName(), queue.queueName());
        return this;
    }

    public Optional<JobHandler<?>> find(String queueName) {
        return Queue.byName(queueName).map(handlers::get);
    }

    public Set<Queue> queues() {
        return Collections.unmodifiableSet(handlers.keySet());
    }
}
