package workforce.backend.model;

/**
 * Typed payload of a queued job. Each queue carries exactly one payload type,
 * see {@link Queue}.
 */
public interface JobPayload {

    /** Tenant the work belongs to */
    String tenantId();

    /** Task whose completion produced the job */
    String taskId();
}
