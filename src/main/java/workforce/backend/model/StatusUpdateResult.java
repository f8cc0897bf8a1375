package workforce.backend.model;

/**
 * Result of a status update request.
 *
 * @param task          task after the transition
 * @param scoringQueued whether this call newly enqueued a scoring job (not whether it ran)
 */
public record StatusUpdateResult(Task task, boolean scoringQueued) {
}
