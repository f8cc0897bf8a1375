package workforce.backend.model;

/**
 * Outcome of a lifecycle transition.
 *
 * @param task             the task as persisted after the transition
 * @param dispatchEligible true only when the transition entered COMPLETED
 */
public record TransitionResult(Task task, boolean dispatchEligible) {
}
