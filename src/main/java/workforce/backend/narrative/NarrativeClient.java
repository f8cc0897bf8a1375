package workforce.backend.narrative;

/**
 * Produces a plain-language explanation of an employee score.
 */
public interface NarrativeClient {

    /**
     * @return explanation text, never blank
     * @throws NarrativeUnavailableException when no explanation can be produced
     */
    String explain(NarrativeRequest request) throws NarrativeUnavailableException;

    boolean isEnabled();
}
