package workforce.backend.narrative;

/**
 * The narrative model could not produce an explanation: no API key, timeout,
 * HTTP error or an unparseable answer.
 */
public class NarrativeUnavailableException extends Exception {

    public NarrativeUnavailableException(String message) {
        super(message);
    }

    public NarrativeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
