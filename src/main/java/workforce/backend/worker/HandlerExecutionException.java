package workforce.backend.worker;

/**
 * A job attempt failed: handler exception, timeout, undecodable payload or missing handler.
 * Its message becomes the job's error message.
 */
public class HandlerExecutionException extends Exception {

    public HandlerExecutionException(String message) {
        super(message);
    }

    public HandlerExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
