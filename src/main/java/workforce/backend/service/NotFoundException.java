package workforce.backend.service;

/**
 * Requested entity does not exist for the calling tenant. Mapped to HTTP 404.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
