package villagecompute.curator.exceptions;

/**
 * Exception thrown when creating a job whose id is already taken. Typically mapped to HTTP 409 Conflict in REST
 * resources.
 */
public class DuplicateResourceException extends RuntimeException {

    public DuplicateResourceException(String message) {
        super(message);
    }

    public DuplicateResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
