package villagecompute.curator.exceptions;

/**
 * Exception thrown when input fails validation (unparseable schedule, missing job fields, unknown plugin name, bad feed
 * configuration).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
