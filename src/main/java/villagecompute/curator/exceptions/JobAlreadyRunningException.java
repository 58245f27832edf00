package villagecompute.curator.exceptions;

/**
 * Thrown when a manual run is requested for a job that is still executing in this process. Mapped to HTTP 409
 * Conflict.
 */
public class JobAlreadyRunningException extends RuntimeException {

    public JobAlreadyRunningException(String message) {
        super(message);
    }
}
