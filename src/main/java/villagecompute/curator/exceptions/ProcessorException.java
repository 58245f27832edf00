package villagecompute.curator.exceptions;

/**
 * Raised by the content pipeline when nothing could be distributed: either no distributors are configured, or every
 * configured distributor failed. In the latter case the first failure is the cause and the remaining failures are
 * attached as suppressed exceptions.
 */
public class ProcessorException extends RuntimeException {

    public ProcessorException(String message) {
        super(message);
    }

    public ProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
