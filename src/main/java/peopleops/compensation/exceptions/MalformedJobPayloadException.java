package peopleops.compensation.exceptions;

/**
 * Exception thrown when a job's stored payload does not match the shape its queue name requires.
 *
 * <p>
 * Extends RuntimeException per project standards. Counted as an ordinary job failure, so a permanently broken payload
 * reaches the dead-letter queue after the failure threshold.
 */
public class MalformedJobPayloadException extends RuntimeException {

    public MalformedJobPayloadException(String message) {
        super(message);
    }

    public MalformedJobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
