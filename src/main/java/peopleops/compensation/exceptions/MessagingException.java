package peopleops.compensation.exceptions;

/**
 * Exception thrown when the messaging platform rejects a call or cannot be reached.
 *
 * <p>
 * Extends RuntimeException per project standards. Inside a job handler it counts as one job failure.
 */
public class MessagingException extends RuntimeException {

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }
}
