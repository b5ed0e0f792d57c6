package peopleops.compensation.exceptions;

/**
 * Exception thrown when a messaging platform interaction (form submission) cannot be parsed.
 *
 * <p>
 * Extends RuntimeException per project standards. The interaction endpoint answers it with HTTP 400.
 */
public class InvalidInteractionException extends RuntimeException {

    public InvalidInteractionException(String message) {
        super(message);
    }

    public InvalidInteractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
