package villagecompute.campus.exceptions;

/**
 * Exception thrown when input validation fails (e.g., malformed schedule config, unknown schedule type).
 *
 * <p>
 * Extends RuntimeException per project standards. Mapped to HTTP 400 Bad Request in REST resources. During dispatch
 * the scheduler catches it and falls back to a one-day reschedule.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
