package villagecompute.campus.exceptions;

/**
 * Exception thrown when an operation conflicts with the current state of a resource (e.g., deleting a scheduled job
 * that still has run history).
 *
 * <p>
 * Mapped to HTTP 409 Conflict in REST resources.
 */
public class ResourceConflictException extends RuntimeException {

    public ResourceConflictException(String message) {
        super(message);
    }
}
