package taskclock.model;

/**
 * Raised when a task definition or timetable document is malformed.
 * Surfaced to the caller of the loader or decoder, never defaulted.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
