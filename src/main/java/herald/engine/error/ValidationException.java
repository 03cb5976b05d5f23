package herald.engine.error;

/**
 * Malformed or past-dated creation request. Raised before any storage write.
 */
public class ValidationException extends HeraldException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
