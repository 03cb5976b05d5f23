package herald.engine.error;

/**
 * A stored record could not be decoded (corrupt JSON column, unknown status).
 * Surfaced to the caller instead of substituting empty values.
 */
public class DataIntegrityException extends StorageException {
    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
