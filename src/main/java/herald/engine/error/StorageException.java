package herald.engine.error;

/**
 * The durable store is unavailable or rejected a statement.
 * Core operations fail closed; the poll loop logs and retries next cycle.
 */
public class StorageException extends HeraldException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
