package herald.engine.error;

/**
 * Base of the engine's error taxonomy. Unchecked: callers that can act on a
 * specific failure catch the subclass, everything else propagates.
 */
public class HeraldException extends RuntimeException {
    public HeraldException(String message) {
        super(message);
    }

    public HeraldException(String message, Throwable cause) {
        super(message, cause);
    }
}
