package herald.engine.dispatch;

import java.util.Map;
import java.util.Objects;

/**
 * Collaborator's answer to a publish call: either a success carrying the
 * response, or a failure carrying an error description.
 */
public final class PublishResult {

    private final boolean success;
    private final Map<String, Object> response;
    private final String error;

    private PublishResult(boolean success, Map<String, Object> response, String error) {
        this.success = success;
        this.response = response;
        this.error = error;
    }

    public static PublishResult success(Map<String, Object> response) {
        return new PublishResult(true, response != null ? response : Map.of(), null);
    }

    public static PublishResult failure(String error) {
        return new PublishResult(false, null, Objects.requireNonNull(error, "error is required"));
    }

    public boolean isSuccess() {
        return success;
    }

    /** Response body; null for failures */
    public Map<String, Object> response() {
        return response;
    }

    /** Error description; null for successes */
    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return success ? "PublishResult{success, response=" + response + "}"
                : "PublishResult{failure, error='" + error + "'}";
    }
}
