package herald.engine.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal outcome of one dispatch, written to the task record by
 * {@code markTerminal}.
 */
public record DispatchOutcome(TaskStatus status, Map<String, Object> result) {

    public DispatchOutcome {
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(result, "result is required");
        if (status != TaskStatus.SUCCEEDED && status != TaskStatus.FAILED) {
            throw new IllegalArgumentException("dispatch outcome must be SUCCEEDED or FAILED, got " + status);
        }
    }

    public static DispatchOutcome succeeded(Map<String, Object> response) {
        return new DispatchOutcome(TaskStatus.SUCCEEDED, response != null ? response : Map.of());
    }

    public static DispatchOutcome failed(String error) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("error", error != null ? error : "unknown error");
        return new DispatchOutcome(TaskStatus.FAILED, result);
    }

    public boolean isSuccess() {
        return status == TaskStatus.SUCCEEDED;
    }
}
