package herald.engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * Input of {@code TaskService.createTask}. Fields are validated by the service,
 * so the record itself accepts nulls.
 */
public record CreateTaskCommand(
        String userId,
        PlatformRef platform,
        Map<String, Object> payload,
        Map<String, Object> credentials,
        Instant scheduledAt) {
}
