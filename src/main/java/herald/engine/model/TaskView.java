package herald.engine.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only projection of a {@link ScheduledTask} handed to the API layer.
 * Structured fields are already decoded by the store's read path.
 */
public record TaskView(
        String id,
        String userId,
        String platform,
        String accountId,
        Map<String, Object> payload,
        Map<String, Object> credentials,
        Instant scheduledAt,
        TaskStatus status,
        Map<String, Object> result,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt) {

    public static TaskView of(ScheduledTask task) {
        return new TaskView(
                task.id(),
                task.userId(),
                task.platform().name(),
                task.platform().accountId(),
                task.payload(),
                task.credentials(),
                task.scheduledAt(),
                task.status(),
                task.result(),
                task.createdAt(),
                task.updatedAt(),
                task.startedAt(),
                task.finishedAt());
    }
}
