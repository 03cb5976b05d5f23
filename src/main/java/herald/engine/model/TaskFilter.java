package herald.engine.model;

import java.time.Instant;

/**
 * Criteria for listing tasks. Every field is optional; {@code null} means "any".
 * The time range applies to {@code scheduledAt} and is half-open: {@code [from, to)}.
 */
public record TaskFilter(String userId, String platform, TaskStatus status, Instant from, Instant to) {

    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null, null);
    }

    public TaskFilter withUser(String userId) {
        return new TaskFilter(userId, platform, status, from, to);
    }

    public TaskFilter withPlatform(String platform) {
        return new TaskFilter(userId, platform, status, from, to);
    }

    public TaskFilter withStatus(TaskStatus status) {
        return new TaskFilter(userId, platform, status, from, to);
    }

    public TaskFilter between(Instant from, Instant to) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("time range start must be before its end");
        }
        return new TaskFilter(userId, platform, status, from, to);
    }
}
