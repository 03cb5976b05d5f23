package herald.engine.support;

import herald.engine.model.PlatformRef;
import herald.engine.model.ScheduledTask;
import herald.engine.model.TaskStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Test fixtures for scheduled tasks.
 */
public final class Tasks {

    private Tasks() {
    }

    public static ScheduledTask scheduled(String platform, Instant scheduledAt) {
        return scheduled(UUID.randomUUID().toString(), platform, scheduledAt);
    }

    public static ScheduledTask scheduled(String id, String platform, Instant scheduledAt) {
        return owned(id, "user-1", platform, scheduledAt);
    }

    public static ScheduledTask owned(String id, String userId, String platform, Instant scheduledAt) {
        return ScheduledTask.builder()
                .id(id)
                .userId(userId)
                .platform(PlatformRef.of(platform, "acct-1"))
                .payload(Map.of("text", "hello from " + id))
                .credentials(Map.of("token", "secret"))
                .scheduledAt(scheduledAt)
                .status(TaskStatus.SCHEDULED)
                .build();
    }

    public static String h2Url(String name) {
        return "jdbc:h2:mem:" + name + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }
}
