package herald.engine.dispatch;

import herald.engine.model.PlatformRef;
import herald.engine.model.ScheduledTask;

import java.util.Map;

/**
 * What a publisher receives: the decoded payload and credentials of one task.
 */
public record PublishRequest(
        String taskId,
        PlatformRef platform,
        Map<String, Object> payload,
        Map<String, Object> credentials) {

    public static PublishRequest from(ScheduledTask task) {
        return new PublishRequest(task.id(), task.platform(), task.payload(), task.credentials());
    }
}
