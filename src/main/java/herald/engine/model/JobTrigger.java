package herald.engine.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Pending alarm: fire task {@code taskId} at {@code fireAt}.
 * Exists only while the owning task is SCHEDULED.
 */
public record JobTrigger(String taskId, Instant fireAt) {

    /** Firing order within one poll batch: fire time, then task id. */
    public static final Comparator<JobTrigger> FIRING_ORDER = Comparator
            .comparing(JobTrigger::fireAt)
            .thenComparing(JobTrigger::taskId);

    public JobTrigger {
        Objects.requireNonNull(taskId, "taskId is required");
        Objects.requireNonNull(fireAt, "fireAt is required");
    }
}
