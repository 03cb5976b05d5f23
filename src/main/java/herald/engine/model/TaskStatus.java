package herald.engine.model;

import java.util.Locale;

/**
 * Lifecycle status of a scheduled task.
 *
 * <pre>
 * SCHEDULED -> RUNNING -> SUCCEEDED | FAILED
 * SCHEDULED -> CANCELLED
 * </pre>
 */
public enum TaskStatus {
    /** Waiting for its fire time; the only state with a pending trigger */
    SCHEDULED,
    /** Claimed by a poller and handed to the dispatcher */
    RUNNING,
    /** Collaborator accepted the publication */
    SUCCEEDED,
    /** Collaborator rejected, timed out, or the dispatch path faulted */
    FAILED,
    /** Cancelled by the caller before firing */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case SCHEDULED -> next == RUNNING || next == CANCELLED;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Lenient parse for query parameters ("scheduled", "SCHEDULED").
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + value);
        }
    }
}
