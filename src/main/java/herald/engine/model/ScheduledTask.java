package herald.engine.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of a publication scheduled for one-shot execution.
 * Payload, credentials and result are held decoded; the store serializes them.
 */
public final class ScheduledTask {
    private final String id;
    private final String userId;
    private final PlatformRef platform;
    private final Map<String, Object> payload;
    private final Map<String, Object> credentials;
    private final Instant scheduledAt;
    private final TaskStatus status;
    private final Map<String, Object> result; // null until the task leaves RUNNING
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private ScheduledTask(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.platform = Objects.requireNonNull(builder.platform, "platform is required");
        this.payload = freeze(Objects.requireNonNull(builder.payload, "payload is required"));
        this.credentials = freeze(builder.credentials != null ? builder.credentials : Map.of());
        this.scheduledAt = Objects.requireNonNull(builder.scheduledAt, "scheduledAt is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.result = builder.result != null ? freeze(builder.result) : null;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        // LinkedHashMap keeps insertion order and tolerates null JSON values
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    // Getters
    public String id() {
        return id;
    }

    /** Owner of the task, as identified by the calling application */
    public String userId() {
        return userId;
    }

    public PlatformRef platform() {
        return platform;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public Map<String, Object> credentials() {
        return credentials;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public TaskStatus status() {
        return status;
    }

    public Map<String, Object> result() {
        return result;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for tests and projections) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .userId(userId)
                .platform(platform)
                .payload(payload)
                .credentials(credentials)
                .scheduledAt(scheduledAt)
                .status(status)
                .result(result)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String userId;
        private PlatformRef platform;
        private Map<String, Object> payload;
        private Map<String, Object> credentials;
        private Instant scheduledAt;
        private TaskStatus status = TaskStatus.SCHEDULED;
        private Map<String, Object> result;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder platform(PlatformRef platform) {
            this.platform = platform;
            return this;
        }

        public Builder payload(Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder credentials(Map<String, Object> credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public ScheduledTask build() {
            return new ScheduledTask(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ScheduledTask task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ScheduledTask{id='" + id + "', platform=" + platform.name()
                + ", status=" + status + ", scheduledAt=" + scheduledAt + "}";
    }
}
