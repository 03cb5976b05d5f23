package herald.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("pendingTriggers") Integer pendingTriggers,
        @JsonProperty("scheduledTasks") Integer scheduledTasks,
        @JsonProperty("runningTasks") Integer runningTasks) {

    public static HealthResponse healthy(String uptime, String version, boolean schedulerRunning,
            int pendingTriggers, int scheduledTasks, int runningTasks) {
        return new HealthResponse("healthy", "ok", uptime, version, schedulerRunning ? "running" : "stopped",
                pendingTriggers, scheduledTasks, runningTasks);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
