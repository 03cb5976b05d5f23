package herald.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import herald.engine.model.TaskView;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for a single task. Credentials are never echoed back.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("userId") String userId,
        @JsonProperty("platform") String platform,
        @JsonProperty("accountId") String accountId,
        @JsonProperty("status") String status,
        @JsonProperty("scheduledAt") Instant scheduledAt,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static TaskResponse from(TaskView view) {
        return new TaskResponse(
                view.id(),
                view.userId(),
                view.platform(),
                view.accountId(),
                view.status().name(),
                view.scheduledAt(),
                view.payload(),
                view.result(),
                view.createdAt(),
                view.updatedAt(),
                view.startedAt(),
                view.finishedAt());
    }
}
