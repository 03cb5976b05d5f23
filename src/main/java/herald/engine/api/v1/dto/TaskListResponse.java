package herald.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * GET /api/v1/tasks
 */
public record TaskListResponse(
        @JsonProperty("tasks") List<TaskResponse> tasks,
        @JsonProperty("total") int total) {

    public static TaskListResponse of(List<TaskResponse> tasks) {
        return new TaskListResponse(tasks, tasks.size());
    }
}
