package herald.engine.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import herald.engine.api.Controller;
import herald.engine.api.v1.dto.CreateTaskRequest;
import herald.engine.api.v1.dto.TaskListResponse;
import herald.engine.api.v1.dto.TaskResponse;
import herald.engine.error.ValidationException;
import herald.engine.model.TaskFilter;
import herald.engine.model.TaskStatus;
import herald.engine.model.TaskView;
import herald.engine.server.RouterHandler;
import herald.engine.service.TaskService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for scheduled tasks (public API).
 *
 * POST /api/v1/tasks - Schedule a publication
 * GET /api/v1/tasks - List tasks (?userId=&platform=&status=&from=&to=)
 * GET /api/v1/tasks/{id} - Get one task
 * DELETE /api/v1/tasks/{id} - Cancel a task that has not fired
 */
public class TaskController implements Controller {

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/tasks/?$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return req.method().equals(HttpMethod.POST)
                    ? handleCreate(req)
                    : handleList(req);
        }

        Matcher byId = TASK_BY_ID_PATTERN.matcher(path);
        if (byId.matches()) {
            String taskId = byId.group(1);
            return req.method().equals(HttpMethod.DELETE)
                    ? handleCancel(taskId)
                    : handleGet(taskId);
        }

        return ControllerResponse.notFound("unknown task endpoint");
    }

    /**
     * POST /api/v1/tasks
     */
    private ControllerResponse handleCreate(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateTaskRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("malformed request body: " + e.getOriginalMessage(), e);
        }
        if (request == null) {
            throw new ValidationException("request body is required");
        }

        String taskId = taskService.createTask(request.toCommand());
        TaskView view = taskService.getTask(taskId);

        return ControllerResponse.ok(HttpResponseStatus.CREATED, "task scheduled", TaskResponse.from(view));
    }

    /**
     * GET /api/v1/tasks
     */
    private ControllerResponse handleList(FullHttpRequest req) {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();

        TaskFilter filter = TaskFilter.all();
        String userId = param(params, "userId");
        if (userId != null) {
            filter = filter.withUser(userId);
        }
        String platform = param(params, "platform");
        if (platform != null) {
            filter = filter.withPlatform(platform);
        }
        String status = param(params, "status");
        if (status != null) {
            try {
                filter = filter.withStatus(TaskStatus.parse(status));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
        }
        Instant from = instantParam(params, "from");
        Instant to = instantParam(params, "to");
        if (from != null || to != null) {
            try {
                filter = filter.between(from, to);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
        }

        List<TaskResponse> tasks = new ArrayList<>();
        for (TaskView view : taskService.listTasks(filter)) {
            tasks.add(TaskResponse.from(view));
        }

        return ControllerResponse.ok(HttpResponseStatus.OK, null, TaskListResponse.of(tasks));
    }

    /**
     * GET /api/v1/tasks/{id}
     */
    private ControllerResponse handleGet(String taskId) {
        return ControllerResponse.ok(HttpResponseStatus.OK, null, TaskResponse.from(taskService.getTask(taskId)));
    }

    /**
     * DELETE /api/v1/tasks/{id}
     */
    private ControllerResponse handleCancel(String taskId) {
        taskService.cancelTask(taskId);
        return ControllerResponse.ok(HttpResponseStatus.OK, "task cancelled",
                TaskResponse.from(taskService.getTask(taskId)));
    }

    private static String param(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    private static Instant instantParam(Map<String, List<String>> params, String name) {
        String value = param(params, name);
        if (value == null) {
            return null;
        }
        // an unencoded '+' in the offset arrives as a space after query decoding
        return CreateTaskRequest.parseInstant(name, value.replace(' ', '+'));
    }
}
