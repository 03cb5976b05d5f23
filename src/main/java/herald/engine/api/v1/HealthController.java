package herald.engine.api.v1;

import herald.engine.api.Controller;
import herald.engine.api.v1.dto.HealthResponse;
import herald.engine.model.TaskStatus;
import herald.engine.repository.TaskRepository;
import herald.engine.repository.TriggerRepository;
import herald.engine.scheduler.SchedulerEngine;
import herald.engine.store.Database;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 * GET /ping
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskRepository taskRepository;
    private final TriggerRepository triggerRepository;
    private final SchedulerEngine scheduler;

    public HealthController(Database database, TaskRepository taskRepository, TriggerRepository triggerRepository,
            SchedulerEngine scheduler) {
        this.database = database;
        this.taskRepository = taskRepository;
        this.triggerRepository = triggerRepository;
        this.scheduler = scheduler;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && ("/api/v1/health".equals(path) || "/ping".equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        if ("/ping".equals(path)) {
            return ControllerResponse.json(HttpResponseStatus.OK, Map.of("ping", "pong!"));
        }

        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        HealthResponse.unhealthy("connection failed"));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    scheduler.isRunning(),
                    triggerRepository.countPending(),
                    taskRepository.countByStatus(TaskStatus.SCHEDULED),
                    taskRepository.countByStatus(TaskStatus.RUNNING));

            return ControllerResponse.json(HttpResponseStatus.OK, response);

        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                    HealthResponse.unhealthy(e.getMessage()));
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
