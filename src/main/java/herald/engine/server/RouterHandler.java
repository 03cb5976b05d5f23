package herald.engine.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import herald.engine.api.Controller;
import herald.engine.api.Controller.ControllerResponse;
import herald.engine.config.HeraldConfig;
import herald.engine.error.StorageException;
import herald.engine.error.TaskConflictException;
import herald.engine.error.TaskNotFoundException;
import herald.engine.error.ValidationException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers and
 * turns domain exceptions into status codes:
 * ValidationException 400, TaskNotFoundException 404, TaskConflictException 409,
 * StorageException 503, anything else 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    static final String KEY_HEADER = "X-Herald-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final HeraldConfig config;

    public RouterHandler(HeraldConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        write(ctx, route(ctx, req, method, path));
    }

    private ControllerResponse route(ChannelHandlerContext ctx, FullHttpRequest req, HttpMethod method, String path) {
        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                return ControllerResponse.forbidden("forbidden");
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    return controller.handle(ctx, req, path);
                }
            }

            log.debug("No handler for: {} {}", method, path);
            return ControllerResponse.notFound("not found");

        } catch (ValidationException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            return ControllerResponse.badRequest(e.getMessage());
        } catch (TaskNotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (TaskConflictException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (StorageException e) {
            log.error("Storage error on {} {}", method, path, e);
            return ControllerResponse.unavailable("storage unavailable");
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * The shared key applies to /api/ only, and only when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasApiKey()) {
            return true;
        }
        if (!path.startsWith("/api/")) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        try {
            writeBody(ctx, response.status(), response.contentType(), response.body());
        } catch (RuntimeException e) {
            log.error("Failed to write response: {}", e.getMessage(), e);
            try {
                writeBody(ctx, INTERNAL_SERVER_ERROR, "application/json",
                        "{\"success\":false,\"message\":\"failed to write response\"}");
            } catch (RuntimeException e2) {
                log.error("Complete failure writing error response", e2);
                ctx.close();
            }
        }
    }

    private static void writeBody(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType,
            String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            write(ctx, ControllerResponse.error("channel error"));
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
