package herald.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import herald.engine.api.v1.dto.ApiResponse;
import herald.engine.server.RouterHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 *
 * Domain exceptions thrown from {@link #handle} are mapped to status codes by
 * the router.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(String body) {
            return new ControllerResponse(HttpResponseStatus.OK, "application/json", body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** Any value serialized as-is. */
        public static ControllerResponse json(HttpResponseStatus status, Object value) {
            try {
                return json(status, RouterHandler.mapper().writeValueAsString(value));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("could not serialize response", e);
            }
        }

        /** Success envelope around {@code data}. */
        public static ControllerResponse ok(HttpResponseStatus status, String message, Object data) {
            return json(status, ApiResponse.ok(message, data));
        }

        /** Failure envelope. */
        public static ControllerResponse failure(HttpResponseStatus status, String message) {
            return json(status, ApiResponse.failure(message));
        }

        public static ControllerResponse notFound(String message) {
            return failure(HttpResponseStatus.NOT_FOUND, message);
        }

        public static ControllerResponse badRequest(String message) {
            return failure(HttpResponseStatus.BAD_REQUEST, message);
        }

        public static ControllerResponse conflict(String message) {
            return failure(HttpResponseStatus.CONFLICT, message);
        }

        public static ControllerResponse forbidden(String message) {
            return failure(HttpResponseStatus.FORBIDDEN, message);
        }

        public static ControllerResponse unavailable(String message) {
            return failure(HttpResponseStatus.SERVICE_UNAVAILABLE, message);
        }

        public static ControllerResponse error(String message) {
            return failure(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
        }
    }
}
