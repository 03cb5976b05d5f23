package herald.engine.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes by POSTing the task to a platform back-end over HTTP.
 *
 * The configured URL is a base. A payload that names a route
 * ({@code mcp_target_endpoint}, e.g. {@code /linkedin/publish}) is POSTed to
 * that path under the base, with its {@code mcp_request_body} object as the
 * request body. Any other payload is POSTed to the base URL inside the
 * envelope {@code {"taskId", "accountId", "payload", "credentials"}}.
 *
 * A 2xx answer is a success whose JSON object body becomes the task result;
 * any other status is a failure.
 */
public class HttpPlatformPublisher implements PlatformPublisher {

    private static final Logger log = LoggerFactory.getLogger(HttpPlatformPublisher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final int MAX_ERROR_BODY = 512;

    static final String TARGET_ENDPOINT_KEY = "mcp_target_endpoint";
    static final String REQUEST_BODY_KEY = "mcp_request_body";

    private final String platform;
    private final URI endpoint;
    private final String serviceToken;
    private final Duration requestTimeout;
    private final HttpClient client;

    public HttpPlatformPublisher(String platform, URI endpoint, String serviceToken, Duration requestTimeout) {
        this(platform, endpoint, serviceToken, requestTimeout, HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build());
    }

    public HttpPlatformPublisher(String platform, URI endpoint, String serviceToken, Duration requestTimeout,
            HttpClient client) {
        this.platform = platform;
        this.endpoint = endpoint;
        this.serviceToken = serviceToken;
        this.requestTimeout = requestTimeout;
        this.client = client;
    }

    @Override
    public PublishResult publish(PublishRequest request) throws InterruptedException {
        Object route = request.payload().get(TARGET_ENDPOINT_KEY);
        URI target;
        Object content;
        if (route == null) {
            target = endpoint;
            content = envelope(request);
        } else {
            if (!(route instanceof String path) || path.isBlank()) {
                return PublishResult.failure(TARGET_ENDPOINT_KEY + " must be a non-empty string");
            }
            Object routedBody = request.payload().get(REQUEST_BODY_KEY);
            if (!(routedBody instanceof Map)) {
                return PublishResult.failure(REQUEST_BODY_KEY + " must be a JSON object when "
                        + TARGET_ENDPOINT_KEY + " is set");
            }
            try {
                target = resolve(endpoint, path);
            } catch (IllegalArgumentException e) {
                return PublishResult.failure("invalid " + TARGET_ENDPOINT_KEY + ": " + path);
            }
            content = routedBody;
        }

        String body;
        try {
            body = MAPPER.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            return PublishResult.failure("could not encode publish request: " + e.getOriginalMessage());
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(target)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (serviceToken != null && !serviceToken.isBlank()) {
            builder.header("Authorization", "Bearer " + serviceToken);
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("POST {} for task {} failed: {}", target, request.taskId(), e.toString());
            return PublishResult.failure("request to " + platform + " failed: " + e.getClass().getSimpleName()
                    + (e.getMessage() != null ? ": " + e.getMessage() : ""));
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            return PublishResult.failure("HTTP " + status + ": " + truncate(response.body()));
        }
        return PublishResult.success(parseBody(response.body()));
    }

    private static Map<String, Object> envelope(PublishRequest request) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("taskId", request.taskId());
        envelope.put("accountId", request.platform().accountId());
        envelope.put("payload", request.payload());
        envelope.put("credentials", request.credentials());
        return envelope;
    }

    /**
     * Join a route to the base URL with exactly one slash between them.
     */
    static URI resolve(URI base, String path) {
        String prefix = base.toString();
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String suffix = path.trim();
        while (suffix.startsWith("/")) {
            suffix = suffix.substring(1);
        }
        return URI.create(prefix + "/" + suffix);
    }

    private static Map<String, Object> parseBody(String text) {
        if (text == null || text.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node != null && node.isObject()) {
                return MAPPER.convertValue(node, MAP_TYPE);
            }
        } catch (JsonProcessingException e) {
            // not JSON: keep the raw text below
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("body", text);
        return wrapped;
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_BODY ? text : text.substring(0, MAX_ERROR_BODY) + "...";
    }

    public String platform() {
        return platform;
    }

    public URI endpoint() {
        return endpoint;
    }
}
