package herald.engine.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import herald.engine.config.Dependencies;
import herald.engine.config.HeraldConfig;
import herald.engine.dispatch.PublisherRegistry;
import herald.engine.support.RecordingPublisher;
import herald.engine.support.Tasks;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test that hits actual HTTP endpoints.
 */
class HttpEndpointIntegrationTest {

        private static final ObjectMapper MAPPER = new ObjectMapper();
        private static final int TEST_PORT = 18081;
        private static final String BASE_URL = "http://localhost:" + TEST_PORT;

        private Dependencies deps;
        private HttpClient httpClient;

        private void start(HeraldConfig config) throws Exception {
                deps = Dependencies.create(config,
                                new PublisherRegistry().register("linkedin", RecordingPublisher.succeeding()),
                                Clock.systemUTC());
                deps.httpServer().start();

                // Wait for server to be ready
                TimeUnit.MILLISECONDS.sleep(200);

                httpClient = HttpClient.newBuilder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .build();
        }

        private static HeraldConfig config() {
                return HeraldConfig.defaults()
                                .withDatabaseUrl(Tasks.h2Url("test-http-" + System.nanoTime()))
                                .withServerPort(TEST_PORT);
        }

        @AfterEach
        void tearDown() {
                if (deps != null) {
                        deps.close();
                }
        }

        @Test
        @DisplayName("Task lifecycle over HTTP: create, get, list, cancel, conflict")
        void taskLifecycle() throws Exception {
                start(config());

                String body = """
                                {
                                    "userId": "user-1",
                                    "platform": {"name": "linkedin", "accountId": "acct-1"},
                                    "payload": {"text": "Hello"},
                                    "credentials": {"accessToken": "abc"},
                                    "scheduledAt": "%s"
                                }
                                """.formatted(Instant.now().plus(Duration.ofHours(1)));

                HttpResponse<String> created = send("POST", "/api/v1/tasks", body);
                assertEquals(201, created.statusCode(), "Body: " + created.body());
                JsonNode createdJson = MAPPER.readTree(created.body());
                assertTrue(createdJson.get("success").asBoolean());
                String id = createdJson.get("data").get("id").asText();
                assertEquals("SCHEDULED", createdJson.get("data").get("status").asText());
                assertNull(createdJson.get("data").get("credentials"), "credentials must not be echoed");

                HttpResponse<String> fetched = send("GET", "/api/v1/tasks/" + id, null);
                assertEquals(200, fetched.statusCode());
                assertEquals("Hello", MAPPER.readTree(fetched.body()).get("data").get("payload").get("text").asText());

                HttpResponse<String> listed = send("GET", "/api/v1/tasks?platform=linkedin&status=scheduled", null);
                assertEquals(200, listed.statusCode());
                JsonNode listData = MAPPER.readTree(listed.body()).get("data");
                assertEquals(1, listData.get("total").asInt());
                assertEquals(id, listData.get("tasks").get(0).get("id").asText());
                assertEquals("user-1", listData.get("tasks").get(0).get("userId").asText());

                // the '+' of the offset is left unencoded and arrives as a space
                String from = Instant.now().minus(Duration.ofHours(1)).atOffset(ZoneOffset.ofHours(2)).toString();
                HttpResponse<String> mine = send("GET", "/api/v1/tasks?userId=user-1&from=" + from, null);
                assertEquals(200, mine.statusCode(), "Body: " + mine.body());
                assertEquals(1, MAPPER.readTree(mine.body()).get("data").get("total").asInt());

                HttpResponse<String> others = send("GET", "/api/v1/tasks?userId=user-2", null);
                assertEquals(0, MAPPER.readTree(others.body()).get("data").get("total").asInt());

                HttpResponse<String> cancelled = send("DELETE", "/api/v1/tasks/" + id, null);
                assertEquals(200, cancelled.statusCode());
                assertEquals("CANCELLED", MAPPER.readTree(cancelled.body()).get("data").get("status").asText());

                HttpResponse<String> again = send("DELETE", "/api/v1/tasks/" + id, null);
                assertEquals(409, again.statusCode());
                assertFalse(MAPPER.readTree(again.body()).get("success").asBoolean());
        }

        @Test
        @DisplayName("Invalid requests map to 400 and unknown ids to 404")
        void errorMapping() throws Exception {
                start(config());

                String past = """
                                {
                                    "userId": "user-1",
                                    "platform": {"name": "linkedin", "accountId": "acct-1"},
                                    "payload": {"text": "Hello"},
                                    "scheduledAt": "2020-01-01T00:00:00Z"
                                }
                                """;
                assertEquals(400, send("POST", "/api/v1/tasks", past).statusCode());

                String anonymous = """
                                {
                                    "platform": {"name": "linkedin", "accountId": "acct-1"},
                                    "payload": {"text": "Hello"},
                                    "scheduledAt": "%s"
                                }
                                """.formatted(Instant.now().plus(Duration.ofHours(1)));
                HttpResponse<String> noUser = send("POST", "/api/v1/tasks", anonymous);
                assertEquals(400, noUser.statusCode());
                assertEquals("userId is required", MAPPER.readTree(noUser.body()).get("message").asText());
                assertEquals(400, send("GET", "/api/v1/tasks?from=yesterday", null).statusCode());
                assertEquals(400, send("POST", "/api/v1/tasks", "{not json").statusCode());
                assertEquals(400, send("GET", "/api/v1/tasks?status=bogus", null).statusCode());
                assertEquals(404, send("GET", "/api/v1/tasks/does-not-exist", null).statusCode());
                assertEquals(404, send("DELETE", "/api/v1/tasks/does-not-exist", null).statusCode());
                assertEquals(404, send("GET", "/nowhere", null).statusCode());
        }

        @Test
        @DisplayName("Health and ping")
        void healthAndPing() throws Exception {
                start(config());

                HttpResponse<String> ping = send("GET", "/ping", null);
                assertEquals(200, ping.statusCode());
                assertEquals("pong!", MAPPER.readTree(ping.body()).get("ping").asText());

                HttpResponse<String> health = send("GET", "/api/v1/health", null);
                assertEquals(200, health.statusCode());
                JsonNode json = MAPPER.readTree(health.body());
                assertEquals("healthy", json.get("status").asText());
                assertEquals("stopped", json.get("scheduler").asText());
                assertEquals(0, json.get("pendingTriggers").asInt());
        }

        @Test
        @DisplayName("Configured API key guards /api/ but not /ping")
        void apiKeyIsEnforced() throws Exception {
                start(config().withApiKey("s3cret"));

                assertEquals(403, send("GET", "/api/v1/tasks", null).statusCode());
                assertEquals(200, send("GET", "/ping", null).statusCode());

                HttpResponse<String> withKey = httpClient.send(
                                HttpRequest.newBuilder()
                                                .uri(URI.create(BASE_URL + "/api/v1/tasks"))
                                                .header("X-Herald-Key", "s3cret")
                                                .GET()
                                                .build(),
                                HttpResponse.BodyHandlers.ofString());
                assertEquals(200, withKey.statusCode());
        }

        private HttpResponse<String> send(String method, String path, String body) throws Exception {
                HttpRequest.Builder builder = HttpRequest.newBuilder()
                                .uri(URI.create(BASE_URL + path))
                                .header("Content-Type", "application/json");
                HttpRequest.BodyPublisher publisher = body == null
                                ? HttpRequest.BodyPublishers.noBody()
                                : HttpRequest.BodyPublishers.ofString(body);
                return httpClient.send(builder.method(method, publisher).build(), HttpResponse.BodyHandlers.ofString());
        }
}
