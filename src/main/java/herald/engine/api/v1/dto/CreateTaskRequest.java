package herald.engine.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import herald.engine.error.ValidationException;
import herald.engine.model.CreateTaskCommand;
import herald.engine.model.PlatformRef;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Request DTO for scheduling a publication.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("userId") String userId,
        @JsonProperty("platform") PlatformBody platform,
        @JsonProperty("payload") Map<String, Object> payload,
        @JsonProperty("credentials") Map<String, Object> credentials,
        @JsonProperty("scheduledAt") String scheduledAt) {

    public record PlatformBody(
            @JsonProperty("name") String name,
            @JsonProperty("accountId") String accountId) {
    }

    /** Shape checks only; time and platform checks belong to the service. */
    public void validate() {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("userId is required");
        }
        if (platform == null) {
            throw new ValidationException("platform is required");
        }
        if (platform.name() == null || platform.name().isBlank()) {
            throw new ValidationException("platform.name is required");
        }
        if (platform.accountId() == null || platform.accountId().isBlank()) {
            throw new ValidationException("platform.accountId is required");
        }
        if (payload == null || payload.isEmpty()) {
            throw new ValidationException("payload is required");
        }
        if (scheduledAt == null || scheduledAt.isBlank()) {
            throw new ValidationException("scheduledAt is required");
        }
        parseInstant("scheduledAt", scheduledAt);
    }

    public CreateTaskCommand toCommand() {
        validate();
        return new CreateTaskCommand(
                userId.trim(),
                PlatformRef.of(platform.name().trim(), platform.accountId().trim()),
                payload,
                credentials != null ? credentials : Map.of(),
                parseInstant("scheduledAt", scheduledAt));
    }

    /**
     * ISO-8601 instant ({@code 2026-05-01T09:00:00Z}) or offset date-time
     * ({@code 2026-05-01T11:00:00+02:00}). Local times without an offset are rejected.
     *
     * @param field name reported in the error message
     * @throws ValidationException if the text is not such a timestamp
     */
    public static Instant parseInstant(String field, String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException e2) {
                throw new ValidationException(field + " must be an ISO-8601 timestamp with offset: " + text, e2);
            }
        }
    }
}
