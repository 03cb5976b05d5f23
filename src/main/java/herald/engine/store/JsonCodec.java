package herald.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import herald.engine.error.DataIntegrityException;
import herald.engine.error.ValidationException;

import java.util.Map;

/**
 * Serializes the structured task columns (payload, credentials, result) to
 * JSON text and back. Decoding happens once, on the store's read path.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonCodec() {
    }

    /**
     * @throws ValidationException if the value cannot be represented as JSON
     */
    public static String encode(Map<String, Object> value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ValidationException("value is not serializable as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode a stored JSON object.
     *
     * @param json   stored text, may be null for optional columns
     * @param column column name, for the error message
     * @param taskId owning task, for the error message
     * @return the decoded map, or null if {@code json} is null
     * @throws DataIntegrityException if the text is not a JSON object
     */
    public static Map<String, Object> decode(String json, String column, String taskId) {
        if (json == null) {
            return null;
        }
        try {
            Map<String, Object> value = MAPPER.readValue(json, MAP_TYPE);
            if (value == null) {
                throw new DataIntegrityException(
                        "Stored " + column + " of task " + taskId + " is JSON null, expected an object", null);
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException(
                    "Stored " + column + " of task " + taskId + " is not a valid JSON object: "
                            + e.getOriginalMessage(),
                    e);
        }
    }
}
