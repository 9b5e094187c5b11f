package io.cronbot.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Payload handed to a capability when its job fires. The payload is a JSON tree tagged with the
 * schema version its producer wrote, so handlers can reject or migrate shapes they do not expect.
 * A JSON array payload is a positional argument list.
 */
public record JobParameters(int schemaVersion, JsonNode payload) {
    public static final int CURRENT_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public JobParameters {
        if (schemaVersion <= 0) {
            throw new IllegalArgumentException("schemaVersion must be > 0");
        }
        payload = payload == null ? NullNode.getInstance() : payload;
    }

    public static JobParameters empty() {
        return new JobParameters(CURRENT_VERSION, NullNode.getInstance());
    }

    public static JobParameters of(Object value) {
        return of(CURRENT_VERSION, value);
    }

    public static JobParameters of(int schemaVersion, Object value) {
        return new JobParameters(schemaVersion, MAPPER.valueToTree(value));
    }

    public static JobParameters positional(Object... arguments) {
        ArrayNode array = MAPPER.createArrayNode();
        for (Object argument : arguments) {
            array.add(MAPPER.valueToTree(argument));
        }
        return new JobParameters(CURRENT_VERSION, array);
    }

    public static JobParameters fromJson(int schemaVersion, String json) {
        if (json == null || json.isBlank()) {
            return new JobParameters(schemaVersion, NullNode.getInstance());
        }
        try {
            return new JobParameters(schemaVersion, MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored parameters are not valid JSON", e);
        }
    }

    public boolean isEmpty() {
        return payload.isNull() || payload.isMissingNode();
    }

    public boolean isPositional() {
        return payload.isArray();
    }

    /**
     * Binds the whole payload to {@code type}.
     */
    public <T> T as(Class<T> type) {
        Objects.requireNonNull(type, "type must not be null");
        try {
            return MAPPER.treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                "Parameters (schema v" + schemaVersion + ") do not match " + type.getSimpleName() + ": " + e.getOriginalMessage(),
                e
            );
        }
    }

    /**
     * Positional view: array elements for a list payload, the payload itself for a structured one,
     * and nothing for an empty payload.
     */
    public List<JsonNode> arguments() {
        if (isEmpty()) {
            return List.of();
        }
        if (!isPositional()) {
            return List.of(payload);
        }
        List<JsonNode> arguments = new ArrayList<>();
        payload.elements().forEachRemaining(arguments::add);
        return List.copyOf(arguments);
    }

    public <T> T argument(int index, Class<T> type) {
        List<JsonNode> arguments = arguments();
        if (index < 0 || index >= arguments.size()) {
            throw new IllegalArgumentException("No positional argument at index " + index + " (have " + arguments.size() + ")");
        }
        try {
            return MAPPER.treeToValue(arguments.get(index), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Argument " + index + " does not match " + type.getSimpleName(), e);
        }
    }

    public String toJson() {
        if (isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize parameters", e);
        }
    }
}
