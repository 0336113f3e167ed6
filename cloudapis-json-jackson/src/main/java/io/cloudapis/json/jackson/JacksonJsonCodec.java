package io.cloudapis.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.JsonException;
import io.cloudapis.json.spi.JsonNode;
import io.cloudapis.json.spi.ObjectNode;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by Jackson databind.
 *
 * <p>Floating point numbers are read as {@code BigDecimal} so epoch timestamps with a fraction keep
 * every digit when hydrated.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    /**
     * Uses a caller-configured mapper, e.g. one shared with the application.
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] writeBytes(JsonNode tree) throws JsonException {
        try {
            return mapper.writeValueAsBytes(jackson(tree));
        } catch (JsonProcessingException e) {
            throw new JsonException("Could not write request payload", e);
        }
    }

    @Override
    public String writeString(JsonNode tree) throws JsonException {
        try {
            return mapper.writeValueAsString(jackson(tree));
        } catch (JsonProcessingException e) {
            throw new JsonException("Could not write request payload", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] data) throws JsonException {
        if (data == null || data.length == 0) {
            throw new JsonException("Response body is empty");
        }
        try {
            return root(mapper.readTree(data));
        } catch (IOException e) {
            throw new JsonException("Response body is not valid JSON", e);
        }
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        if (json == null || json.isEmpty()) {
            throw new JsonException("Response body is empty");
        }
        try {
            return root(mapper.readTree(json));
        } catch (IOException e) {
            throw new JsonException("Response body is not valid JSON", e);
        }
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode());
    }

    private static JsonNode root(com.fasterxml.jackson.databind.JsonNode parsed) throws JsonException {
        JsonNode root = JacksonJsonNode.wrap(parsed);
        if (root == null) {
            throw new JsonException("Response body holds no JSON value");
        }
        return root;
    }

    private static com.fasterxml.jackson.databind.JsonNode jackson(JsonNode tree) {
        if (tree instanceof JacksonJsonNode) {
            return ((JacksonJsonNode) tree).node;
        }
        throw new IllegalArgumentException("Tree was not created by a Jackson codec: " + tree);
    }
}
