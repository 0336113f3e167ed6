package io.cloudapis.json.spi;

/**
 * JSON binding used by the clients.
 *
 * <p>Inputs build their payload as an {@link ObjectNode} tree so each member can be absent, empty or
 * filled. Responses are read back with {@link #readTree(byte[])} and hydrated field by field.
 * Bindings are discovered through {@link JsonCodecProvider}.
 *
 * <p>Implementations must be thread-safe.
 */
public interface JsonCodec {

    /**
     * Writes a tree created by this codec as UTF-8 bytes.
     */
    byte[] writeBytes(JsonNode tree) throws JsonException;

    String writeString(JsonNode tree) throws JsonException;

    /**
     * @return the root node, never null
     * @throws JsonException if {@code data} is empty or not JSON
     */
    JsonNode readTree(byte[] data) throws JsonException;

    JsonNode readTree(String json) throws JsonException;

    ObjectNode createObjectNode();
}
