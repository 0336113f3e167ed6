package io.cloudapis.json.spi;

import java.util.Iterator;
import java.util.Map;

/**
 * Read view over one value of a parsed response document.
 *
 * <p>Hydrators walk results with {@link #get(String)}, which returns {@code null} for an absent
 * member. A member that is present with a JSON {@code null} is a node whose {@link #isNull()} is true.
 */
public interface JsonNode {

    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isBoolean() {
        return getNodeType() == JsonNodeType.BOOLEAN;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Member of an object, or {@code null} when absent or when this node is not an object.
     */
    JsonNode get(String fieldName);

    /**
     * Member count for objects, element count for arrays, 0 for scalars.
     */
    int size();

    /**
     * Scalar value as text. Numbers keep their literal form, so {@code 1700000000.25} stays exact.
     */
    String asText();

    long asLong();

    int asInt();

    boolean asBoolean();

    Iterator<Map.Entry<String, JsonNode>> fields();

    Iterator<JsonNode> elements();
}
