package io.cloudapis.json.spi;

/**
 * List member of a payload: strings or nested structures.
 */
public interface ArrayNode extends JsonNode {

    ArrayNode add(String value);

    /**
     * Appends an empty structure and returns it for filling.
     */
    ObjectNode addObject();
}
