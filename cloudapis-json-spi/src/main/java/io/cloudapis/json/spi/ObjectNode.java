package io.cloudapis.json.spi;

/**
 * Request payload under construction. Members are written in the order they are put.
 *
 * <p>There is no way to put a {@code null}: optional members are skipped by the caller instead.
 */
public interface ObjectNode extends JsonNode {

    ObjectNode put(String fieldName, String value);

    ObjectNode put(String fieldName, int value);

    ObjectNode put(String fieldName, long value);

    ObjectNode put(String fieldName, boolean value);

    /**
     * Adds a nested structure or map member; it is written as {@code {}} if nothing is put into it.
     */
    ObjectNode putObject(String fieldName);

    /**
     * Adds a list member; it is written as {@code []} if nothing is added to it.
     */
    ArrayNode putArray(String fieldName);
}
