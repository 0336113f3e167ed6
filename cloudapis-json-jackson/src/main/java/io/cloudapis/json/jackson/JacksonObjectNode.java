package io.cloudapis.json.jackson;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cloudapis.json.spi.ArrayNode;

/**
 * Payload tree backed by a Jackson {@link ObjectNode}, which keeps members in insertion order.
 */
final class JacksonObjectNode extends JacksonJsonNode implements io.cloudapis.json.spi.ObjectNode {

    JacksonObjectNode(ObjectNode object) {
        super(object);
    }

    private ObjectNode object() {
        return (ObjectNode) node;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode put(String fieldName, String value) {
        object().put(fieldName, value);
        return this;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode put(String fieldName, int value) {
        object().put(fieldName, value);
        return this;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode put(String fieldName, long value) {
        object().put(fieldName, value);
        return this;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode put(String fieldName, boolean value) {
        object().put(fieldName, value);
        return this;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode putObject(String fieldName) {
        return new JacksonObjectNode(object().putObject(fieldName));
    }

    @Override
    public ArrayNode putArray(String fieldName) {
        return new JacksonArrayNode(object().putArray(fieldName));
    }
}
