package io.cloudapis.json.jackson;

import com.fasterxml.jackson.databind.node.ArrayNode;

final class JacksonArrayNode extends JacksonJsonNode implements io.cloudapis.json.spi.ArrayNode {

    JacksonArrayNode(ArrayNode array) {
        super(array);
    }

    @Override
    public io.cloudapis.json.spi.ArrayNode add(String value) {
        ((ArrayNode) node).add(value);
        return this;
    }

    @Override
    public io.cloudapis.json.spi.ObjectNode addObject() {
        return new JacksonObjectNode(((ArrayNode) node).addObject());
    }
}
