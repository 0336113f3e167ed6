package io.cloudapis.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Read view over a Jackson tree. Child nodes are wrapped lazily as hydrators reach them.
 */
class JacksonJsonNode implements io.cloudapis.json.spi.JsonNode {
    final JsonNode node;

    JacksonJsonNode(JsonNode node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    static io.cloudapis.json.spi.JsonNode wrap(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return null;
        }
        if (node instanceof ObjectNode) {
            return new JacksonObjectNode((ObjectNode) node);
        }
        if (node instanceof ArrayNode) {
            return new JacksonArrayNode((ArrayNode) node);
        }
        return new JacksonJsonNode(node);
    }

    @Override
    public io.cloudapis.json.spi.JsonNodeType getNodeType() {
        JsonNodeType type = node.getNodeType();
        switch (type) {
            case OBJECT:
            case POJO:
                return io.cloudapis.json.spi.JsonNodeType.OBJECT;
            case ARRAY:
                return io.cloudapis.json.spi.JsonNodeType.ARRAY;
            case STRING:
            case BINARY:
                return io.cloudapis.json.spi.JsonNodeType.STRING;
            case NUMBER:
                return io.cloudapis.json.spi.JsonNodeType.NUMBER;
            case BOOLEAN:
                return io.cloudapis.json.spi.JsonNodeType.BOOLEAN;
            default:
                return io.cloudapis.json.spi.JsonNodeType.NULL;
        }
    }

    @Override
    public io.cloudapis.json.spi.JsonNode get(String fieldName) {
        return node.isObject() ? wrap(node.get(fieldName)) : null;
    }

    @Override
    public int size() {
        return node.size();
    }

    @Override
    public String asText() {
        return node.asText();
    }

    @Override
    public long asLong() {
        return node.asLong();
    }

    @Override
    public int asInt() {
        return node.asInt();
    }

    @Override
    public boolean asBoolean() {
        return node.asBoolean();
    }

    @Override
    public Iterator<Map.Entry<String, io.cloudapis.json.spi.JsonNode>> fields() {
        Iterator<Map.Entry<String, JsonNode>> members = node.fields();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return members.hasNext();
            }

            @Override
            public Map.Entry<String, io.cloudapis.json.spi.JsonNode> next() {
                Map.Entry<String, JsonNode> member = members.next();
                return Map.entry(member.getKey(), wrap(member.getValue()));
            }
        };
    }

    @Override
    public Iterator<io.cloudapis.json.spi.JsonNode> elements() {
        Iterator<JsonNode> items = node.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return items.hasNext();
            }

            @Override
            public io.cloudapis.json.spi.JsonNode next() {
                return wrap(items.next());
            }
        };
    }

    @Override
    public String toString() {
        return node.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JacksonJsonNode && node.equals(((JacksonJsonNode) o).node);
    }

    @Override
    public int hashCode() {
        return node.hashCode();
    }
}
