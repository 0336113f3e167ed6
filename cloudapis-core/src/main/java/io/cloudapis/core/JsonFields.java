package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.spi.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Field readers used by result hydration.
 *
 * <p>A missing key or a JSON null reads as {@code null} (or an empty collection); unknown keys are never
 * looked at. A value of the wrong shape is a {@link CloudApiException.MalformedResponse}.
 */
public final class JsonFields {
    private JsonFields() {}

    public static String string(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null) return null;
        requireScalar(node, name);
        return node.asText();
    }

    public static Integer integer(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null) return null;
        try {
            return exactNumber(node, name).intValueExact();
        } catch (ArithmeticException e) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" does not fit an int: " + node.asText(), e);
        }
    }

    public static Long longValue(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null) return null;
        try {
            return exactNumber(node, name).longValueExact();
        } catch (ArithmeticException e) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" does not fit a long: " + node.asText(), e);
        }
    }

    /**
     * Reads an optional diagnostic member of an error body. Unlike {@link #string}, a value of the
     * wrong shape reads as {@code null} so that building the service exception never fails.
     */
    public static String diagnostic(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null || node.isObject() || node.isArray()) return null;
        return node.asText();
    }

    public static Boolean bool(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null) return null;
        if (!node.isBoolean()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be a boolean, got " + node.getNodeType());
        }
        return node.asBoolean();
    }

    public static Instant timestamp(JsonNode parent, String name) {
        try {
            return Timestamps.parse(field(parent, name));
        } catch (CloudApiException.MalformedResponse e) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\": " + e.getMessage(), e);
        }
    }

    public static byte[] blob(JsonNode parent, String name) {
        String encoded = string(parent, name);
        if (encoded == null) return null;
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" is not valid base64", e);
        }
    }

    public static <T> T object(JsonNode parent, String name, Function<JsonNode, T> hydrator) {
        JsonNode node = field(parent, name);
        if (node == null) return null;
        if (!node.isObject()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be an object, got " + node.getNodeType());
        }
        return hydrator.apply(node);
    }

    public static <T> List<T> list(JsonNode parent, String name, Function<JsonNode, T> hydrator) {
        JsonNode node = field(parent, name);
        if (node == null) return List.of();
        if (!node.isArray()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be an array, got " + node.getNodeType());
        }
        List<T> out = new ArrayList<>(node.size());
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            out.add(hydrator.apply(it.next()));
        }
        return Collections.unmodifiableList(out);
    }

    public static List<String> stringList(JsonNode parent, String name) {
        return list(parent, name, element -> {
            requireScalar(element, name);
            return element.asText();
        });
    }

    public static Map<String, String> stringMap(JsonNode parent, String name) {
        JsonNode node = field(parent, name);
        if (node == null) return Map.of();
        if (!node.isObject()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be an object, got " + node.getNodeType());
        }
        Map<String, String> out = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getValue() == null || entry.getValue().isNull()) continue;
            requireScalar(entry.getValue(), name + "." + entry.getKey());
            out.put(entry.getKey(), entry.getValue().asText());
        }
        return Collections.unmodifiableMap(out);
    }

    private static JsonNode field(JsonNode parent, String name) {
        if (parent == null) return null;
        JsonNode node = parent.get(name);
        if (node == null || node.isNull()) return null;
        return node;
    }

    private static void requireScalar(JsonNode node, String name) {
        if (node.isObject() || node.isArray()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be a scalar, got " + node.getNodeType());
        }
    }

    private static BigDecimal exactNumber(JsonNode node, String name) {
        if (!node.isNumber()) {
            throw new CloudApiException.MalformedResponse("Field \"" + name + "\" should be a number, got " + node.getNodeType());
        }
        return new BigDecimal(node.asText());
    }
}
