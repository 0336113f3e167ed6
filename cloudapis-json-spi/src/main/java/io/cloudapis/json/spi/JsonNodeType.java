package io.cloudapis.json.spi;

import java.util.Locale;

/**
 * Shape of a {@link JsonNode}, reported in malformed-response messages.
 */
public enum JsonNodeType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
