package io.cloudapis.json.spi;

/**
 * Raised by a {@link JsonCodec} when a document cannot be parsed or a payload cannot be written.
 */
public class JsonException extends Exception {

    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
