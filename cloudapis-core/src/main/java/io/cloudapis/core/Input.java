package io.cloudapis.core;

import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.JsonException;
import io.cloudapis.json.spi.ObjectNode;

/**
 * Base class for request inputs.
 *
 * <p>An input is a mutable bag of fields. Required fields and enum membership are checked by
 * {@link #request(JsonCodec)}, not by setters, so a partially filled input is a valid intermediate
 * state. {@code request} depends only on the current field values.
 */
public abstract class Input {

    private String region;

    protected Input() {}

    protected Input(String region) {
        this.region = region;
    }

    /**
     * Region override for this call only, or null to use the client's configured region.
     */
    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    /**
     * Serializes this input into a transport-neutral request.
     *
     * @param json codec used for the request body
     * @throws io.cloudapis.core.exception.CloudApiException.MissingRequiredField if a required field is unset
     * @throws io.cloudapis.core.exception.CloudApiException.InvalidEnumValue if an enum field holds an unknown value
     */
    public abstract Request request(JsonCodec json);

    /**
     * Encodes a request body tree.
     */
    protected static byte[] encode(JsonCodec json, ObjectNode payload) {
        try {
            return json.writeBytes(payload);
        } catch (JsonException e) {
            throw new IllegalStateException("Unable to encode request body", e);
        }
    }
}
