package io.cloudapis.core;

import io.cloudapis.json.spi.JsonNode;

/**
 * Diagnostic fields extracted from an error response.
 *
 * @param code the error code used to select the exception type, or null if the response had none
 * @param type the fault type reported by the service (for example {@code Sender} or {@code User}), may be null
 * @param message the human-readable message, may be null
 * @param detail additional detail, may be null
 * @param body the parsed error body, or null when the body was empty or not JSON
 */
public record AwsError(String code, String type, String message, String detail, JsonNode body) {

    public static AwsError empty() {
        return new AwsError(null, null, null, null, null);
    }
}
