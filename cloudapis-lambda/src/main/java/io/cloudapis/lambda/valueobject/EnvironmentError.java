package io.cloudapis.lambda.valueobject;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

/**
 * Error messages for environment variables that couldn't be applied.
 */
public final class EnvironmentError {

    private final String errorCode;
    private final String message;

    private EnvironmentError(String errorCode, String message) {
        this.errorCode = errorCode;
        this.message = message;
    }

    public static EnvironmentError hydrate(JsonNode data) {
        return new EnvironmentError(JsonFields.string(data, "ErrorCode"), JsonFields.string(data, "Message"));
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }
}
