package io.cloudapis.lambda.valueobject;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

import java.util.Map;

/**
 * The results of an operation to update or read environment variables. If the operation succeeds,
 * the response contains the environment variables. If it fails, the response contains details
 * about the error.
 */
public final class EnvironmentResponse {

    private final Map<String, String> variables;
    private final EnvironmentError error;

    private EnvironmentResponse(Map<String, String> variables, EnvironmentError error) {
        this.variables = variables;
        this.error = error;
    }

    public static EnvironmentResponse hydrate(JsonNode data) {
        return new EnvironmentResponse(
                JsonFields.stringMap(data, "Variables"),
                JsonFields.object(data, "Error", EnvironmentError::hydrate));
    }

    public Map<String, String> getVariables() {
        return variables;
    }

    public EnvironmentError getError() {
        return error;
    }
}
