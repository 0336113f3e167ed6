package io.cloudapis.lambda.result;

import io.cloudapis.core.Response;

/**
 * Outcome of {@code Invoke}, read from the status line, the response headers and the raw body.
 */
public final class InvocationResponse {

    private final int statusCode;
    private final String functionError;
    private final String logResult;
    private final String payload;
    private final String executedVersion;

    private InvocationResponse(Response response) {
        this.statusCode = response.statusCode();
        this.functionError = response.header("X-Amz-Function-Error").orElse(null);
        this.logResult = response.header("X-Amz-Log-Result").orElse(null);
        this.payload = response.bodyAsString();
        this.executedVersion = response.header("X-Amz-Executed-Version").orElse(null);
    }

    /**
     * @param response a response whose status has already been checked
     */
    public static InvocationResponse hydrate(Response response) {
        return new InvocationResponse(response);
    }

    /**
     * 200 for {@code RequestResponse}, 202 for {@code Event} and 204 for {@code DryRun}.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Set when the function itself failed. The payload then holds the error object.
     */
    public String getFunctionError() {
        return functionError;
    }

    /** Base64 encoded last 4 KB of the execution log, only with {@code LogType=Tail}. */
    public String getLogResult() {
        return logResult;
    }

    public String getPayload() {
        return payload;
    }

    public String getExecutedVersion() {
        return executedVersion;
    }
}
