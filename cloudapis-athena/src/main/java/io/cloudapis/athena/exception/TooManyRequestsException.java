package io.cloudapis.athena.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.JsonFields;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * Indicates that the request was throttled.
 */
public final class TooManyRequestsException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    public TooManyRequestsException(Response response, AwsError error) {
        super(response, error);
        this.reason = JsonFields.diagnostic(error.body(), "Reason");
    }

    /** Only {@code CONCURRENT_QUERY_LIMIT_EXCEEDED} is defined today. */
    public String getReason() {
        return reason;
    }
}
