package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The request payload exceeded the invocation payload size limit.
 */
public final class RequestTooLargeException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public RequestTooLargeException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
