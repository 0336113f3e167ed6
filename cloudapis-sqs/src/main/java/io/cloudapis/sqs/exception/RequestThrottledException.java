package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The request was denied due to request throttling.
 */
public final class RequestThrottledException extends ClientException {

    private static final long serialVersionUID = 1L;

    public RequestThrottledException(Response response, AwsError error) {
        super(response, error);
    }
}
