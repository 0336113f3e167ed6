package io.cloudapis.core.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;

/**
 * Raised for a 3xx response.
 */
public class RedirectionException extends HttpException {

    private static final long serialVersionUID = 1L;

    public RedirectionException(Response response, AwsError error) {
        super(response, error);
    }
}
