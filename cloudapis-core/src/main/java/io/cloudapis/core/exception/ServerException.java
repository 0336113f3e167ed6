package io.cloudapis.core.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;

/**
 * Raised for a 5xx response.
 */
public class ServerException extends HttpException {

    private static final long serialVersionUID = 1L;

    public ServerException(Response response, AwsError error) {
        super(response, error);
    }
}
