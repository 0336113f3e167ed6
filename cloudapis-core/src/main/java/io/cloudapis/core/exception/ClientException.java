package io.cloudapis.core.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;

/**
 * Raised for a 4xx response.
 */
public class ClientException extends HttpException {

    private static final long serialVersionUID = 1L;

    public ClientException(Response response, AwsError error) {
        super(response, error);
    }
}
