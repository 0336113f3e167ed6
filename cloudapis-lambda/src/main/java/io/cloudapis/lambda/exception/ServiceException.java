package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ServerException;

/**
 * The service encountered an internal error.
 */
public final class ServiceException extends ServerException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public ServiceException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
