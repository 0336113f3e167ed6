package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * One of the parameters in the request is not valid.
 */
public final class InvalidParameterValueException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public InvalidParameterValueException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
