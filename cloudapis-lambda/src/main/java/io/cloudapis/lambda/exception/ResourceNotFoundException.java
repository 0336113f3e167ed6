package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The resource specified in the request does not exist.
 */
public final class ResourceNotFoundException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public ResourceNotFoundException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
