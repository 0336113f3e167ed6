package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The content type of the {@code Invoke} request body is not JSON.
 */
public final class UnsupportedMediaTypeException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public UnsupportedMediaTypeException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
