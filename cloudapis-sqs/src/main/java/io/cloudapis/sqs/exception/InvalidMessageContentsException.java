package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The message contains characters outside the allowed set.
 */
public final class InvalidMessageContentsException extends ClientException {

    private static final long serialVersionUID = 1L;

    public InvalidMessageContentsException(Response response, AwsError error) {
        super(response, error);
    }
}
