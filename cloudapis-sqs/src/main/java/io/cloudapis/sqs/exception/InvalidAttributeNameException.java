package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The specified attribute doesn't exist.
 */
public final class InvalidAttributeNameException extends ClientException {

    private static final long serialVersionUID = 1L;

    public InvalidAttributeNameException(Response response, AwsError error) {
        super(response, error);
    }
}
