package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * A queue attribute value is invalid.
 */
public final class InvalidAttributeValueException extends ClientException {

    private static final long serialVersionUID = 1L;

    public InvalidAttributeValueException(Response response, AwsError error) {
        super(response, error);
    }
}
