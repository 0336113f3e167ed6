package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * The specified queue doesn't exist.
 */
public final class QueueDoesNotExistException extends ClientException {

    private static final long serialVersionUID = 1L;

    public QueueDoesNotExistException(Response response, AwsError error) {
        super(response, error);
    }
}
