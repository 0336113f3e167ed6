package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * A queue with this name already exists with different attributes.
 */
public final class QueueNameExistsException extends ClientException {

    private static final long serialVersionUID = 1L;

    public QueueNameExistsException(Response response, AwsError error) {
        super(response, error);
    }
}
