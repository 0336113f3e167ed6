package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * A queue with this name was deleted less than 60 seconds ago.
 */
public final class QueueDeletedRecentlyException extends ClientException {

    private static final long serialVersionUID = 1L;

    public QueueDeletedRecentlyException(Response response, AwsError error) {
        super(response, error);
    }
}
