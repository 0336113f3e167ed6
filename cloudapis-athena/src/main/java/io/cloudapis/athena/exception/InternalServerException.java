package io.cloudapis.athena.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ServerException;

/**
 * Indicates a platform issue, which may be due to a transient condition or outage.
 */
public final class InternalServerException extends ServerException {

    private static final long serialVersionUID = 1L;

    public InternalServerException(Response response, AwsError error) {
        super(response, error);
    }
}
