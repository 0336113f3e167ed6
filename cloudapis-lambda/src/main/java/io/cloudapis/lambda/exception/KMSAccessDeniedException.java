package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ServerException;

/**
 * The function couldn't decrypt the environment variables because KMS access was denied.
 */
public final class KMSAccessDeniedException extends ServerException {

    private static final long serialVersionUID = 1L;

    private final String type;

    public KMSAccessDeniedException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
    }

    public String getType() {
        return type;
    }
}
