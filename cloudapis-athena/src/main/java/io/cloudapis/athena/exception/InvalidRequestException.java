package io.cloudapis.athena.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.JsonFields;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

/**
 * Indicates that something is wrong with the input to the request. For example, a required
 * parameter may be missing or out of range.
 */
public final class InvalidRequestException extends ClientException {

    private static final long serialVersionUID = 1L;

    private final String athenaErrorCode;

    public InvalidRequestException(Response response, AwsError error) {
        super(response, error);
        this.athenaErrorCode = JsonFields.diagnostic(error.body(), "AthenaErrorCode");
    }

    public String getAthenaErrorCode() {
        return athenaErrorCode;
    }
}
