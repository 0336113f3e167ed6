package io.cloudapis.sqs.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

public final class InvalidAddressException extends ClientException {

    private static final long serialVersionUID = 1L;

    public InvalidAddressException(Response response, AwsError error) {
        super(response, error);
    }
}
