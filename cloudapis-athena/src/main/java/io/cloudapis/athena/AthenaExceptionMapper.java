package io.cloudapis.athena;

import io.cloudapis.athena.exception.InternalServerException;
import io.cloudapis.athena.exception.InvalidRequestException;
import io.cloudapis.athena.exception.ResourceNotFoundException;
import io.cloudapis.athena.exception.TooManyRequestsException;
import io.cloudapis.core.AwsError;
import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.HttpException;

final class AthenaExceptionMapper implements ExceptionMapper {

    static final AthenaExceptionMapper INSTANCE = new AthenaExceptionMapper();

    private AthenaExceptionMapper() {}

    @Override
    public HttpException map(String code, Response response, AwsError error) {
        switch (code) {
            case "InternalServerException":
                return new InternalServerException(response, error);
            case "InvalidRequestException":
                return new InvalidRequestException(response, error);
            case "ResourceNotFoundException":
                return new ResourceNotFoundException(response, error);
            case "TooManyRequestsException":
                return new TooManyRequestsException(response, error);
            default:
                return null;
        }
    }
}
