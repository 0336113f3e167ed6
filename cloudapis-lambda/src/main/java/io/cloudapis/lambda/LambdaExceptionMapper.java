package io.cloudapis.lambda;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.HttpException;
import io.cloudapis.lambda.exception.InvalidParameterValueException;
import io.cloudapis.lambda.exception.InvalidRequestContentException;
import io.cloudapis.lambda.exception.KMSAccessDeniedException;
import io.cloudapis.lambda.exception.KMSDisabledException;
import io.cloudapis.lambda.exception.KMSInvalidStateException;
import io.cloudapis.lambda.exception.KMSNotFoundException;
import io.cloudapis.lambda.exception.RequestTooLargeException;
import io.cloudapis.lambda.exception.ResourceNotFoundException;
import io.cloudapis.lambda.exception.ServiceException;
import io.cloudapis.lambda.exception.TooManyRequestsException;
import io.cloudapis.lambda.exception.UnsupportedMediaTypeException;

final class LambdaExceptionMapper implements ExceptionMapper {

    static final LambdaExceptionMapper INSTANCE = new LambdaExceptionMapper();

    private LambdaExceptionMapper() {}

    @Override
    public HttpException map(String code, Response response, AwsError error) {
        switch (code) {
            case "KMSDisabledException":
                return new KMSDisabledException(response, error);
            case "KMSAccessDeniedException":
                return new KMSAccessDeniedException(response, error);
            case "KMSNotFoundException":
                return new KMSNotFoundException(response, error);
            case "KMSInvalidStateException":
                return new KMSInvalidStateException(response, error);
            case "ServiceException":
                return new ServiceException(response, error);
            case "ResourceNotFoundException":
                return new ResourceNotFoundException(response, error);
            case "InvalidParameterValueException":
                return new InvalidParameterValueException(response, error);
            case "InvalidRequestContentException":
                return new InvalidRequestContentException(response, error);
            case "RequestTooLargeException":
                return new RequestTooLargeException(response, error);
            case "TooManyRequestsException":
                return new TooManyRequestsException(response, error);
            case "UnsupportedMediaTypeException":
                return new UnsupportedMediaTypeException(response, error);
            default:
                return null;
        }
    }
}
