package io.cloudapis.sqs;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.HttpException;
import io.cloudapis.sqs.exception.InvalidAddressException;
import io.cloudapis.sqs.exception.InvalidAttributeNameException;
import io.cloudapis.sqs.exception.InvalidAttributeValueException;
import io.cloudapis.sqs.exception.InvalidMessageContentsException;
import io.cloudapis.sqs.exception.InvalidSecurityException;
import io.cloudapis.sqs.exception.QueueDeletedRecentlyException;
import io.cloudapis.sqs.exception.QueueDoesNotExistException;
import io.cloudapis.sqs.exception.QueueNameExistsException;
import io.cloudapis.sqs.exception.RequestThrottledException;

/**
 * Error codes of the queue service. The legacy query protocol codes are still sent in
 * {@code x-amzn-query-error} and map to the same types.
 */
final class SqsExceptionMapper implements ExceptionMapper {

    static final SqsExceptionMapper INSTANCE = new SqsExceptionMapper();

    private SqsExceptionMapper() {}

    @Override
    public HttpException map(String code, Response response, AwsError error) {
        switch (code) {
            case "QueueDoesNotExist":
            case "AWS.SimpleQueueService.NonExistentQueue":
                return new QueueDoesNotExistException(response, error);
            case "QueueNameExists":
            case "QueueAlreadyExists":
                return new QueueNameExistsException(response, error);
            case "QueueDeletedRecently":
            case "AWS.SimpleQueueService.QueueDeletedRecently":
                return new QueueDeletedRecentlyException(response, error);
            case "InvalidAttributeName":
                return new InvalidAttributeNameException(response, error);
            case "InvalidAttributeValue":
                return new InvalidAttributeValueException(response, error);
            case "RequestThrottled":
                return new RequestThrottledException(response, error);
            case "InvalidSecurity":
                return new InvalidSecurityException(response, error);
            case "InvalidMessageContents":
                return new InvalidMessageContentsException(response, error);
            case "InvalidAddress":
                return new InvalidAddressException(response, error);
            default:
                return null;
        }
    }
}
