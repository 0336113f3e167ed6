package io.cloudapis.core;

import io.cloudapis.core.exception.HttpException;

/**
 * Maps a service error code to the exception type the service declares for it.
 *
 * <p>Each service implements this as a single {@code switch} over its known codes. Returning
 * {@code null} means the code is not one of them, and the caller falls back to
 * {@link HttpException#forStatus(Response, AwsError)}.
 */
@FunctionalInterface
public interface ExceptionMapper {

    ExceptionMapper NONE = (code, response, error) -> null;

    HttpException map(String code, Response response, AwsError error);
}
