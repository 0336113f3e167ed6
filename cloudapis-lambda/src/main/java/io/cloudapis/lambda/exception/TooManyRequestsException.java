package io.cloudapis.lambda.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.JsonFields;
import io.cloudapis.core.Protocol;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.ClientException;

import java.util.regex.Pattern;

/**
 * The request throughput limit was exceeded.
 *
 * <p>{@link #getRetryAfterSeconds()} comes from the {@code Retry-After} header and is null when the
 * header is absent or not a number of seconds.
 */
public final class TooManyRequestsException extends ClientException {

    private static final long serialVersionUID = 1L;

    private static final Pattern SECONDS = Pattern.compile("\\d{1,18}");

    private final String type;
    private final String reason;
    private final Long retryAfterSeconds;

    public TooManyRequestsException(Response response, AwsError error) {
        super(response, error);
        this.type = error.type();
        this.reason = JsonFields.diagnostic(error.body(), "Reason");
        this.retryAfterSeconds = response.header(Protocol.H_RETRY_AFTER)
                .map(String::trim)
                .filter(v -> SECONDS.matcher(v).matches())
                .map(Long::valueOf)
                .orElse(null);
    }

    public String getType() {
        return type;
    }

    /**
     * One of {@code ConcurrentInvocationLimitExceeded}, {@code FunctionInvocationRateLimitExceeded},
     * {@code ReservedFunctionConcurrentInvocationLimitExceeded} and the like. Not checked.
     */
    public String getReason() {
        return reason;
    }

    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
