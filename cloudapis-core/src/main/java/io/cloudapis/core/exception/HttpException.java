package io.cloudapis.core.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.Response;

import java.net.URI;

/**
 * A fault reported by a service: the response carried a non-2xx status.
 *
 * <p>Holds the status and whatever diagnostic fields the service supplied. Subclasses for a
 * specific error code read their extra fields from {@link AwsError#body()} in their constructor;
 * instances are never mutated afterwards.
 */
public abstract class HttpException extends CloudApiException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final transient URI uri;
    private final String requestId;
    private final String awsCode;
    private final String awsType;
    private final String awsMessage;
    private final String awsDetail;

    protected HttpException(Response response, AwsError error) {
        super(describe(response, error));
        this.statusCode = response.statusCode();
        this.uri = response.uri();
        this.requestId = response.requestId().orElse(null);
        this.awsCode = error.code();
        this.awsType = error.type();
        this.awsMessage = error.message();
        this.awsDetail = error.detail();
    }

    /**
     * Builds the generic exception for the status family of the response. Used when the error code
     * is absent or not one the service declares.
     */
    public static HttpException forStatus(Response response, AwsError error) {
        int status = response.statusCode();
        if (status >= 500) {
            return new ServerException(response, error);
        }
        if (status >= 400) {
            return new ClientException(response, error);
        }
        return new RedirectionException(response, error);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public URI getUri() {
        return uri;
    }

    public String getRequestId() {
        return requestId;
    }

    /** Service error code, the dispatch discriminator. */
    public String getAwsCode() {
        return awsCode;
    }

    public String getAwsType() {
        return awsType;
    }

    public String getAwsMessage() {
        return awsMessage;
    }

    public String getAwsDetail() {
        return awsDetail;
    }

    private static String describe(Response response, AwsError error) {
        StringBuilder sb = new StringBuilder()
                .append("HTTP ").append(response.statusCode())
                .append(" returned for \"").append(response.uri()).append("\".");
        if (error.code() != null) sb.append("\n\nCode: ").append(error.code());
        if (error.message() != null) sb.append("\nMessage: ").append(error.message());
        if (error.type() != null) sb.append("\nType: ").append(error.type());
        if (error.detail() != null) sb.append("\nDetail: ").append(error.detail());
        return sb.toString();
    }
}
