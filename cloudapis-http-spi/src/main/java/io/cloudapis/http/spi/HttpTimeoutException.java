package io.cloudapis.http.spi;

/**
 * The per-request timeout elapsed before the response arrived.
 */
public class HttpTimeoutException extends HttpClientException {

    public HttpTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
