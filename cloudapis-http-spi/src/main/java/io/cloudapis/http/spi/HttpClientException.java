package io.cloudapis.http.spi;

/**
 * The request never produced a response: connection refused, reset, DNS failure, interrupted.
 */
public class HttpClientException extends Exception {

    public HttpClientException(String message) {
        super(message);
    }

    public HttpClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
