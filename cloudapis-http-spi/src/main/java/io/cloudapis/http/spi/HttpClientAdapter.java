package io.cloudapis.http.spi;

/**
 * Transport used by the service clients.
 *
 * <p>An adapter receives a fully resolved {@link HttpClientRequest} (endpoint, query, protocol headers
 * and payload already applied) and returns the response with its body read into memory. Any status
 * code is a valid result: mapping 4xx and 5xx answers to service exceptions happens above this layer.
 *
 * <p>Two adapters ship with the project: {@link JdkHttpClientAdapter}, used when nothing else is
 * configured, and the Apache HttpClient 5 adapter in {@code cloudapis-http-apache5}.
 *
 * <p>Implementations must be thread-safe; one adapter is shared by every call a client makes.
 */
public interface HttpClientAdapter {

    /**
     * @throws HttpTimeoutException if no response arrived within {@link HttpClientRequest#timeout()}
     * @throws HttpClientException if the exchange failed before a status line was read
     */
    HttpClientResponse send(HttpClientRequest request) throws HttpClientException;
}
