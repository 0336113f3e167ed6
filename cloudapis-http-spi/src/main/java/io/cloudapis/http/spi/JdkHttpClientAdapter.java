package io.cloudapis.http.spi;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link HttpClientAdapter} on top of {@code java.net.http.HttpClient}. Needs no extra dependency,
 * so it is what a client uses unless another adapter is configured.
 */
public final class JdkHttpClientAdapter implements HttpClientAdapter {

    // Managed by java.net.http; setting them throws.
    private static final Set<String> RESTRICTED = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final HttpClient client;

    private JdkHttpClientAdapter(HttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public static JdkHttpClientAdapter create() {
        return new JdkHttpClientAdapter(HttpClient.newHttpClient());
    }

    public static JdkHttpClientAdapter create(HttpClient client) {
        return new JdkHttpClientAdapter(client);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        HttpResponse<byte[]> response;
        try {
            response = client.send(convert(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (java.net.http.HttpTimeoutException e) {
            throw new HttpTimeoutException("No response from " + request.uri() + " within " + request.timeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientException("Interrupted while calling " + request.uri(), e);
        } catch (IOException e) {
            throw new HttpClientException("Could not call " + request.uri() + ": " + e.getMessage(), e);
        }
        return new JdkResponse(response.statusCode(), response.headers(), response.body());
    }

    private static HttpRequest convert(HttpClientRequest request) throws HttpClientException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder(request.uri());
        } catch (IllegalArgumentException e) {
            throw new HttpClientException("Unusable endpoint " + request.uri(), e);
        }
        builder.method(request.method(), request.hasBody()
                ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                : HttpRequest.BodyPublishers.noBody());
        for (var header : request.headers().entrySet()) {
            if (!RESTRICTED.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private static final class JdkResponse implements HttpClientResponse {
        private final int status;
        private final HttpHeaders headers;
        private final byte[] body;

        JdkResponse(int status, HttpHeaders headers, byte[] body) {
            this.status = status;
            this.headers = headers;
            this.body = body == null ? new byte[0] : body;
        }

        @Override
        public int statusCode() {
            return status;
        }

        @Override
        public Optional<String> header(String name) {
            return headers.firstValue(name);
        }

        @Override
        public byte[] body() {
            return body;
        }
    }
}
