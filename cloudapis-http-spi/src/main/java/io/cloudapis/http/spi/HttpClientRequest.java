package io.cloudapis.http.spi;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One outgoing call as the transport sees it.
 *
 * <p>Headers keep the order in which the client added them. A {@code null} body means the request
 * is sent without one (GET), which is different from an empty payload.
 */
public final class HttpClientRequest {

    private final URI uri;
    private final String method;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Duration timeout;

    private HttpClientRequest(Builder builder) {
        this.uri = builder.uri;
        this.method = builder.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.timeout = builder.timeout;
    }

    public static Builder builder(URI uri, String method) {
        return new Builder(uri, method);
    }

    public static Builder get(URI uri) {
        return builder(uri, "GET");
    }

    public static Builder post(URI uri) {
        return builder(uri, "POST");
    }

    public URI uri() {
        return uri;
    }

    public String method() {
        return method;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return the response timeout, or {@code null} to use the transport's own default
     */
    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return method + " " + uri + (body == null ? "" : " (" + body.length + " bytes)");
    }

    public static final class Builder {
        private final URI uri;
        private final String method;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private Duration timeout;

        private Builder(URI uri, String method) {
            this.uri = Objects.requireNonNull(uri, "uri");
            this.method = Objects.requireNonNull(method, "method");
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> values) {
            values.forEach(this::header);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpClientRequest build() {
            return new HttpClientRequest(this);
        }
    }
}
