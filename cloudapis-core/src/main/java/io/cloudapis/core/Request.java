package io.cloudapis.core;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Transport-neutral description of one API call, produced by {@link Input#request(io.cloudapis.json.spi.JsonCodec)}.
 *
 * <p>The path is relative to the service endpoint, which the client resolves from its configuration
 * and the optional per-request {@link #region()}. Immutable.
 */
public final class Request {

    private final String method;
    private final String path;
    private final Map<String, String> query;
    private final Map<String, String> headers;
    private final byte[] body;
    private final String region;

    private Request(Builder builder) {
        this.method = Objects.requireNonNull(builder.method, "method");
        this.path = Objects.requireNonNull(builder.path, "path");
        this.query = Collections.unmodifiableMap(new TreeMap<>(builder.query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.region = builder.region;
    }

    public String method() { return method; }
    public String path() { return path; }
    public Map<String, String> query() { return query; }
    public Map<String, String> headers() { return headers; }
    public byte[] body() { return body; }
    public String region() { return region; }

    /**
     * Returns the body decoded as UTF-8, or an empty string when there is no body.
     */
    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Resolves the full request URI against a service endpoint.
     */
    public URI uri(URI endpoint) {
        return Urls.withQuery(Urls.resolve(endpoint, path), query);
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public static Builder post(String path) { return new Builder("POST", path); }
    public static Builder get(String path) { return new Builder("GET", path); }

    @Override
    public String toString() {
        return method + " " + path + (query.isEmpty() ? "" : " " + query);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Request)) return false;
        Request other = (Request) obj;
        return method.equals(other.method)
                && path.equals(other.path)
                && query.equals(other.query)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body)
                && Objects.equals(region, other.region);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, path, query, headers, Arrays.hashCode(body), region);
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private final Map<String, String> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private String region;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder header(String name, String value) {
            if (value != null) headers.put(name, value);
            return this;
        }

        public Builder query(String name, String value) {
            if (value != null) query.put(name, value);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Request build() {
            return new Request(this);
        }
    }
}
