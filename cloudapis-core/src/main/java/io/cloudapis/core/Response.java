package io.cloudapis.core;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.core.exception.HttpException;
import io.cloudapis.http.spi.HttpClientResponse;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.JsonException;
import io.cloudapis.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * A received HTTP response together with what is needed to read it: the JSON codec and the
 * service's {@link ExceptionMapper}.
 *
 * <p>{@link #toJson(boolean)} is the single entry point for result hydration. With
 * {@code throwOnError} set, a non-2xx status is turned into exactly one {@link HttpException}.
 */
public final class Response {

    private static final Logger LOG = LoggerFactory.getLogger(Response.class);

    private final URI uri;
    private final HttpClientResponse raw;
    private final JsonCodec json;
    private final ExceptionMapper exceptionMapper;

    public Response(URI uri, HttpClientResponse raw, JsonCodec json, ExceptionMapper exceptionMapper) {
        this.uri = Objects.requireNonNull(uri, "uri");
        this.raw = Objects.requireNonNull(raw, "raw");
        this.json = Objects.requireNonNull(json, "json");
        this.exceptionMapper = exceptionMapper == null ? ExceptionMapper.NONE : exceptionMapper;
    }

    /** The URI the request was sent to. */
    public URI uri() {
        return uri;
    }

    public int statusCode() {
        return raw.statusCode();
    }

    public boolean isSuccessful() {
        int status = raw.statusCode();
        return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
        return raw.header(name);
    }

    public Optional<String> requestId() {
        return raw.header(Protocol.H_REQUEST_ID);
    }

    public byte[] body() {
        byte[] body = raw.body();
        return body == null ? new byte[0] : body;
    }

    public String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }

    /**
     * Throws the mapped {@link HttpException} if the status is not 2xx.
     * @return this response, for chaining
     */
    public Response checkStatus() {
        if (!isSuccessful()) {
            throw toException();
        }
        return this;
    }

    /**
     * Parses the body as a JSON tree. An empty body reads as an empty object.
     *
     * @param throwOnError whether a non-2xx status should raise the mapped exception first
     * @return the parsed body
     * @throws HttpException if {@code throwOnError} is set and the status is not 2xx
     * @throws CloudApiException.MalformedResponse if the body is not JSON
     */
    public JsonNode toJson(boolean throwOnError) {
        if (throwOnError) {
            checkStatus();
        }
        byte[] body = body();
        if (isBlank(body)) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(body);
        } catch (JsonException e) {
            throw new CloudApiException.MalformedResponse("Response body from \"" + uri + "\" is not valid JSON", e);
        }
    }

    /**
     * Builds the exception for this response: the service's type for a known code, otherwise the
     * generic type for the status family.
     */
    public HttpException toException() {
        AwsError error = ErrorParser.parse(this);
        if (error.code() != null) {
            HttpException mapped = exceptionMapper.map(error.code(), this, error);
            if (mapped != null) {
                return mapped;
            }
            LOG.debug("No exception type declared for code {} (HTTP {}), falling back to status family", error.code(), statusCode());
        }
        return HttpException.forStatus(this, error);
    }

    JsonNode toJsonOrNull() {
        byte[] body = body();
        if (isBlank(body)) {
            return null;
        }
        try {
            return json.readTree(body);
        } catch (JsonException e) {
            LOG.debug("Error body from {} is not JSON: {}", uri, e.getMessage());
            return null;
        }
    }

    private static boolean isBlank(byte[] body) {
        for (byte b : body) {
            if (!Character.isWhitespace(b)) return false;
        }
        return true;
    }
}
