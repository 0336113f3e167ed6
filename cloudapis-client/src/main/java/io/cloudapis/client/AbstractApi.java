package io.cloudapis.client;

import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Response;
import io.cloudapis.core.exception.NetworkException;
import io.cloudapis.http.spi.HttpClientAdapter;
import io.cloudapis.http.spi.HttpClientException;
import io.cloudapis.http.spi.HttpClientRequest;
import io.cloudapis.http.spi.HttpClientResponse;
import io.cloudapis.http.spi.HttpTimeoutException;
import io.cloudapis.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;

/**
 * Base class for service clients.
 *
 * <p>Each operation is a straight line: serialize the input, send it once through the
 * {@link HttpClientAdapter}, and wrap what comes back in a {@link Response} bound to the service's
 * {@link ExceptionMapper}. There is no retry, signing or pagination here.
 *
 * <p>Instances are immutable and may be shared between threads if the transport allows it.
 */
public abstract class AbstractApi {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractApi.class);

    private final HttpClientAdapter httpClient;
    private final JsonCodec json;
    private final Configuration configuration;

    protected AbstractApi(ClientContext context) {
        Objects.requireNonNull(context, "context");
        this.httpClient = context.httpClient();
        this.json = context.json();
        this.configuration = context.configuration();
    }

    /**
     * Host prefix of the service endpoint, e.g. {@code sqs} or {@code lambda}.
     */
    protected abstract String endpointPrefix();

    /**
     * Maps this service's error codes to its exception types.
     */
    protected abstract ExceptionMapper exceptionMapper();

    public Configuration configuration() {
        return configuration;
    }

    protected final JsonCodec json() {
        return json;
    }

    /**
     * Sends one operation and returns the raw response. Status is not checked here; callers
     * hydrate through {@link Response#toJson(boolean)} or {@link Response#checkStatus()}.
     *
     * @throws NetworkException if the transport fails before a response arrives
     */
    protected final Response execute(String operation, Input input) {
        Request request = input.request(json);
        URI endpoint = configuration.resolveEndpoint(endpointPrefix(), request.region());
        URI uri = request.uri(endpoint);

        HttpClientRequest.Builder builder = HttpClientRequest.builder(uri, request.method())
                .headers(request.headers())
                .body(request.body());
        configuration.timeout().ifPresent(builder::timeout);

        LOG.debug("{} {} {}", operation, request.method(), uri);
        HttpClientResponse raw;
        try {
            raw = httpClient.send(builder.build());
        } catch (HttpTimeoutException e) {
            throw new NetworkException.Timeout("Timed out waiting for " + operation + " at \"" + uri + "\"", e);
        } catch (HttpClientException e) {
            throw new NetworkException("Could not contact \"" + uri + "\" for " + operation, e);
        }
        LOG.debug("{} returned HTTP {}", operation, raw.statusCode());
        return new Response(uri, raw, json, exceptionMapper());
    }
}
