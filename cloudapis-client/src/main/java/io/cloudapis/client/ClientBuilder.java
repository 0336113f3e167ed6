package io.cloudapis.client;

import io.cloudapis.http.spi.HttpClientAdapter;
import io.cloudapis.http.spi.JdkHttpClientAdapter;
import io.cloudapis.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builder for service clients.
 *
 * <p>Allows configuring the transport layer (e.g. JDK HttpClient or custom), the JSON codec and the
 * {@link Configuration}. Anything left unset gets a default.
 *
 * @param <C> the service client type
 */
public final class ClientBuilder<C extends AbstractApi> {
    private final Function<ClientContext, C> factory;
    private HttpClientAdapter httpClient;
    private JsonCodec json;
    private Configuration configuration;

    public ClientBuilder(Function<ClientContext, C> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    /**
     * Sets a custom transport implementation.
     *
     * @param httpClient the transport to use
     * @return this builder
     */
    public ClientBuilder<C> httpClient(HttpClientAdapter httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    /**
     * Uses the JDK transport with a provided HttpClient instance.
     *
     * @param httpClient the JDK HttpClient to use
     * @return this builder
     */
    public ClientBuilder<C> jdkHttpClient(HttpClient httpClient) {
        this.httpClient = JdkHttpClientAdapter.create(Objects.requireNonNull(httpClient, "httpClient"));
        return this;
    }

    public ClientBuilder<C> jsonCodec(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
        return this;
    }

    public ClientBuilder<C> configuration(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        return this;
    }

    /**
     * Shorthand for a configuration that only sets the region.
     */
    public ClientBuilder<C> region(String region) {
        Configuration base = configuration == null ? Configuration.defaults() : configuration;
        this.configuration = base.toBuilder().region(region).build();
        return this;
    }

    /**
     * Builds the client.
     *
     * <p>If no transport is configured, a default JDK HttpClient-based transport is created. If no codec
     * is configured, one is discovered through {@link java.util.ServiceLoader}. If no configuration is
     * given, it is read from the environment.
     *
     * @return the new client instance
     */
    public C build() {
        HttpClientAdapter resolvedHttp = httpClient == null ? JdkHttpClientAdapter.create() : httpClient;
        JsonCodec resolvedJson = json == null ? JsonCodecs.discover() : json;
        Configuration resolvedConfig = configuration == null ? Configuration.fromEnvironment() : configuration;
        return factory.apply(new ClientContext(resolvedHttp, resolvedJson, resolvedConfig));
    }
}
