package io.cloudapis.client;

import io.cloudapis.http.spi.HttpClientAdapter;
import io.cloudapis.json.spi.JsonCodec;

import java.util.Objects;

/**
 * Collaborators shared by every service client.
 *
 * @param httpClient the transport
 * @param json the codec for request bodies and response trees
 * @param configuration region, endpoint and timeout settings
 */
public record ClientContext(HttpClientAdapter httpClient, JsonCodec json, Configuration configuration) {
    public ClientContext {
        Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(configuration, "configuration");
    }
}
