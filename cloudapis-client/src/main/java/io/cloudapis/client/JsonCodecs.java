package io.cloudapis.client;

import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.JsonCodecProvider;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
final class JsonCodecs {
    private JsonCodecs() {}

    static JsonCodec discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    static JsonCodec discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> providers = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException("No " + JsonCodecProvider.class.getName()
                    + " found on the classpath; add cloudapis-json-jackson or pass a JsonCodec to the builder");
        }
        return providers.next().create();
    }
}
