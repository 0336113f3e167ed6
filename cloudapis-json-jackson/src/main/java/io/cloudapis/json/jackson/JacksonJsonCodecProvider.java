package io.cloudapis.json.jackson;

import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public JsonCodec create() {
        return new JacksonJsonCodec();
    }
}
