package io.cloudapis.json.spi;

/**
 * ServiceLoader provider for {@link JsonCodec}.
 *
 * <p>Binding modules register an implementation under
 * {@code META-INF/services/io.cloudapis.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Creates a codec with the binding's default settings.
     */
    JsonCodec create();
}
