package io.cloudapis.http.spi;

import java.util.Optional;

/**
 * A response whose body has been fully read.
 */
public interface HttpClientResponse {

    int statusCode();

    /**
     * First value of a header. Lookup ignores case, so {@code x-amzn-errortype} finds
     * {@code X-Amzn-ErrorType}.
     */
    Optional<String> header(String name);

    /**
     * @return the body, empty (never null) when the response had none
     */
    byte[] body();
}
