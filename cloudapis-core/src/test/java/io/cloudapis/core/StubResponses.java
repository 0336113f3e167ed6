package io.cloudapis.core;

import io.cloudapis.http.spi.HttpClientResponse;
import io.cloudapis.json.jackson.JacksonJsonCodec;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public final class StubResponses {
    private StubResponses() {}

    public static final URI ENDPOINT = URI.create("https://sqs.us-east-1.amazonaws.com/");

    public static Response of(int status, String body) {
        return of(status, Map.of(), body, ExceptionMapper.NONE);
    }

    public static Response of(int status, Map<String, String> headers, String body) {
        return of(status, headers, body, ExceptionMapper.NONE);
    }

    public static Response of(int status, Map<String, String> headers, String body, ExceptionMapper mapper) {
        return new Response(ENDPOINT, raw(status, headers, body), new JacksonJsonCodec(), mapper);
    }

    public static HttpClientResponse raw(int status, Map<String, String> headers, String body) {
        Map<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        caseInsensitive.putAll(headers);
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        return new HttpClientResponse() {
            @Override
            public int statusCode() {
                return status;
            }

            @Override
            public Optional<String> header(String name) {
                return Optional.ofNullable(caseInsensitive.get(name));
            }

            @Override
            public byte[] body() {
                return bytes;
            }
        };
    }
}
