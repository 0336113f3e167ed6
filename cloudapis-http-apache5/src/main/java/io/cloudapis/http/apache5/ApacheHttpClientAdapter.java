package io.cloudapis.http.apache5;

import io.cloudapis.http.spi.HttpClientAdapter;
import io.cloudapis.http.spi.HttpClientException;
import io.cloudapis.http.spi.HttpClientRequest;
import io.cloudapis.http.spi.HttpClientResponse;
import io.cloudapis.http.spi.HttpTimeoutException;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link HttpClientAdapter} backed by Apache HttpClient 5, for applications that already tune a
 * pooled {@link CloseableHttpClient}.
 *
 * <p>Content-Type is carried on the entity and Content-Length is left to HttpClient; every other
 * header is copied as is.
 */
public final class ApacheHttpClientAdapter implements HttpClientAdapter {

    private final CloseableHttpClient client;

    private ApacheHttpClientAdapter(CloseableHttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public static ApacheHttpClientAdapter create() {
        return new ApacheHttpClientAdapter(HttpClients.createSystem());
    }

    public static ApacheHttpClientAdapter create(CloseableHttpClient client) {
        return new ApacheHttpClientAdapter(client);
    }

    @Override
    public HttpClientResponse send(HttpClientRequest request) throws HttpClientException {
        try {
            return client.execute(convert(request), ApacheHttpClientAdapter::readFully);
        } catch (SocketTimeoutException e) {
            throw new HttpTimeoutException("No response from " + request.uri() + " within " + request.timeout(), e);
        } catch (IOException e) {
            throw new HttpClientException("Could not call " + request.uri() + ": " + e.getMessage(), e);
        }
    }

    private static HttpUriRequestBase convert(HttpClientRequest request) {
        HttpUriRequestBase out = new HttpUriRequestBase(request.method(), request.uri());
        String contentType = null;
        for (var header : request.headers().entrySet()) {
            String name = header.getKey();
            if (HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(name)) {
                contentType = header.getValue();
            } else if (!HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
                out.setHeader(name, header.getValue());
            }
        }
        if (request.hasBody()) {
            out.setEntity(new ByteArrayEntity(request.body(),
                    contentType == null ? ContentType.APPLICATION_OCTET_STREAM : ContentType.parse(contentType)));
        } else if (contentType != null) {
            out.setHeader(HttpHeaders.CONTENT_TYPE, contentType);
        }
        if (request.timeout() != null) {
            Timeout timeout = Timeout.ofMilliseconds(request.timeout().toMillis());
            out.setConfig(RequestConfig.custom()
                    .setConnectionRequestTimeout(timeout)
                    .setResponseTimeout(timeout)
                    .build());
        }
        return out;
    }

    private static HttpClientResponse readFully(ClassicHttpResponse response) throws IOException {
        HttpEntity entity = response.getEntity();
        byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
        return new BufferedResponse(response.getCode(), response.getHeaders(), body);
    }

    private static final class BufferedResponse implements HttpClientResponse {
        private final int status;
        private final Header[] headers;
        private final byte[] body;

        BufferedResponse(int status, Header[] headers, byte[] body) {
            this.status = status;
            this.headers = headers;
            this.body = body;
        }

        @Override
        public int statusCode() {
            return status;
        }

        @Override
        public Optional<String> header(String name) {
            for (Header header : headers) {
                if (header.getName().equalsIgnoreCase(name)) {
                    return Optional.ofNullable(header.getValue());
                }
            }
            return Optional.empty();
        }

        @Override
        public byte[] body() {
            return body;
        }
    }
}
