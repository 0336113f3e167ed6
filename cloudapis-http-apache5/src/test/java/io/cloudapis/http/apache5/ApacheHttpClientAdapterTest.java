package io.cloudapis.http.apache5;

import io.cloudapis.http.spi.HttpClientRequest;
import io.cloudapis.http.spi.HttpClientResponse;
import io.cloudapis.http.spi.HttpTimeoutException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApacheHttpClientAdapterTest {

    private MockWebServer server;
    private ApacheHttpClientAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        adapter = ApacheHttpClientAdapter.create();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void postCarriesContentTypeOnEntity() throws Exception {
        server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("X-Amz-Executed-Version", "$LATEST")
                .setBody("\"ok\""));

        HttpClientResponse response = adapter.send(HttpClientRequest.post(server.url("/2015-03-31/functions/f/invocations").uri())
                .header("Content-Type", "application/json")
                .header("X-Amz-Invocation-Type", "RequestResponse")
                .body("{}".getBytes(StandardCharsets.UTF_8))
                .build());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.header("x-amz-executed-version")).contains("$LATEST");
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("\"ok\"");

        RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");
        assertThat(recorded.getHeader("X-Amz-Invocation-Type")).isEqualTo("RequestResponse");
        assertThat(recorded.getBody().readUtf8()).isEqualTo("{}");
    }

    @Test
    void getWithoutBodyReturnsEmptyArrayOnNoContent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        HttpClientResponse response = adapter.send(HttpClientRequest.get(server.url("/").uri()).build());

        assertThat(response.statusCode()).isEqualTo(204);
        assertThat(response.body()).isEmpty();
    }

    @Test
    void slowResponseRaisesTimeout() {
        server.enqueue(new MockResponse().setBody("{}").setHeadersDelay(2, TimeUnit.SECONDS));

        HttpClientRequest request = HttpClientRequest.get(server.url("/slow").uri())
                .timeout(Duration.ofMillis(200))
                .build();

        assertThatThrownBy(() -> adapter.send(request)).isInstanceOf(HttpTimeoutException.class);
    }
}
