package io.cloudapis.core.exception;

import io.cloudapis.core.AwsError;
import io.cloudapis.core.ErrorParser;
import io.cloudapis.core.Response;
import io.cloudapis.core.StubResponses;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpExceptionTest {

    @Test
    void forStatusPicksFamily() {
        assertThat(forStatus(500)).isExactlyInstanceOf(ServerException.class);
        assertThat(forStatus(599)).isExactlyInstanceOf(ServerException.class);
        assertThat(forStatus(400)).isExactlyInstanceOf(ClientException.class);
        assertThat(forStatus(429)).isExactlyInstanceOf(ClientException.class);
        assertThat(forStatus(307)).isExactlyInstanceOf(RedirectionException.class);
    }

    @Test
    void carriesDiagnosticFields() {
        Response response = StubResponses.of(400,
                Map.of("x-amzn-RequestId", "abc-123", "x-amzn-query-error", "InvalidAddress;Sender"),
                "{\"message\":\"bad address\",\"detail\":\"host\"}");

        HttpException e = HttpException.forStatus(response, ErrorParser.parse(response));

        assertThat(e.getStatusCode()).isEqualTo(400);
        assertThat(e.getUri()).isEqualTo(StubResponses.ENDPOINT);
        assertThat(e.getRequestId()).isEqualTo("abc-123");
        assertThat(e.getAwsCode()).isEqualTo("InvalidAddress");
        assertThat(e.getAwsType()).isEqualTo("Sender");
        assertThat(e.getAwsMessage()).isEqualTo("bad address");
        assertThat(e.getAwsDetail()).isEqualTo("host");
        assertThat(e).isInstanceOf(CloudApiException.class)
                .hasMessageStartingWith("HTTP 400 returned for \"" + StubResponses.ENDPOINT + "\".")
                .hasMessageContaining("Message: bad address");
    }

    @Test
    void missingFieldsStayNull() {
        HttpException e = forStatus(500);

        assertThat(e.getAwsCode()).isNull();
        assertThat(e.getAwsMessage()).isNull();
        assertThat(e.getRequestId()).isNull();
    }

    private static HttpException forStatus(int status) {
        return HttpException.forStatus(StubResponses.of(status, ""), AwsError.empty());
    }
}
