package io.cloudapis.core;

import io.cloudapis.core.exception.ClientException;
import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.core.exception.RedirectionException;
import io.cloudapis.core.exception.ServerException;
import io.cloudapis.json.spi.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseTest {

    @Test
    void emptySuccessBodyReadsAsEmptyObject() {
        JsonNode node = StubResponses.of(200, "").toJson(true);

        assertThat(node.isObject()).isTrue();
        assertThat(node.size()).isZero();
    }

    @Test
    void invalidJsonIsMalformed() {
        Response response = StubResponses.of(200, "not json");

        assertThatThrownBy(() -> response.toJson(true))
                .isInstanceOf(CloudApiException.MalformedResponse.class);
    }

    @Test
    void errorBodyReadableWithoutThrowing() {
        JsonNode node = StubResponses.of(400, "{\"message\":\"bad\"}").toJson(false);

        assertThat(node.get("message").asText()).isEqualTo("bad");
    }

    @Test
    void knownCodeUsesServiceMapper() {
        ExceptionMapper mapper = (code, response, error) ->
                "Teapot".equals(code) ? new TeapotException(response, error) : null;
        Response response = StubResponses.of(418, Map.of(), "{\"__type\":\"ns#Teapot\"}", mapper);

        assertThatThrownBy(() -> response.toJson(true))
                .isInstanceOf(TeapotException.class)
                .hasMessageContaining("Code: Teapot");
    }

    @Test
    void unknownCodeFallsBackToStatusFamily() {
        ExceptionMapper mapper = (code, response, error) -> null;

        assertThat(StubResponses.of(404, Map.of(), "{\"code\":\"Nope\"}", mapper).toException())
                .isExactlyInstanceOf(ClientException.class);
        assertThat(StubResponses.of(503, Map.of(), "{\"code\":\"Nope\"}", mapper).toException())
                .isExactlyInstanceOf(ServerException.class);
        assertThat(StubResponses.of(301, Map.of(), "", mapper).toException())
                .isExactlyInstanceOf(RedirectionException.class);
    }

    @Test
    void checkStatusPassesSuccess() {
        Response response = StubResponses.of(204, Map.of("x-amzn-RequestId", "req-1"), "");

        assertThat(response.checkStatus()).isSameAs(response);
        assertThat(response.requestId()).contains("req-1");
    }

    private static final class TeapotException extends ClientException {
        private static final long serialVersionUID = 1L;

        TeapotException(Response response, AwsError error) {
            super(response, error);
        }
    }
}
