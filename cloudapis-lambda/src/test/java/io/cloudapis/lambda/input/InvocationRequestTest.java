package io.cloudapis.lambda.input;

import io.cloudapis.core.Request;
import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.lambda.enums.InvocationType;
import io.cloudapis.lambda.enums.LogType;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvocationRequestTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void mapsFieldsToPathHeadersQueryAndRawBody() {
        Request request = InvocationRequest.builder()
                .functionName("arn:aws:lambda:us-east-1:123:function:resize")
                .invocationType(InvocationType.EVENT)
                .logType(LogType.TAIL)
                .clientContext("eyJhIjoxfQ==")
                .qualifier("prod")
                .payload("{\"width\":200}")
                .build()
                .request(json);

        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/2015-03-31/functions/arn%3Aaws%3Alambda%3Aus-east-1%3A123%3Afunction%3Aresize/invocations");
        assertThat(request.headers())
                .containsEntry("X-Amz-Invocation-Type", "Event")
                .containsEntry("X-Amz-Log-Type", "Tail")
                .containsEntry("X-Amz-Client-Context", "eyJhIjoxfQ==")
                .doesNotContainKey("X-Amz-Target");
        assertThat(request.query()).containsEntry("Qualifier", "prod");
        assertThat(request.bodyAsString()).isEqualTo("{\"width\":200}");
        assertThat(request.uri(URI.create("https://lambda.us-east-1.amazonaws.com")).toString())
                .endsWith("/invocations?Qualifier=prod");
    }

    @Test
    void optionalHeadersAreOmitted() {
        Request request = new InvocationRequest().setFunctionName("resize").request(json);

        assertThat(request.headers()).doesNotContainKeys("X-Amz-Invocation-Type", "X-Amz-Log-Type", "X-Amz-Client-Context");
        assertThat(request.query()).isEmpty();
        assertThat(request.bodyAsString()).isEmpty();
    }

    @Test
    void functionNameIsRequired() {
        assertThatThrownBy(() -> new InvocationRequest().setPayload("{}").request(json))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class,
                        e -> assertThat(e.field()).isEqualTo("FunctionName"));
    }

    @Test
    void invocationTypeOutsideSetIsRejected() {
        InvocationRequest input = new InvocationRequest().setFunctionName("f").setInvocationType("Async");

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.InvalidEnumValue.class, e -> {
                    assertThat(e.field()).isEqualTo("InvocationType");
                    assertThat(e.value()).isEqualTo("Async");
                    assertThat(e.enumType()).isEqualTo("InvocationType");
                });
    }
}
