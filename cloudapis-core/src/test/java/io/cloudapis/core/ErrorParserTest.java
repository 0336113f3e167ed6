package io.cloudapis.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorParserTest {

    @Test
    void queryErrorHeaderWinsOverBody() {
        Response response = StubResponses.of(400,
                Map.of("x-amzn-query-error", "AWS.SimpleQueueService.NonExistentQueue;Sender"),
                "{\"__type\":\"com.amazonaws.sqs#QueueDoesNotExist\",\"message\":\"gone\"}");

        AwsError error = ErrorParser.parse(response);

        assertThat(error.code()).isEqualTo("AWS.SimpleQueueService.NonExistentQueue");
        assertThat(error.type()).isEqualTo("Sender");
        assertThat(error.message()).isEqualTo("gone");
    }

    @Test
    void errorTypeHeaderDropsEverythingAfterColon() {
        Response response = StubResponses.of(502,
                Map.of("x-amzn-ErrorType", "KMSDisabledException:http://internal.amazon.com/coral/com.amazonaws.awslambda/"),
                "{\"Type\":\"User\",\"Message\":\"key disabled\"}");

        AwsError error = ErrorParser.parse(response);

        assertThat(error.code()).isEqualTo("KMSDisabledException");
        assertThat(error.type()).isEqualTo("User");
        assertThat(error.message()).isEqualTo("key disabled");
    }

    @Test
    void typeDiscriminatorKeepsPartAfterLastHash() {
        Response response = StubResponses.of(400, "{\"__type\":\"com.amazon.coral#v2#InvalidRequestException\"}");

        assertThat(ErrorParser.parse(response).code()).isEqualTo("InvalidRequestException");
    }

    @Test
    void codeFieldUsedWhenNoDiscriminator() {
        Response response = StubResponses.of(400, "{\"Code\":\"Throttling\",\"Message\":\"slow down\",\"detail\":\"d\"}");

        AwsError error = ErrorParser.parse(response);

        assertThat(error.code()).isEqualTo("Throttling");
        assertThat(error.detail()).isEqualTo("d");
    }

    @Test
    void bodyTypeIsLastResortForCode() {
        Response response = StubResponses.of(502, "{\"Type\":\"KMSDisabledException\",\"Message\":\"x\"}");

        AwsError error = ErrorParser.parse(response);

        assertThat(error.code()).isEqualTo("KMSDisabledException");
        assertThat(error.type()).isEqualTo("KMSDisabledException");
    }

    @Test
    void nonJsonBodyYieldsNoFields() {
        Response response = StubResponses.of(503, "<html>Service Unavailable</html>");

        AwsError error = ErrorParser.parse(response);

        assertThat(error.code()).isNull();
        assertThat(error.message()).isNull();
        assertThat(error.body()).isNull();
    }

    @Test
    void emptyBodyYieldsNoFields() {
        assertThat(ErrorParser.parse(StubResponses.of(500, "")).code()).isNull();
    }
}
