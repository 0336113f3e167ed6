package io.cloudapis.sqs.input;

import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.sqs.valueobject.MessageAttributeValue;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SendMessageRequestTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void serializesEveryPresentField() {
        SendMessageRequest input = SendMessageRequest.builder()
                .queueUrl("https://sqs.us-east-1.amazonaws.com/123/orders.fifo")
                .messageBody("{\"id\":1}")
                .delaySeconds(0)
                .messageAttribute("kind", MessageAttributeValue.ofString("order"))
                .messageAttribute("raw", MessageAttributeValue.ofBinary("hi".getBytes(StandardCharsets.UTF_8)))
                .messageGroupId("g1")
                .messageDeduplicationId("d1")
                .build();

        assertThat(input.request(json).bodyAsString()).isEqualTo("{"
                + "\"QueueUrl\":\"https://sqs.us-east-1.amazonaws.com/123/orders.fifo\","
                + "\"MessageBody\":\"{\\\"id\\\":1}\","
                + "\"DelaySeconds\":0,"
                + "\"MessageAttributes\":{"
                + "\"kind\":{\"StringValue\":\"order\",\"DataType\":\"String\"},"
                + "\"raw\":{\"BinaryValue\":\"aGk=\",\"DataType\":\"Binary\"}},"
                + "\"MessageDeduplicationId\":\"d1\","
                + "\"MessageGroupId\":\"g1\"}");
        assertThat(input.request(json).headers()).containsEntry("X-Amz-Target", "AmazonSQS.SendMessage");
    }

    @Test
    void emptyMessageAttributesAreSentAsEmptyObject() {
        SendMessageRequest input = new SendMessageRequest()
                .setQueueUrl("u")
                .setMessageBody("b")
                .setMessageAttributes(Map.of());

        assertThat(input.request(json).bodyAsString())
                .isEqualTo("{\"QueueUrl\":\"u\",\"MessageBody\":\"b\",\"MessageAttributes\":{}}");
    }

    @Test
    void listValuesAreSerializedAsArrays() {
        MessageAttributeValue value = MessageAttributeValue.builder()
                .dataType("String.list")
                .stringListValues(List.of())
                .build();
        SendMessageRequest input = new SendMessageRequest()
                .setQueueUrl("u")
                .setMessageBody("b")
                .setMessageAttributes(Map.of("l", value));

        assertThat(input.request(json).bodyAsString())
                .contains("\"l\":{\"StringListValues\":[],\"DataType\":\"String.list\"}");
    }

    @Test
    void missingBodyIsReported() {
        SendMessageRequest input = new SendMessageRequest().setQueueUrl("u");

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class,
                        e -> assertThat(e.field()).isEqualTo("MessageBody"));
    }

    @Test
    void nullAttributeValueIsReportedAsMissing() {
        SendMessageRequest input = SendMessageRequest.builder()
                .queueUrl("u")
                .messageBody("b")
                .messageAttribute("x", null)
                .build();

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class, e -> {
                    assertThat(e.field()).isEqualTo("MessageAttributes");
                    assertThat(e.owner()).isEqualTo(SendMessageRequest.class.getName());
                });
    }

    @Test
    void missingDataTypeNamesNestedOwner() {
        SendMessageRequest input = new SendMessageRequest()
                .setQueueUrl("u")
                .setMessageBody("b")
                .setMessageAttributes(Map.of("x", MessageAttributeValue.builder().stringValue("v").build()));

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class, e -> {
                    assertThat(e.field()).isEqualTo("DataType");
                    assertThat(e.owner()).isEqualTo(MessageAttributeValue.class.getName());
                });
    }
}
