package io.cloudapis.sqs.input;

import io.cloudapis.core.Request;
import io.cloudapis.core.exception.CloudApiException;
import io.cloudapis.json.jackson.JacksonJsonCodec;
import io.cloudapis.sqs.enums.QueueAttributeName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreateQueueRequestTest {

    private final JacksonJsonCodec json = new JacksonJsonCodec();

    @Test
    void unsetMapsAreOmitted() {
        Request request = new CreateQueueRequest().setQueueName("orders.fifo").request(json);

        assertThat(request.bodyAsString()).isEqualTo("{\"QueueName\":\"orders.fifo\"}");
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/");
        assertThat(request.headers())
                .containsEntry("Content-Type", "application/x-amz-json-1.0")
                .containsEntry("X-Amz-Target", "AmazonSQS.CreateQueue")
                .containsEntry("Accept", "application/json");
    }

    @Test
    void emptyAttributesAreSentAsEmptyObject() {
        Request request = new CreateQueueRequest()
                .setQueueName("orders.fifo")
                .setAttributes(Map.of())
                .request(json);

        assertThat(request.bodyAsString()).isEqualTo("{\"QueueName\":\"orders.fifo\",\"Attributes\":{}}");
    }

    @Test
    void emptyTagsAreSentAsEmptyObject() {
        Request request = new CreateQueueRequest()
                .setQueueName("orders.fifo")
                .setTags(Map.of())
                .request(json);

        assertThat(request.bodyAsString()).isEqualTo("{\"QueueName\":\"orders.fifo\",\"tags\":{}}");
    }

    @Test
    void attributesAndTagsAreSerialized() {
        CreateQueueRequest input = CreateQueueRequest.builder()
                .queueName("orders.fifo")
                .attribute(QueueAttributeName.FIFO_QUEUE, "true")
                .attribute(QueueAttributeName.VISIBILITY_TIMEOUT, "60")
                .tag("team", "billing")
                .build();

        assertThat(input.request(json).bodyAsString()).isEqualTo(
                "{\"QueueName\":\"orders.fifo\",\"Attributes\":{\"FifoQueue\":\"true\",\"VisibilityTimeout\":\"60\"},"
                        + "\"tags\":{\"team\":\"billing\"}}");
        assertThat(input.getTags()).containsEntry("team", "billing");
    }

    @Test
    void getterOfUnsetMapIsEmpty() {
        CreateQueueRequest input = new CreateQueueRequest();

        assertThat(input.getAttributes()).isEmpty();
        assertThat(input.getTags()).isEmpty();
    }

    @Test
    void missingQueueNameFailsOnlyAtSerialization() {
        CreateQueueRequest input = CreateQueueRequest.builder().tag("a", "b").build();

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.MissingRequiredField.class, e -> {
                    assertThat(e.field()).isEqualTo("QueueName");
                    assertThat(e.owner()).isEqualTo(CreateQueueRequest.class.getName());
                });
    }

    @Test
    void unknownAttributeNameIsRejected() {
        CreateQueueRequest input = new CreateQueueRequest()
                .setQueueName("q")
                .setAttributes(Map.of("FifoQueueue", "true"));

        assertThatThrownBy(() -> input.request(json))
                .isInstanceOfSatisfying(CloudApiException.InvalidEnumValue.class, e -> {
                    assertThat(e.value()).isEqualTo("FifoQueueue");
                    assertThat(e.enumType()).isEqualTo("QueueAttributeName");
                });
    }

    @Test
    void toBuilderCopiesEveryField() {
        CreateQueueRequest original = CreateQueueRequest.builder()
                .queueName("q")
                .attributes(Map.of())
                .region("eu-west-1")
                .build();

        CreateQueueRequest copy = original.toBuilder().build();

        assertThat(copy.request(json)).isEqualTo(original.request(json));
        assertThat(copy.getRegion()).isEqualTo("eu-west-1");
    }
}
