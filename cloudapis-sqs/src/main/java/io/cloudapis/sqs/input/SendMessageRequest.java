package io.cloudapis.sqs.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;
import io.cloudapis.sqs.valueobject.MessageAttributeValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of the {@code SendMessage} operation.
 */
public final class SendMessageRequest extends Input {

    private String queueUrl;
    private String messageBody;
    private Integer delaySeconds;
    private Map<String, MessageAttributeValue> messageAttributes;
    private String messageDeduplicationId;
    private String messageGroupId;

    public SendMessageRequest() {}

    private SendMessageRequest(Builder builder) {
        super(builder.region);
        this.queueUrl = builder.queueUrl;
        this.messageBody = builder.messageBody;
        this.delaySeconds = builder.delaySeconds;
        this.messageAttributes = builder.messageAttributes == null ? null : new LinkedHashMap<>(builder.messageAttributes);
        this.messageDeduplicationId = builder.messageDeduplicationId;
        this.messageGroupId = builder.messageGroupId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .queueUrl(queueUrl)
                .messageBody(messageBody)
                .delaySeconds(delaySeconds)
                .messageDeduplicationId(messageDeduplicationId)
                .messageGroupId(messageGroupId)
                .region(getRegion());
        if (messageAttributes != null) builder.messageAttributes(messageAttributes);
        return builder;
    }

    public String getQueueUrl() {
        return queueUrl;
    }

    public SendMessageRequest setQueueUrl(String queueUrl) {
        this.queueUrl = queueUrl;
        return this;
    }

    public String getMessageBody() {
        return messageBody;
    }

    public SendMessageRequest setMessageBody(String messageBody) {
        this.messageBody = messageBody;
        return this;
    }

    public Integer getDelaySeconds() {
        return delaySeconds;
    }

    public SendMessageRequest setDelaySeconds(Integer delaySeconds) {
        this.delaySeconds = delaySeconds;
        return this;
    }

    public Map<String, MessageAttributeValue> getMessageAttributes() {
        return messageAttributes == null ? Map.of() : Collections.unmodifiableMap(messageAttributes);
    }

    public SendMessageRequest setMessageAttributes(Map<String, MessageAttributeValue> messageAttributes) {
        this.messageAttributes = messageAttributes == null ? null : new LinkedHashMap<>(messageAttributes);
        return this;
    }

    /** FIFO queues only. */
    public String getMessageDeduplicationId() {
        return messageDeduplicationId;
    }

    public SendMessageRequest setMessageDeduplicationId(String messageDeduplicationId) {
        this.messageDeduplicationId = messageDeduplicationId;
        return this;
    }

    /** FIFO queues only; required there by the service, not checked here. */
    public String getMessageGroupId() {
        return messageGroupId;
    }

    public SendMessageRequest setMessageGroupId(String messageGroupId) {
        this.messageGroupId = messageGroupId;
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("QueueUrl", Validate.required(queueUrl, "QueueUrl", SendMessageRequest.class));
        payload.put("MessageBody", Validate.required(messageBody, "MessageBody", SendMessageRequest.class));
        if (delaySeconds != null) {
            payload.put("DelaySeconds", delaySeconds.intValue());
        }
        if (messageAttributes != null) {
            ObjectNode attributes = payload.putObject("MessageAttributes");
            for (Map.Entry<String, MessageAttributeValue> entry : messageAttributes.entrySet()) {
                Validate.required(entry.getValue(), "MessageAttributes", SendMessageRequest.class)
                        .requestBody(attributes.putObject(entry.getKey()));
            }
        }
        if (messageDeduplicationId != null) {
            payload.put("MessageDeduplicationId", messageDeduplicationId);
        }
        if (messageGroupId != null) {
            payload.put("MessageGroupId", messageGroupId);
        }
        return SqsRpc.request("SendMessage")
                .body(encode(json, payload))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String queueUrl;
        private String messageBody;
        private Integer delaySeconds;
        private Map<String, MessageAttributeValue> messageAttributes;
        private String messageDeduplicationId;
        private String messageGroupId;
        private String region;

        private Builder() {}

        public Builder queueUrl(String queueUrl) {
            this.queueUrl = queueUrl;
            return this;
        }

        public Builder messageBody(String messageBody) {
            this.messageBody = messageBody;
            return this;
        }

        public Builder delaySeconds(Integer delaySeconds) {
            this.delaySeconds = delaySeconds;
            return this;
        }

        public Builder messageAttributes(Map<String, MessageAttributeValue> messageAttributes) {
            this.messageAttributes = messageAttributes == null ? null : new LinkedHashMap<>(messageAttributes);
            return this;
        }

        public Builder messageAttribute(String name, MessageAttributeValue value) {
            if (messageAttributes == null) messageAttributes = new LinkedHashMap<>();
            messageAttributes.put(name, value);
            return this;
        }

        public Builder messageDeduplicationId(String messageDeduplicationId) {
            this.messageDeduplicationId = messageDeduplicationId;
            return this;
        }

        public Builder messageGroupId(String messageGroupId) {
            this.messageGroupId = messageGroupId;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public SendMessageRequest build() {
            return new SendMessageRequest(this);
        }
    }
}
