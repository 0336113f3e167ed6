package io.cloudapis.sqs.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;
import io.cloudapis.sqs.enums.QueueAttributeName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Input of the {@code CreateQueue} operation.
 *
 * <p>{@code Attributes} and {@code tags} distinguish "unset" from "set to an empty map": an unset
 * map is left out of the body, an empty one is sent as {@code {}}.
 */
public final class CreateQueueRequest extends Input {

    /**
     * Name of the new queue: up to 80 alphanumeric characters, hyphens and underscores. A FIFO
     * queue name must end with {@code .fifo}. Case-sensitive.
     *
     * <p>Required.
     */
    private String queueName;

    /**
     * Queue attributes keyed by {@link QueueAttributeName} value, e.g. {@code DelaySeconds},
     * {@code FifoQueue}, {@code RedrivePolicy}. Keys are validated when the request is built.
     */
    private Map<String, String> attributes;

    /**
     * Cost allocation tags. Case-sensitive; a tag with an existing key overwrites it.
     */
    private Map<String, String> tags;

    public CreateQueueRequest() {}

    private CreateQueueRequest(Builder builder) {
        super(builder.region);
        this.queueName = builder.queueName;
        this.attributes = copy(builder.attributes);
        this.tags = copy(builder.tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder().queueName(queueName).region(getRegion());
        builder.attributes = copy(attributes);
        builder.tags = copy(tags);
        return builder;
    }

    public String getQueueName() {
        return queueName;
    }

    public CreateQueueRequest setQueueName(String queueName) {
        this.queueName = queueName;
        return this;
    }

    /**
     * @return the attributes, or an empty map when unset
     */
    public Map<String, String> getAttributes() {
        return attributes == null ? Map.of() : Collections.unmodifiableMap(attributes);
    }

    /**
     * @param attributes the attributes; {@code null} unsets the field, an empty map sends {@code {}}
     */
    public CreateQueueRequest setAttributes(Map<String, String> attributes) {
        this.attributes = copy(attributes);
        return this;
    }

    /**
     * @return the tags, or an empty map when unset
     */
    public Map<String, String> getTags() {
        return tags == null ? Map.of() : Collections.unmodifiableMap(tags);
    }

    public CreateQueueRequest setTags(Map<String, String> tags) {
        this.tags = copy(tags);
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        return SqsRpc.request("CreateQueue")
                .body(encode(json, requestBody(json)))
                .region(getRegion())
                .build();
    }

    private ObjectNode requestBody(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("QueueName", Validate.required(queueName, "QueueName", CreateQueueRequest.class));
        if (attributes != null) {
            ObjectNode node = payload.putObject("Attributes");
            for (Map.Entry<String, String> entry : attributes.entrySet()) {
                Validate.member(entry.getKey(), QueueAttributeName.class, "Attributes", CreateQueueRequest.class);
                node.put(entry.getKey(), entry.getValue());
            }
        }
        if (tags != null) {
            ObjectNode node = payload.putObject("tags");
            tags.forEach(node::put);
        }
        return payload;
    }

    private static Map<String, String> copy(Map<String, String> source) {
        return source == null ? null : new LinkedHashMap<>(source);
    }

    public static final class Builder {
        private String queueName;
        private Map<String, String> attributes;
        private Map<String, String> tags;
        private String region;

        private Builder() {}

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = copy(attributes);
            return this;
        }

        public Builder attribute(QueueAttributeName name, String value) {
            if (attributes == null) attributes = new LinkedHashMap<>();
            attributes.put(name.value(), value);
            return this;
        }

        public Builder tags(Map<String, String> tags) {
            this.tags = copy(tags);
            return this;
        }

        public Builder tag(String key, String value) {
            if (tags == null) tags = new LinkedHashMap<>();
            tags.put(key, value);
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public CreateQueueRequest build() {
            return new CreateQueueRequest(this);
        }
    }
}
