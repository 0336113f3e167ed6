package io.cloudapis.sqs.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.ArrayNode;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;
import io.cloudapis.sqs.enums.QueueAttributeName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Input of the {@code GetQueueAttributes} operation.
 *
 * <p>An unset {@code AttributeNames} is omitted; an explicitly empty list is sent as {@code []}.
 */
public final class GetQueueAttributesRequest extends Input {

    private String queueUrl;
    private List<String> attributeNames;

    public GetQueueAttributesRequest() {}

    private GetQueueAttributesRequest(Builder builder) {
        super(builder.region);
        this.queueUrl = builder.queueUrl;
        this.attributeNames = builder.attributeNames == null ? null : new ArrayList<>(builder.attributeNames);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder().queueUrl(queueUrl).region(getRegion());
        if (attributeNames != null) builder.attributeNames(attributeNames);
        return builder;
    }

    /** Required. */
    public String getQueueUrl() {
        return queueUrl;
    }

    public GetQueueAttributesRequest setQueueUrl(String queueUrl) {
        this.queueUrl = queueUrl;
        return this;
    }

    /**
     * @return {@link QueueAttributeName} values to fetch, or an empty list when unset
     */
    public List<String> getAttributeNames() {
        return attributeNames == null ? List.of() : Collections.unmodifiableList(attributeNames);
    }

    public GetQueueAttributesRequest setAttributeNames(List<String> attributeNames) {
        this.attributeNames = attributeNames == null ? null : new ArrayList<>(attributeNames);
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("QueueUrl", Validate.required(queueUrl, "QueueUrl", GetQueueAttributesRequest.class));
        if (attributeNames != null) {
            ArrayNode names = payload.putArray("AttributeNames");
            for (String name : attributeNames) {
                names.add(Validate.member(name, QueueAttributeName.class, "AttributeNames", GetQueueAttributesRequest.class));
            }
        }
        return SqsRpc.request("GetQueueAttributes")
                .body(encode(json, payload))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String queueUrl;
        private List<String> attributeNames;
        private String region;

        private Builder() {}

        public Builder queueUrl(String queueUrl) {
            this.queueUrl = queueUrl;
            return this;
        }

        public Builder attributeNames(List<String> attributeNames) {
            this.attributeNames = attributeNames == null ? null : new ArrayList<>(attributeNames);
            return this;
        }

        public Builder attributeNames(QueueAttributeName... names) {
            List<String> values = new ArrayList<>(names.length);
            for (QueueAttributeName name : names) {
                values.add(name.value());
            }
            this.attributeNames = values;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public GetQueueAttributesRequest build() {
            return new GetQueueAttributesRequest(this);
        }
    }
}
