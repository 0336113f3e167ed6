package io.cloudapis.sqs.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;

/**
 * Input of the {@code GetQueueUrl} operation.
 */
public final class GetQueueUrlRequest extends Input {

    private String queueName;
    private String queueOwnerAwsAccountId;

    public GetQueueUrlRequest() {}

    private GetQueueUrlRequest(Builder builder) {
        super(builder.region);
        this.queueName = builder.queueName;
        this.queueOwnerAwsAccountId = builder.queueOwnerAwsAccountId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .queueName(queueName)
                .queueOwnerAwsAccountId(queueOwnerAwsAccountId)
                .region(getRegion());
    }

    /** Required. */
    public String getQueueName() {
        return queueName;
    }

    public GetQueueUrlRequest setQueueName(String queueName) {
        this.queueName = queueName;
        return this;
    }

    /** Account that created the queue, when it is not the caller's. */
    public String getQueueOwnerAwsAccountId() {
        return queueOwnerAwsAccountId;
    }

    public GetQueueUrlRequest setQueueOwnerAwsAccountId(String queueOwnerAwsAccountId) {
        this.queueOwnerAwsAccountId = queueOwnerAwsAccountId;
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("QueueName", Validate.required(queueName, "QueueName", GetQueueUrlRequest.class));
        if (queueOwnerAwsAccountId != null) {
            payload.put("QueueOwnerAWSAccountId", queueOwnerAwsAccountId);
        }
        return SqsRpc.request("GetQueueUrl")
                .body(encode(json, payload))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String queueName;
        private String queueOwnerAwsAccountId;
        private String region;

        private Builder() {}

        public Builder queueName(String queueName) {
            this.queueName = queueName;
            return this;
        }

        public Builder queueOwnerAwsAccountId(String queueOwnerAwsAccountId) {
            this.queueOwnerAwsAccountId = queueOwnerAwsAccountId;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public GetQueueUrlRequest build() {
            return new GetQueueUrlRequest(this);
        }
    }
}
