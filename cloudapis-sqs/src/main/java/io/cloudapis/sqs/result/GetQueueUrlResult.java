package io.cloudapis.sqs.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

public final class GetQueueUrlResult {

    private final String queueUrl;

    private GetQueueUrlResult(String queueUrl) {
        this.queueUrl = queueUrl;
    }

    public static GetQueueUrlResult hydrate(JsonNode data) {
        return new GetQueueUrlResult(JsonFields.string(data, "QueueUrl"));
    }

    public String getQueueUrl() {
        return queueUrl;
    }
}
