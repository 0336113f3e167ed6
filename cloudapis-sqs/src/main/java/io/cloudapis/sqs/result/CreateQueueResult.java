package io.cloudapis.sqs.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

/**
 * Returns the {@code QueueUrl} attribute of the created queue.
 */
public final class CreateQueueResult {

    private final String queueUrl;

    private CreateQueueResult(String queueUrl) {
        this.queueUrl = queueUrl;
    }

    public static CreateQueueResult hydrate(JsonNode data) {
        return new CreateQueueResult(JsonFields.string(data, "QueueUrl"));
    }

    public String getQueueUrl() {
        return queueUrl;
    }
}
