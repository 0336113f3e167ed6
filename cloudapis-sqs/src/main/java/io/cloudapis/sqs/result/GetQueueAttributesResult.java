package io.cloudapis.sqs.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;
import io.cloudapis.sqs.enums.QueueAttributeName;

import java.util.Map;

/**
 * A map of attributes to their respective values. Keys are {@link QueueAttributeName} values but
 * are not checked, so attributes added to the service later still come through.
 */
public final class GetQueueAttributesResult {

    private final Map<String, String> attributes;

    private GetQueueAttributesResult(Map<String, String> attributes) {
        this.attributes = attributes;
    }

    public static GetQueueAttributesResult hydrate(JsonNode data) {
        return new GetQueueAttributesResult(JsonFields.stringMap(data, "Attributes"));
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(QueueAttributeName name) {
        return attributes.get(name.value());
    }
}
