package io.cloudapis.sqs.result;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

/**
 * The {@code MD5OfMessageBody} and {@code MessageId} elements.
 */
public final class SendMessageResult {

    private final String md5OfMessageBody;
    private final String md5OfMessageAttributes;
    private final String md5OfMessageSystemAttributes;
    private final String messageId;
    private final String sequenceNumber;

    private SendMessageResult(JsonNode data) {
        this.md5OfMessageBody = JsonFields.string(data, "MD5OfMessageBody");
        this.md5OfMessageAttributes = JsonFields.string(data, "MD5OfMessageAttributes");
        this.md5OfMessageSystemAttributes = JsonFields.string(data, "MD5OfMessageSystemAttributes");
        this.messageId = JsonFields.string(data, "MessageId");
        this.sequenceNumber = JsonFields.string(data, "SequenceNumber");
    }

    public static SendMessageResult hydrate(JsonNode data) {
        return new SendMessageResult(data);
    }

    /**
     * An MD5 digest of the non-URL-encoded message body string.
     */
    public String getMd5OfMessageBody() {
        return md5OfMessageBody;
    }

    public String getMd5OfMessageAttributes() {
        return md5OfMessageAttributes;
    }

    public String getMd5OfMessageSystemAttributes() {
        return md5OfMessageSystemAttributes;
    }

    public String getMessageId() {
        return messageId;
    }

    /**
     * FIFO queues only. The large, non-consecutive number the service assigns to each message.
     */
    public String getSequenceNumber() {
        return sequenceNumber;
    }
}
