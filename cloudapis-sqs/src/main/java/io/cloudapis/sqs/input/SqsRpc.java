package io.cloudapis.sqs.input;

import io.cloudapis.core.Protocol;
import io.cloudapis.core.Request;

/**
 * JSON-RPC framing shared by every SQS operation.
 */
final class SqsRpc {
    private SqsRpc() {}

    static final String TARGET_PREFIX = "AmazonSQS";

    /**
     * Starts a {@code POST /} request with the SQS content type and the {@code X-Amz-Target} for {@code operation}.
     */
    static Request.Builder request(String operation) {
        return Request.post("/")
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_AMZ_JSON_1_0)
                .header(Protocol.H_AMZ_TARGET, TARGET_PREFIX + "." + operation)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON);
    }
}
