package io.cloudapis.athena.input;

import io.cloudapis.core.Protocol;
import io.cloudapis.core.Request;

final class AthenaRpc {
    private AthenaRpc() {}

    static final String TARGET_PREFIX = "AmazonAthena";

    static Request.Builder request(String operation) {
        return Request.post("/")
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_AMZ_JSON_1_1)
                .header(Protocol.H_AMZ_TARGET, TARGET_PREFIX + "." + operation)
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON);
    }
}
