package io.cloudapis.athena.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;

public final class GetSessionStatusRequest extends Input {

    private String sessionId;

    public GetSessionStatusRequest() {}

    private GetSessionStatusRequest(Builder builder) {
        super(builder.region);
        this.sessionId = builder.sessionId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().sessionId(sessionId).region(getRegion());
    }

    /** Required. */
    public String getSessionId() {
        return sessionId;
    }

    public GetSessionStatusRequest setSessionId(String sessionId) {
        this.sessionId = sessionId;
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("SessionId", Validate.required(sessionId, "SessionId", GetSessionStatusRequest.class));
        return AthenaRpc.request("GetSessionStatus")
                .body(encode(json, payload))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String sessionId;
        private String region;

        private Builder() {}

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public GetSessionStatusRequest build() {
            return new GetSessionStatusRequest(this);
        }
    }
}
