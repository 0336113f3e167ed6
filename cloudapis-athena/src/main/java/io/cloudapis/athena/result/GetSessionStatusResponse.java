package io.cloudapis.athena.result;

import io.cloudapis.athena.valueobject.SessionStatus;
import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

public final class GetSessionStatusResponse {

    private final String sessionId;
    private final SessionStatus status;

    private GetSessionStatusResponse(String sessionId, SessionStatus status) {
        this.sessionId = sessionId;
        this.status = status;
    }

    public static GetSessionStatusResponse hydrate(JsonNode data) {
        return new GetSessionStatusResponse(
                JsonFields.string(data, "SessionId"),
                JsonFields.object(data, "Status", SessionStatus::hydrate));
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionStatus getStatus() {
        return status;
    }
}
