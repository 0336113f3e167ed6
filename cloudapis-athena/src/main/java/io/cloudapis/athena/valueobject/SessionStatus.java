package io.cloudapis.athena.valueobject;

import io.cloudapis.athena.enums.SessionState;
import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;

import java.time.Instant;

/**
 * Contains information about the status of a session.
 */
public final class SessionStatus {

    private final Instant startDateTime;
    private final Instant lastModifiedDateTime;
    private final Instant endDateTime;
    private final Instant idleSinceDateTime;
    private final String state;
    private final String stateChangeReason;

    private SessionStatus(JsonNode data) {
        this.startDateTime = JsonFields.timestamp(data, "StartDateTime");
        this.lastModifiedDateTime = JsonFields.timestamp(data, "LastModifiedDateTime");
        this.endDateTime = JsonFields.timestamp(data, "EndDateTime");
        this.idleSinceDateTime = JsonFields.timestamp(data, "IdleSinceDateTime");
        this.state = JsonFields.string(data, "State");
        this.stateChangeReason = JsonFields.string(data, "StateChangeReason");
    }

    public static SessionStatus hydrate(JsonNode data) {
        return new SessionStatus(data);
    }

    public Instant getStartDateTime() {
        return startDateTime;
    }

    public Instant getLastModifiedDateTime() {
        return lastModifiedDateTime;
    }

    public Instant getEndDateTime() {
        return endDateTime;
    }

    /**
     * Null unless the session is currently idle.
     */
    public Instant getIdleSinceDateTime() {
        return idleSinceDateTime;
    }

    /**
     * A {@link SessionState} value, not checked. Use {@link SessionState#exists(String)} to test it.
     */
    public String getState() {
        return state;
    }

    /** For example, canceled because the session was terminated. */
    public String getStateChangeReason() {
        return stateChangeReason;
    }
}
