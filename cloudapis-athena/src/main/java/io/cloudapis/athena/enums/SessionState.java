package io.cloudapis.athena.enums;

import io.cloudapis.core.WireEnum;

/**
 * State of an interactive session.
 *
 * <p>{@code DEGRADED} means the session has no healthy coordinators; {@code FAILED} means it failed
 * to start or was terminated because of an error.
 */
public enum SessionState implements WireEnum {
    BUSY("BUSY"),
    CREATED("CREATED"),
    CREATING("CREATING"),
    DEGRADED("DEGRADED"),
    FAILED("FAILED"),
    IDLE("IDLE"),
    TERMINATED("TERMINATED"),
    TERMINATING("TERMINATING");

    private final String value;

    SessionState(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(SessionState.class, value);
    }
}
