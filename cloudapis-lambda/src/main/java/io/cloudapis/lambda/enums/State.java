package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

/**
 * Current state of a function.
 */
public enum State implements WireEnum {
    ACTIVE("Active"),
    FAILED("Failed"),
    INACTIVE("Inactive"),
    PENDING("Pending");

    private final String value;

    State(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(State.class, value);
    }
}
