package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

public enum LastUpdateStatus implements WireEnum {
    FAILED("Failed"),
    IN_PROGRESS("InProgress"),
    SUCCESSFUL("Successful");

    private final String value;

    LastUpdateStatus(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(LastUpdateStatus.class, value);
    }
}
