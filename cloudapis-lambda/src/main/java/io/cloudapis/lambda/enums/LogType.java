package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

public enum LogType implements WireEnum {
    NONE("None"),
    TAIL("Tail");

    private final String value;

    LogType(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(LogType.class, value);
    }
}
