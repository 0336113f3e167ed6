package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

public enum Architecture implements WireEnum {
    ARM64("arm64"),
    X86_64("x86_64");

    private final String value;

    Architecture(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(Architecture.class, value);
    }
}
