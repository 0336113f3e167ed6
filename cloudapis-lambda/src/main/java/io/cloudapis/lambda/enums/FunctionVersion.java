package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

/**
 * Set to {@code ALL} to list every published version of each function.
 */
public enum FunctionVersion implements WireEnum {
    ALL("ALL");

    private final String value;

    FunctionVersion(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(FunctionVersion.class, value);
    }
}
