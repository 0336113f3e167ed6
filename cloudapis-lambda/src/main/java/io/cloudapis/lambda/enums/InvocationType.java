package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

/**
 * How a function is invoked. {@code DryRun} only validates parameters and permissions.
 */
public enum InvocationType implements WireEnum {
    DRY_RUN("DryRun"),
    EVENT("Event"),
    REQUEST_RESPONSE("RequestResponse");

    private final String value;

    InvocationType(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(InvocationType.class, value);
    }
}
