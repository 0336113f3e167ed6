package io.cloudapis.lambda.enums;

import io.cloudapis.core.WireEnum;

public enum PackageType implements WireEnum {
    IMAGE("Image"),
    ZIP("Zip");

    private final String value;

    PackageType(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(PackageType.class, value);
    }
}
