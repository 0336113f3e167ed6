package io.cloudapis.athena.enums;

import io.cloudapis.core.WireEnum;

public enum EncryptionOption implements WireEnum {
    CSE_KMS("CSE_KMS"),
    SSE_KMS("SSE_KMS"),
    SSE_S3("SSE_S3");

    private final String value;

    EncryptionOption(String value) {
        this.value = value;
    }

    @Override
    public String value() {
        return value;
    }

    public static boolean exists(String value) {
        return WireEnum.exists(EncryptionOption.class, value);
    }
}
