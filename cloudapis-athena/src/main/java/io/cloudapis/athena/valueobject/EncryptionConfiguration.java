package io.cloudapis.athena.valueobject;

import io.cloudapis.athena.enums.EncryptionOption;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.ObjectNode;

import java.util.Objects;

/**
 * How query results are encrypted. {@code KmsKey} is needed for the KMS based options.
 */
public final class EncryptionConfiguration {

    private final String encryptionOption;
    private final String kmsKey;

    private EncryptionConfiguration(Builder builder) {
        this.encryptionOption = builder.encryptionOption;
        this.kmsKey = builder.kmsKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Required, one of {@link EncryptionOption}. */
    public String getEncryptionOption() {
        return encryptionOption;
    }

    public String getKmsKey() {
        return kmsKey;
    }

    public void requestBody(ObjectNode node) {
        String option = Validate.required(encryptionOption, "EncryptionOption", EncryptionConfiguration.class);
        node.put("EncryptionOption", Validate.member(option, EncryptionOption.class, "EncryptionOption", EncryptionConfiguration.class));
        if (kmsKey != null) {
            node.put("KmsKey", kmsKey);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EncryptionConfiguration)) return false;
        EncryptionConfiguration other = (EncryptionConfiguration) obj;
        return Objects.equals(encryptionOption, other.encryptionOption) && Objects.equals(kmsKey, other.kmsKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(encryptionOption, kmsKey);
    }

    public static final class Builder {
        private String encryptionOption;
        private String kmsKey;

        private Builder() {}

        public Builder encryptionOption(String encryptionOption) {
            this.encryptionOption = encryptionOption;
            return this;
        }

        public Builder encryptionOption(EncryptionOption encryptionOption) {
            this.encryptionOption = encryptionOption == null ? null : encryptionOption.value();
            return this;
        }

        public Builder kmsKey(String kmsKey) {
            this.kmsKey = kmsKey;
            return this;
        }

        public EncryptionConfiguration build() {
            return new EncryptionConfiguration(this);
        }
    }
}
