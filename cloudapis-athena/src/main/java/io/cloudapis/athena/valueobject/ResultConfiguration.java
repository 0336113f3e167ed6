package io.cloudapis.athena.valueobject;

import io.cloudapis.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Where query results are written and how they are encrypted. Settings of the workgroup override
 * these when the workgroup enforces its own configuration.
 */
public final class ResultConfiguration {

    private final String outputLocation;
    private final EncryptionConfiguration encryptionConfiguration;
    private final String expectedBucketOwner;

    private ResultConfiguration(Builder builder) {
        this.outputLocation = builder.outputLocation;
        this.encryptionConfiguration = builder.encryptionConfiguration;
        this.expectedBucketOwner = builder.expectedBucketOwner;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** An S3 location such as {@code s3://path/to/query/bucket/}. */
    public String getOutputLocation() {
        return outputLocation;
    }

    public EncryptionConfiguration getEncryptionConfiguration() {
        return encryptionConfiguration;
    }

    public String getExpectedBucketOwner() {
        return expectedBucketOwner;
    }

    public void requestBody(ObjectNode node) {
        if (outputLocation != null) {
            node.put("OutputLocation", outputLocation);
        }
        if (encryptionConfiguration != null) {
            encryptionConfiguration.requestBody(node.putObject("EncryptionConfiguration"));
        }
        if (expectedBucketOwner != null) {
            node.put("ExpectedBucketOwner", expectedBucketOwner);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ResultConfiguration)) return false;
        ResultConfiguration other = (ResultConfiguration) obj;
        return Objects.equals(outputLocation, other.outputLocation)
                && Objects.equals(encryptionConfiguration, other.encryptionConfiguration)
                && Objects.equals(expectedBucketOwner, other.expectedBucketOwner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputLocation, encryptionConfiguration, expectedBucketOwner);
    }

    public static final class Builder {
        private String outputLocation;
        private EncryptionConfiguration encryptionConfiguration;
        private String expectedBucketOwner;

        private Builder() {}

        public Builder outputLocation(String outputLocation) {
            this.outputLocation = outputLocation;
            return this;
        }

        public Builder encryptionConfiguration(EncryptionConfiguration encryptionConfiguration) {
            this.encryptionConfiguration = encryptionConfiguration;
            return this;
        }

        public Builder expectedBucketOwner(String expectedBucketOwner) {
            this.expectedBucketOwner = expectedBucketOwner;
            return this;
        }

        public ResultConfiguration build() {
            return new ResultConfiguration(this);
        }
    }
}
