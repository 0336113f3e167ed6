package io.cloudapis.lambda.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Protocol;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.lambda.enums.FunctionVersion;

/**
 * Input of the {@code ListFunctions} operation. Every field is optional and sent as a query parameter.
 */
public final class ListFunctionsRequest extends Input {

    private String masterRegion;
    private String functionVersion;
    private String marker;
    private Integer maxItems;

    public ListFunctionsRequest() {}

    private ListFunctionsRequest(Builder builder) {
        super(builder.region);
        this.masterRegion = builder.masterRegion;
        this.functionVersion = builder.functionVersion;
        this.marker = builder.marker;
        this.maxItems = builder.maxItems;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .masterRegion(masterRegion)
                .functionVersion(functionVersion)
                .marker(marker)
                .maxItems(maxItems)
                .region(getRegion());
    }

    /**
     * For Lambda@Edge functions, the region of the master function, or {@code ALL}.
     */
    public String getMasterRegion() {
        return masterRegion;
    }

    public ListFunctionsRequest setMasterRegion(String masterRegion) {
        this.masterRegion = masterRegion;
        return this;
    }

    public String getFunctionVersion() {
        return functionVersion;
    }

    public ListFunctionsRequest setFunctionVersion(String functionVersion) {
        this.functionVersion = functionVersion;
        return this;
    }

    /** The {@code NextMarker} of a previous page. */
    public String getMarker() {
        return marker;
    }

    public ListFunctionsRequest setMarker(String marker) {
        this.marker = marker;
        return this;
    }

    public Integer getMaxItems() {
        return maxItems;
    }

    public ListFunctionsRequest setMaxItems(Integer maxItems) {
        this.maxItems = maxItems;
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        Request.Builder request = Request.get("/2015-03-31/functions/")
                .header(Protocol.H_ACCEPT, Protocol.CT_JSON)
                .query("MasterRegion", masterRegion)
                .query("Marker", marker);
        if (functionVersion != null) {
            request.query("FunctionVersion",
                    Validate.member(functionVersion, FunctionVersion.class, "FunctionVersion", ListFunctionsRequest.class));
        }
        if (maxItems != null) {
            request.query("MaxItems", String.valueOf(maxItems));
        }
        return request.region(getRegion()).build();
    }

    public static final class Builder {
        private String masterRegion;
        private String functionVersion;
        private String marker;
        private Integer maxItems;
        private String region;

        private Builder() {}

        public Builder masterRegion(String masterRegion) {
            this.masterRegion = masterRegion;
            return this;
        }

        public Builder functionVersion(String functionVersion) {
            this.functionVersion = functionVersion;
            return this;
        }

        public Builder functionVersion(FunctionVersion functionVersion) {
            this.functionVersion = functionVersion == null ? null : functionVersion.value();
            return this;
        }

        public Builder marker(String marker) {
            this.marker = marker;
            return this;
        }

        public Builder maxItems(Integer maxItems) {
            this.maxItems = maxItems;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public ListFunctionsRequest build() {
            return new ListFunctionsRequest(this);
        }
    }
}
