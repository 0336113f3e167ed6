package io.cloudapis.lambda.input;

import io.cloudapis.core.Input;
import io.cloudapis.core.Protocol;
import io.cloudapis.core.Request;
import io.cloudapis.core.Urls;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.lambda.enums.InvocationType;
import io.cloudapis.lambda.enums.LogType;

import java.nio.charset.StandardCharsets;

/**
 * Input of the {@code Invoke} operation.
 *
 * <p>The payload is sent as the raw request body, not wrapped in a JSON document.
 */
public final class InvocationRequest extends Input {

    private String functionName;
    private String invocationType;
    private String logType;
    private String clientContext;
    private String payload;
    private String qualifier;

    public InvocationRequest() {}

    private InvocationRequest(Builder builder) {
        super(builder.region);
        this.functionName = builder.functionName;
        this.invocationType = builder.invocationType;
        this.logType = builder.logType;
        this.clientContext = builder.clientContext;
        this.payload = builder.payload;
        this.qualifier = builder.qualifier;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .functionName(functionName)
                .invocationType(invocationType)
                .logType(logType)
                .clientContext(clientContext)
                .payload(payload)
                .qualifier(qualifier)
                .region(getRegion());
    }

    /**
     * Required. The function name, version or alias, a full ARN or a partial ARN.
     */
    public String getFunctionName() {
        return functionName;
    }

    public InvocationRequest setFunctionName(String functionName) {
        this.functionName = functionName;
        return this;
    }

    /** One of {@link InvocationType}. Defaults to {@code RequestResponse} on the service side. */
    public String getInvocationType() {
        return invocationType;
    }

    public InvocationRequest setInvocationType(String invocationType) {
        this.invocationType = invocationType;
        return this;
    }

    /** One of {@link LogType}. */
    public String getLogType() {
        return logType;
    }

    public InvocationRequest setLogType(String logType) {
        this.logType = logType;
        return this;
    }

    /** Base64 encoded client context, passed through as is. */
    public String getClientContext() {
        return clientContext;
    }

    public InvocationRequest setClientContext(String clientContext) {
        this.clientContext = clientContext;
        return this;
    }

    public String getPayload() {
        return payload;
    }

    public InvocationRequest setPayload(String payload) {
        this.payload = payload;
        return this;
    }

    public String getQualifier() {
        return qualifier;
    }

    public InvocationRequest setQualifier(String qualifier) {
        this.qualifier = qualifier;
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        String name = Validate.required(functionName, "FunctionName", InvocationRequest.class);
        Request.Builder request = Request.post("/2015-03-31/functions/" + Urls.encodePathSegment(name) + "/invocations")
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        if (invocationType != null) {
            request.header("X-Amz-Invocation-Type",
                    Validate.member(invocationType, InvocationType.class, "InvocationType", InvocationRequest.class));
        }
        if (logType != null) {
            request.header("X-Amz-Log-Type", Validate.member(logType, LogType.class, "LogType", InvocationRequest.class));
        }
        request.header("X-Amz-Client-Context", clientContext);
        request.query("Qualifier", qualifier);
        return request
                .body(payload == null ? new byte[0] : payload.getBytes(StandardCharsets.UTF_8))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String functionName;
        private String invocationType;
        private String logType;
        private String clientContext;
        private String payload;
        private String qualifier;
        private String region;

        private Builder() {}

        public Builder functionName(String functionName) {
            this.functionName = functionName;
            return this;
        }

        public Builder invocationType(String invocationType) {
            this.invocationType = invocationType;
            return this;
        }

        public Builder invocationType(InvocationType invocationType) {
            this.invocationType = invocationType == null ? null : invocationType.value();
            return this;
        }

        public Builder logType(String logType) {
            this.logType = logType;
            return this;
        }

        public Builder logType(LogType logType) {
            this.logType = logType == null ? null : logType.value();
            return this;
        }

        public Builder clientContext(String clientContext) {
            this.clientContext = clientContext;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public Builder qualifier(String qualifier) {
            this.qualifier = qualifier;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public InvocationRequest build() {
            return new InvocationRequest(this);
        }
    }
}
