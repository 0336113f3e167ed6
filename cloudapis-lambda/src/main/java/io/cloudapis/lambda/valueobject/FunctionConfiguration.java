package io.cloudapis.lambda.valueobject;

import io.cloudapis.core.JsonFields;
import io.cloudapis.json.spi.JsonNode;
import io.cloudapis.lambda.enums.Architecture;
import io.cloudapis.lambda.enums.LastUpdateStatus;
import io.cloudapis.lambda.enums.PackageType;
import io.cloudapis.lambda.enums.State;

import java.util.List;

/**
 * Details about a function's configuration.
 *
 * <p>{@code State}, {@code LastUpdateStatus}, {@code PackageType} and {@code Architectures} hold
 * values of {@link State}, {@link LastUpdateStatus}, {@link PackageType} and {@link Architecture}
 * but are not checked against them. {@code LastModified} is kept as the service sends it
 * ({@code YYYY-MM-DDThh:mm:ss.sTZD}).
 */
public final class FunctionConfiguration {

    private final String functionName;
    private final String functionArn;
    private final String runtime;
    private final String role;
    private final String handler;
    private final Long codeSize;
    private final String description;
    private final Integer timeout;
    private final Integer memorySize;
    private final String lastModified;
    private final String codeSha256;
    private final String version;
    private final EnvironmentResponse environment;
    private final String kmsKeyArn;
    private final String masterArn;
    private final String revisionId;
    private final String state;
    private final String stateReason;
    private final String stateReasonCode;
    private final String lastUpdateStatus;
    private final String packageType;
    private final List<String> architectures;

    private FunctionConfiguration(JsonNode data) {
        this.functionName = JsonFields.string(data, "FunctionName");
        this.functionArn = JsonFields.string(data, "FunctionArn");
        this.runtime = JsonFields.string(data, "Runtime");
        this.role = JsonFields.string(data, "Role");
        this.handler = JsonFields.string(data, "Handler");
        this.codeSize = JsonFields.longValue(data, "CodeSize");
        this.description = JsonFields.string(data, "Description");
        this.timeout = JsonFields.integer(data, "Timeout");
        this.memorySize = JsonFields.integer(data, "MemorySize");
        this.lastModified = JsonFields.string(data, "LastModified");
        this.codeSha256 = JsonFields.string(data, "CodeSha256");
        this.version = JsonFields.string(data, "Version");
        this.environment = JsonFields.object(data, "Environment", EnvironmentResponse::hydrate);
        this.kmsKeyArn = JsonFields.string(data, "KMSKeyArn");
        this.masterArn = JsonFields.string(data, "MasterArn");
        this.revisionId = JsonFields.string(data, "RevisionId");
        this.state = JsonFields.string(data, "State");
        this.stateReason = JsonFields.string(data, "StateReason");
        this.stateReasonCode = JsonFields.string(data, "StateReasonCode");
        this.lastUpdateStatus = JsonFields.string(data, "LastUpdateStatus");
        this.packageType = JsonFields.string(data, "PackageType");
        this.architectures = JsonFields.stringList(data, "Architectures");
    }

    public static FunctionConfiguration hydrate(JsonNode data) {
        return new FunctionConfiguration(data);
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getFunctionArn() {
        return functionArn;
    }

    public String getRuntime() {
        return runtime;
    }

    /** The function's execution role. */
    public String getRole() {
        return role;
    }

    public String getHandler() {
        return handler;
    }

    /** Size of the deployment package in bytes. */
    public Long getCodeSize() {
        return codeSize;
    }

    public String getDescription() {
        return description;
    }

    /** Seconds the function may run before it is stopped. */
    public Integer getTimeout() {
        return timeout;
    }

    /** Memory available to the function at runtime, in MB. */
    public Integer getMemorySize() {
        return memorySize;
    }

    public String getLastModified() {
        return lastModified;
    }

    public String getCodeSha256() {
        return codeSha256;
    }

    public String getVersion() {
        return version;
    }

    public EnvironmentResponse getEnvironment() {
        return environment;
    }

    public String getKmsKeyArn() {
        return kmsKeyArn;
    }

    public String getMasterArn() {
        return masterArn;
    }

    public String getRevisionId() {
        return revisionId;
    }

    public String getState() {
        return state;
    }

    public String getStateReason() {
        return stateReason;
    }

    public String getStateReasonCode() {
        return stateReasonCode;
    }

    public String getLastUpdateStatus() {
        return lastUpdateStatus;
    }

    public String getPackageType() {
        return packageType;
    }

    public List<String> getArchitectures() {
        return architectures;
    }
}
