package io.cloudapis.athena.input;

import io.cloudapis.athena.valueobject.QueryExecutionContext;
import io.cloudapis.athena.valueobject.ResultConfiguration;
import io.cloudapis.core.Input;
import io.cloudapis.core.Request;
import io.cloudapis.core.Validate;
import io.cloudapis.json.spi.ArrayNode;
import io.cloudapis.json.spi.JsonCodec;
import io.cloudapis.json.spi.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Input of the {@code StartQueryExecution} operation.
 *
 * <p>{@code ExecutionParameters} are substituted, in order, for the {@code ?} placeholders of a
 * parameterized query.
 */
public final class StartQueryExecutionRequest extends Input {

    private String queryString;
    private String clientRequestToken;
    private QueryExecutionContext queryExecutionContext;
    private ResultConfiguration resultConfiguration;
    private String workGroup;
    private List<String> executionParameters;

    public StartQueryExecutionRequest() {}

    private StartQueryExecutionRequest(Builder builder) {
        super(builder.region);
        this.queryString = builder.queryString;
        this.clientRequestToken = builder.clientRequestToken;
        this.queryExecutionContext = builder.queryExecutionContext;
        this.resultConfiguration = builder.resultConfiguration;
        this.workGroup = builder.workGroup;
        this.executionParameters = builder.executionParameters == null ? null : new ArrayList<>(builder.executionParameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .queryString(queryString)
                .clientRequestToken(clientRequestToken)
                .queryExecutionContext(queryExecutionContext)
                .resultConfiguration(resultConfiguration)
                .workGroup(workGroup)
                .executionParameters(executionParameters)
                .region(getRegion());
    }

    /** Required. The SQL statement to run. */
    public String getQueryString() {
        return queryString;
    }

    public StartQueryExecutionRequest setQueryString(String queryString) {
        this.queryString = queryString;
        return this;
    }

    /**
     * Idempotency token. Repeating a call with the same token does not start a second query.
     */
    public String getClientRequestToken() {
        return clientRequestToken;
    }

    public StartQueryExecutionRequest setClientRequestToken(String clientRequestToken) {
        this.clientRequestToken = clientRequestToken;
        return this;
    }

    public QueryExecutionContext getQueryExecutionContext() {
        return queryExecutionContext;
    }

    public StartQueryExecutionRequest setQueryExecutionContext(QueryExecutionContext queryExecutionContext) {
        this.queryExecutionContext = queryExecutionContext;
        return this;
    }

    public ResultConfiguration getResultConfiguration() {
        return resultConfiguration;
    }

    public StartQueryExecutionRequest setResultConfiguration(ResultConfiguration resultConfiguration) {
        this.resultConfiguration = resultConfiguration;
        return this;
    }

    public String getWorkGroup() {
        return workGroup;
    }

    public StartQueryExecutionRequest setWorkGroup(String workGroup) {
        this.workGroup = workGroup;
        return this;
    }

    public List<String> getExecutionParameters() {
        return executionParameters == null ? List.of() : Collections.unmodifiableList(executionParameters);
    }

    public StartQueryExecutionRequest setExecutionParameters(List<String> executionParameters) {
        this.executionParameters = executionParameters == null ? null : new ArrayList<>(executionParameters);
        return this;
    }

    @Override
    public Request request(JsonCodec json) {
        ObjectNode payload = json.createObjectNode();
        payload.put("QueryString", Validate.required(queryString, "QueryString", StartQueryExecutionRequest.class));
        if (clientRequestToken != null) {
            payload.put("ClientRequestToken", clientRequestToken);
        }
        if (queryExecutionContext != null) {
            queryExecutionContext.requestBody(payload.putObject("QueryExecutionContext"));
        }
        if (resultConfiguration != null) {
            resultConfiguration.requestBody(payload.putObject("ResultConfiguration"));
        }
        if (workGroup != null) {
            payload.put("WorkGroup", workGroup);
        }
        if (executionParameters != null) {
            ArrayNode parameters = payload.putArray("ExecutionParameters");
            executionParameters.forEach(parameters::add);
        }
        return AthenaRpc.request("StartQueryExecution")
                .body(encode(json, payload))
                .region(getRegion())
                .build();
    }

    public static final class Builder {
        private String queryString;
        private String clientRequestToken;
        private QueryExecutionContext queryExecutionContext;
        private ResultConfiguration resultConfiguration;
        private String workGroup;
        private List<String> executionParameters;
        private String region;

        private Builder() {}

        public Builder queryString(String queryString) {
            this.queryString = queryString;
            return this;
        }

        public Builder clientRequestToken(String clientRequestToken) {
            this.clientRequestToken = clientRequestToken;
            return this;
        }

        public Builder queryExecutionContext(QueryExecutionContext queryExecutionContext) {
            this.queryExecutionContext = queryExecutionContext;
            return this;
        }

        public Builder resultConfiguration(ResultConfiguration resultConfiguration) {
            this.resultConfiguration = resultConfiguration;
            return this;
        }

        public Builder workGroup(String workGroup) {
            this.workGroup = workGroup;
            return this;
        }

        public Builder executionParameters(List<String> executionParameters) {
            this.executionParameters = executionParameters == null ? null : new ArrayList<>(executionParameters);
            return this;
        }

        public Builder executionParameters(String... executionParameters) {
            this.executionParameters = new ArrayList<>(Arrays.asList(executionParameters));
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public StartQueryExecutionRequest build() {
            return new StartQueryExecutionRequest(this);
        }
    }
}
