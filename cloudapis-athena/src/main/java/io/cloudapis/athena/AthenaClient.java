package io.cloudapis.athena;

import io.cloudapis.athena.input.GetSessionStatusRequest;
import io.cloudapis.athena.input.StartQueryExecutionRequest;
import io.cloudapis.athena.result.GetSessionStatusResponse;
import io.cloudapis.athena.result.StartQueryExecutionOutput;
import io.cloudapis.client.AbstractApi;
import io.cloudapis.client.ClientBuilder;
import io.cloudapis.client.ClientContext;
import io.cloudapis.core.ExceptionMapper;

import java.util.function.Consumer;

/**
 * Client for the query service.
 */
public final class AthenaClient extends AbstractApi {

    public AthenaClient(ClientContext context) {
        super(context);
    }

    public static ClientBuilder<AthenaClient> builder() {
        return new ClientBuilder<>(AthenaClient::new);
    }

    @Override
    protected String endpointPrefix() {
        return "athena";
    }

    @Override
    protected ExceptionMapper exceptionMapper() {
        return AthenaExceptionMapper.INSTANCE;
    }

    /**
     * Runs the SQL query statements contained in the query string. Returns as soon as the query
     * is queued; it does not wait for results.
     *
     * @throws io.cloudapis.athena.exception.InvalidRequestException if the request is rejected
     * @throws io.cloudapis.athena.exception.TooManyRequestsException if the concurrent query limit is reached
     */
    public StartQueryExecutionOutput startQueryExecution(StartQueryExecutionRequest input) {
        return StartQueryExecutionOutput.hydrate(execute("StartQueryExecution", input).toJson(true));
    }

    public StartQueryExecutionOutput startQueryExecution(Consumer<StartQueryExecutionRequest.Builder> input) {
        StartQueryExecutionRequest.Builder builder = StartQueryExecutionRequest.builder();
        input.accept(builder);
        return startQueryExecution(builder.build());
    }

    public GetSessionStatusResponse getSessionStatus(GetSessionStatusRequest input) {
        return GetSessionStatusResponse.hydrate(execute("GetSessionStatus", input).toJson(true));
    }

    public GetSessionStatusResponse getSessionStatus(Consumer<GetSessionStatusRequest.Builder> input) {
        GetSessionStatusRequest.Builder builder = GetSessionStatusRequest.builder();
        input.accept(builder);
        return getSessionStatus(builder.build());
    }
}
