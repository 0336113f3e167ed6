package io.cloudapis.lambda;

import io.cloudapis.client.AbstractApi;
import io.cloudapis.client.ClientBuilder;
import io.cloudapis.client.ClientContext;
import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.lambda.input.InvocationRequest;
import io.cloudapis.lambda.input.ListFunctionsRequest;
import io.cloudapis.lambda.result.InvocationResponse;
import io.cloudapis.lambda.result.ListFunctionsResponse;

import java.util.function.Consumer;

/**
 * Client for the serverless compute service.
 */
public final class LambdaClient extends AbstractApi {

    public LambdaClient(ClientContext context) {
        super(context);
    }

    public static ClientBuilder<LambdaClient> builder() {
        return new ClientBuilder<>(LambdaClient::new);
    }

    @Override
    protected String endpointPrefix() {
        return "lambda";
    }

    @Override
    protected ExceptionMapper exceptionMapper() {
        return LambdaExceptionMapper.INSTANCE;
    }

    /**
     * Invokes a function, synchronously or asynchronously depending on the invocation type.
     *
     * <p>A function error is not an exception: it is reported through
     * {@link InvocationResponse#getFunctionError()} with a 200 status.
     *
     * @throws io.cloudapis.lambda.exception.ResourceNotFoundException if the function does not exist
     * @throws io.cloudapis.lambda.exception.TooManyRequestsException if the function is throttled
     */
    public InvocationResponse invoke(InvocationRequest input) {
        return InvocationResponse.hydrate(execute("Invoke", input).checkStatus());
    }

    public InvocationResponse invoke(Consumer<InvocationRequest.Builder> input) {
        InvocationRequest.Builder builder = InvocationRequest.builder();
        input.accept(builder);
        return invoke(builder.build());
    }

    /**
     * Returns one page of functions, with the version-specific configuration of each.
     */
    public ListFunctionsResponse listFunctions(ListFunctionsRequest input) {
        return ListFunctionsResponse.hydrate(execute("ListFunctions", input).toJson(true));
    }

    public ListFunctionsResponse listFunctions(Consumer<ListFunctionsRequest.Builder> input) {
        ListFunctionsRequest.Builder builder = ListFunctionsRequest.builder();
        input.accept(builder);
        return listFunctions(builder.build());
    }

    public ListFunctionsResponse listFunctions() {
        return listFunctions(new ListFunctionsRequest());
    }
}
