package io.cloudapis.sqs;

import io.cloudapis.client.AbstractApi;
import io.cloudapis.client.ClientBuilder;
import io.cloudapis.client.ClientContext;
import io.cloudapis.core.ExceptionMapper;
import io.cloudapis.sqs.input.CreateQueueRequest;
import io.cloudapis.sqs.input.GetQueueAttributesRequest;
import io.cloudapis.sqs.input.GetQueueUrlRequest;
import io.cloudapis.sqs.input.SendMessageRequest;
import io.cloudapis.sqs.result.CreateQueueResult;
import io.cloudapis.sqs.result.GetQueueAttributesResult;
import io.cloudapis.sqs.result.GetQueueUrlResult;
import io.cloudapis.sqs.result.SendMessageResult;

import java.util.function.Consumer;

/**
 * Client for the queue service.
 *
 * <pre>{@code
 * SqsClient sqs = SqsClient.builder().region("eu-west-1").build();
 * String url = sqs.createQueue(b -> b.queueName("orders.fifo")
 *         .attribute(QueueAttributeName.FIFO_QUEUE, "true")).getQueueUrl();
 * }</pre>
 */
public final class SqsClient extends AbstractApi {

    public SqsClient(ClientContext context) {
        super(context);
    }

    public static ClientBuilder<SqsClient> builder() {
        return new ClientBuilder<>(SqsClient::new);
    }

    @Override
    protected String endpointPrefix() {
        return "sqs";
    }

    @Override
    protected ExceptionMapper exceptionMapper() {
        return SqsExceptionMapper.INSTANCE;
    }

    /**
     * Creates a new standard or FIFO queue.
     *
     * @throws io.cloudapis.sqs.exception.QueueDeletedRecentlyException if the name was used less than 60 seconds ago
     * @throws io.cloudapis.sqs.exception.QueueNameExistsException if the queue exists with different attributes
     */
    public CreateQueueResult createQueue(CreateQueueRequest input) {
        return CreateQueueResult.hydrate(execute("CreateQueue", input).toJson(true));
    }

    public CreateQueueResult createQueue(Consumer<CreateQueueRequest.Builder> input) {
        CreateQueueRequest.Builder builder = CreateQueueRequest.builder();
        input.accept(builder);
        return createQueue(builder.build());
    }

    /**
     * @throws io.cloudapis.sqs.exception.QueueDoesNotExistException if no queue has that name
     */
    public GetQueueUrlResult getQueueUrl(GetQueueUrlRequest input) {
        return GetQueueUrlResult.hydrate(execute("GetQueueUrl", input).toJson(true));
    }

    public GetQueueUrlResult getQueueUrl(Consumer<GetQueueUrlRequest.Builder> input) {
        GetQueueUrlRequest.Builder builder = GetQueueUrlRequest.builder();
        input.accept(builder);
        return getQueueUrl(builder.build());
    }

    public GetQueueAttributesResult getQueueAttributes(GetQueueAttributesRequest input) {
        return GetQueueAttributesResult.hydrate(execute("GetQueueAttributes", input).toJson(true));
    }

    public GetQueueAttributesResult getQueueAttributes(Consumer<GetQueueAttributesRequest.Builder> input) {
        GetQueueAttributesRequest.Builder builder = GetQueueAttributesRequest.builder();
        input.accept(builder);
        return getQueueAttributes(builder.build());
    }

    /**
     * Delivers a message to the specified queue.
     *
     * @throws io.cloudapis.sqs.exception.InvalidMessageContentsException if the body has characters the service rejects
     */
    public SendMessageResult sendMessage(SendMessageRequest input) {
        return SendMessageResult.hydrate(execute("SendMessage", input).toJson(true));
    }

    public SendMessageResult sendMessage(Consumer<SendMessageRequest.Builder> input) {
        SendMessageRequest.Builder builder = SendMessageRequest.builder();
        input.accept(builder);
        return sendMessage(builder.build());
    }
}
