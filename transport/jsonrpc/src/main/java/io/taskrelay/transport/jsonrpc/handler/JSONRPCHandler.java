package io.taskrelay.transport.jsonrpc.handler;

import static io.taskrelay.server.util.async.AsyncUtils.createTubeConfig;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.server.PublicAgentCard;
import io.taskrelay.server.requesthandlers.RequestHandler;
import io.taskrelay.server.util.async.Internal;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.CancelTaskRequest;
import io.taskrelay.spec.CancelTaskResponse;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.GetTaskRequest;
import io.taskrelay.spec.GetTaskResponse;
import io.taskrelay.spec.InternalError;
import io.taskrelay.spec.InvalidRequestError;
import io.taskrelay.spec.JSONRPCRequest;
import io.taskrelay.spec.SendMessageRequest;
import io.taskrelay.spec.SendMessageResponse;
import io.taskrelay.spec.SendStreamingMessageRequest;
import io.taskrelay.spec.SendStreamingMessageResponse;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskResubscriptionRequest;
import mutiny.zero.ZeroPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 binding of a {@link RequestHandler}.
 *
 * <p>Each method takes a typed request, calls the request handler and wraps the outcome in the
 * matching response carrying the request id. Nothing escapes as an exception:
 * <ul>
 *   <li>an {@link A2AError} becomes the response's {@code error} with its own code;</li>
 *   <li>any other throwable becomes an {@link InternalError}.</li>
 * </ul>
 *
 * <h2>Streaming</h2>
 * <p>{@code message/stream} and {@code tasks/resubscribe} return a {@link Flow.Publisher} of
 * responses, one per event. A failure of the underlying stream is delivered as the last item,
 * an error response, followed by completion; subscribers never see {@code onError}. Both methods
 * answer with {@link InvalidRequestError} when the agent card does not advertise streaming.
 *
 * @see JSONRPCDispatcher
 */
@ApplicationScoped
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    // Fields set by constructor injection cannot be final: CDI proxies need the no-args constructor
    private AgentCard agentCard;
    private RequestHandler requestHandler;
    private Executor executor;

    @SuppressWarnings("NullAway")
    protected JSONRPCHandler() {
        // For CDI proxy creation
        this.agentCard = null;
        this.requestHandler = null;
        this.executor = null;
    }

    /**
     * Creates a handler.
     *
     * @param agentCard the published agent card, consulted for the streaming capability
     * @param requestHandler the handler that performs the operations
     * @param executor the executor streams are relayed on
     */
    @Inject
    public JSONRPCHandler(@PublicAgentCard AgentCard agentCard, RequestHandler requestHandler,
                          @Internal Executor executor) {
        this.agentCard = agentCard;
        this.requestHandler = requestHandler;
        this.executor = executor;
    }

    public SendMessageResponse onMessageSend(SendMessageRequest request) {
        try {
            EventKind taskOrMessage = requestHandler.onMessageSend(request.getParams());
            return new SendMessageResponse(request.getId(), taskOrMessage);
        } catch (A2AError e) {
            return new SendMessageResponse(request.getId(), e);
        } catch (Throwable t) {
            return new SendMessageResponse(request.getId(), internalError(request.getMethod(), t));
        }
    }

    public Flow.Publisher<SendStreamingMessageResponse> onMessageSendStream(SendStreamingMessageRequest request) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(
                    new SendStreamingMessageResponse(
                            request.getId(),
                            new InvalidRequestError("Streaming is not supported by the agent")));
        }

        try {
            Flow.Publisher<StreamingEventKind> publisher = requestHandler.onMessageSendStream(request.getParams());
            return convertToSendStreamingMessageResponse(request, publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), e));
        } catch (Throwable t) {
            return ZeroPublisher.fromItems(
                    new SendStreamingMessageResponse(request.getId(), internalError(request.getMethod(), t)));
        }
    }

    public CancelTaskResponse onCancelTask(CancelTaskRequest request) {
        try {
            Task task = requestHandler.onCancelTask(request.getParams());
            return new CancelTaskResponse(request.getId(), task);
        } catch (A2AError e) {
            return new CancelTaskResponse(request.getId(), e);
        } catch (Throwable t) {
            return new CancelTaskResponse(request.getId(), internalError(request.getMethod(), t));
        }
    }

    public Flow.Publisher<SendStreamingMessageResponse> onResubscribeToTask(TaskResubscriptionRequest request) {
        if (!agentCard.capabilities().streaming()) {
            return ZeroPublisher.fromItems(
                    new SendStreamingMessageResponse(
                            request.getId(),
                            new InvalidRequestError("Streaming is not supported by the agent")));
        }

        try {
            Flow.Publisher<StreamingEventKind> publisher = requestHandler.onResubscribeToTask(request.getParams());
            return convertToSendStreamingMessageResponse(request, publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), e));
        } catch (Throwable t) {
            return ZeroPublisher.fromItems(
                    new SendStreamingMessageResponse(request.getId(), internalError(request.getMethod(), t)));
        }
    }

    public GetTaskResponse onGetTask(GetTaskRequest request) {
        try {
            Task task = requestHandler.onGetTask(request.getParams());
            return new GetTaskResponse(request.getId(), task);
        } catch (A2AError e) {
            return new GetTaskResponse(request.getId(), e);
        } catch (Throwable t) {
            return new GetTaskResponse(request.getId(), internalError(request.getMethod(), t));
        }
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    private static InternalError internalError(String method, Throwable t) {
        LOGGER.error("Unexpected failure handling {}", method, t);
        return new InternalError(t.getMessage());
    }

    private Flow.Publisher<SendStreamingMessageResponse> convertToSendStreamingMessageResponse(
            JSONRPCRequest<?> request,
            Flow.Publisher<StreamingEventKind> publisher) {
        Object requestId = request.getId();
        // Failures are sent as an error response item rather than through Subscriber.onError()
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            CompletableFuture.runAsync(() -> {
                publisher.subscribe(new Flow.Subscriber<StreamingEventKind>() {
                    @SuppressWarnings("NullAway")
                    Flow.Subscription subscription;

                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        this.subscription = subscription;
                        tube.whenCancelled(subscription::cancel);
                        subscription.request(1);
                    }

                    @Override
                    public void onNext(StreamingEventKind item) {
                        tube.send(new SendStreamingMessageResponse(requestId, item));
                        subscription.request(1);
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        if (throwable instanceof A2AError error) {
                            tube.send(new SendStreamingMessageResponse(requestId, error));
                        } else {
                            tube.send(new SendStreamingMessageResponse(
                                    requestId, internalError(request.getMethod(), throwable)));
                        }
                        onComplete();
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                });
            }, executor);
        });
    }
}
