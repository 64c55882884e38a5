package io.taskrelay.transport.jsonrpc.handler;

import java.util.concurrent.Flow;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.CancelTaskRequest;
import io.taskrelay.spec.GetTaskRequest;
import io.taskrelay.spec.InvalidParamsError;
import io.taskrelay.spec.InvalidRequestError;
import io.taskrelay.spec.JSONParseError;
import io.taskrelay.spec.JSONRPCErrorResponse;
import io.taskrelay.spec.JSONRPCMessage;
import io.taskrelay.spec.JSONRPCResponse;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.MethodNotFoundError;
import io.taskrelay.spec.SendMessageRequest;
import io.taskrelay.spec.SendStreamingMessageRequest;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.spec.TaskResubscriptionRequest;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes raw JSON-RPC request bodies to {@link JSONRPCHandler}.
 * <p>
 * Requests that cannot be routed are answered with a {@link JSONRPCErrorResponse}:
 * <ul>
 *   <li>a body that is not JSON gives {@link JSONParseError} with a null id;</li>
 *   <li>a body that is not a JSON-RPC 2.0 request object gives {@link InvalidRequestError};</li>
 *   <li>an unknown method gives {@link MethodNotFoundError};</li>
 *   <li>params missing or not matching the method give {@link InvalidParamsError}.</li>
 * </ul>
 * The request id is echoed whenever it could be read.
 */
@ApplicationScoped
public class JSONRPCDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCDispatcher.class);

    private JSONRPCHandler handler;

    @SuppressWarnings("NullAway")
    protected JSONRPCDispatcher() {
        // For CDI proxy creation
        this.handler = null;
    }

    @Inject
    public JSONRPCDispatcher(JSONRPCHandler handler) {
        this.handler = handler;
    }

    /**
     * The outcome of dispatching one request body.
     */
    public sealed interface Dispatch permits Single, Streaming {
    }

    /**
     * A single response, to be written as the reply body.
     */
    public record Single(JSONRPCResponse<?> response) implements Dispatch {
    }

    /**
     * A stream of responses, to be written one event at a time.
     */
    public record Streaming(Flow.Publisher<? extends JSONRPCResponse<?>> responses) implements Dispatch {
    }

    /**
     * Returns whether the method answers with a stream of responses.
     *
     * @param method the JSON-RPC method name
     * @return true for {@code message/stream} and {@code tasks/resubscribe}
     */
    public static boolean isStreamingMethod(@Nullable String method) {
        return SendStreamingMessageRequest.METHOD.equals(method) || TaskResubscriptionRequest.METHOD.equals(method);
    }

    public Dispatch dispatch(String body) {
        JsonNode node;
        try {
            node = Utils.OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Rejecting unparseable request: {}", e.getOriginalMessage());
            return new Single(new JSONRPCErrorResponse(new JSONParseError()));
        }
        if (node == null || !node.isObject()) {
            return new Single(new JSONRPCErrorResponse(new InvalidRequestError("Request must be a JSON object")));
        }

        JsonNode idNode = node.get("id");
        Object id;
        if (idNode == null || idNode.isNull()) {
            id = null;
        } else if (idNode.isTextual()) {
            id = idNode.asText();
        } else if (idNode.isNumber()) {
            id = idNode.numberValue();
        } else {
            return new Single(new JSONRPCErrorResponse(new InvalidRequestError("Id must be a string, a number or null")));
        }

        JsonNode version = node.get("jsonrpc");
        if (version == null || !JSONRPCMessage.JSONRPC_VERSION.equals(version.asText())) {
            return new Single(new JSONRPCErrorResponse(id, new InvalidRequestError("Only JSON-RPC 2.0 is supported")));
        }
        JsonNode methodNode = node.get("method");
        if (methodNode == null || !methodNode.isTextual()) {
            return new Single(new JSONRPCErrorResponse(id, new InvalidRequestError("Method must be a string")));
        }
        String method = methodNode.asText();
        LOGGER.debug("Dispatching {} (id {})", method, id);

        try {
            JsonNode params = node.get("params");
            return switch (method) {
                case SendMessageRequest.METHOD -> new Single(handler.onMessageSend(
                        new SendMessageRequest(id, readParams(params, MessageSendParams.class))));
                case SendStreamingMessageRequest.METHOD -> new Streaming(handler.onMessageSendStream(
                        new SendStreamingMessageRequest(id, readParams(params, MessageSendParams.class))));
                case CancelTaskRequest.METHOD -> new Single(handler.onCancelTask(
                        new CancelTaskRequest(id, readParams(params, TaskIdParams.class))));
                case TaskResubscriptionRequest.METHOD -> new Streaming(handler.onResubscribeToTask(
                        new TaskResubscriptionRequest(id, readParams(params, TaskIdParams.class))));
                case GetTaskRequest.METHOD -> new Single(handler.onGetTask(
                        new GetTaskRequest(id, readParams(params, TaskQueryParams.class))));
                default -> new Single(new JSONRPCErrorResponse(id, new MethodNotFoundError("Method not found: " + method)));
            };
        } catch (A2AError e) {
            return new Single(new JSONRPCErrorResponse(id, e));
        }
    }

    private static <T> T readParams(@Nullable JsonNode params, Class<T> type) {
        if (params == null || !params.isObject()) {
            throw new InvalidParamsError("Params must be a JSON object");
        }
        try {
            T value = Utils.OBJECT_MAPPER.treeToValue(params, type);
            if (value == null) {
                throw new InvalidParamsError();
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.debug("Invalid params for {}: {}", type.getSimpleName(), e.getMessage());
            throw new InvalidParamsError();
        }
    }
}
