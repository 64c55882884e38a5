package io.taskrelay.transport.jsonrpc.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import io.taskrelay.A2A;
import io.taskrelay.server.requesthandlers.RequestHandler;
import io.taskrelay.server.util.async.AsyncUtils;
import io.taskrelay.spec.A2AErrorCodes;
import io.taskrelay.spec.AgentCapabilities;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.CancelTaskRequest;
import io.taskrelay.spec.CancelTaskResponse;
import io.taskrelay.spec.GetTaskRequest;
import io.taskrelay.spec.GetTaskResponse;
import io.taskrelay.spec.InvalidStateTransitionError;
import io.taskrelay.spec.JSONRPCErrorResponse;
import io.taskrelay.spec.JSONRPCResponse;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.SendMessageRequest;
import io.taskrelay.spec.SendMessageResponse;
import io.taskrelay.spec.SendStreamingMessageRequest;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskBusyError;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskNotFoundError;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.spec.TaskResubscriptionRequest;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.UpstreamUnavailableError;
import io.taskrelay.util.Utils;
import mutiny.zero.ZeroPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

public class JSONRPCHandlerTest {

    private static final Task WORKING_TASK = Task.builder()
            .id("task-1")
            .contextId("ctx-1")
            .status(new TaskStatus(TaskState.WORKING))
            .build();

    private static final Task CANCELED_TASK = Task.builder(WORKING_TASK)
            .status(new TaskStatus(TaskState.CANCELED))
            .build();

    private RequestHandler requestHandler;
    private ExecutorService executor;
    private JSONRPCHandler handler;

    @BeforeEach
    public void setUp() {
        requestHandler = mock(RequestHandler.class);
        executor = Executors.newCachedThreadPool();
        handler = new JSONRPCHandler(card(true), requestHandler, executor);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    static AgentCard card(boolean streaming) {
        return AgentCard.builder()
                .name("test-agent")
                .description("Agent used by the JSON-RPC tests")
                .url("http://localhost:9999")
                .version("1.0.0")
                .capabilities(AgentCapabilities.builder().streaming(streaming).build())
                .defaultInputModes(List.of("text"))
                .defaultOutputModes(List.of("text"))
                .skills(List.of())
                .build();
    }

    private static MessageSendParams params(String text) {
        return new MessageSendParams(A2A.toUserMessage(text));
    }

    private static TaskStatusUpdateEvent status(TaskState state, boolean isFinal) {
        return new TaskStatusUpdateEvent("task-1", "ctx-1", new TaskStatus(state), isFinal);
    }

    @Test
    public void testOnMessageSendReturnsTask() throws Exception {
        when(requestHandler.onMessageSend(any())).thenReturn(WORKING_TASK);

        SendMessageResponse response = handler.onMessageSend(new SendMessageRequest("1", params("hi")));

        assertEquals("1", response.getId());
        assertSame(WORKING_TASK, response.getResult());
        assertNull(response.getError());
    }

    @Test
    public void testOnMessageSendReturnsDirectMessage() throws Exception {
        Message reply = A2A.toAgentMessage("pong");
        when(requestHandler.onMessageSend(any())).thenReturn(reply);

        SendMessageResponse response = handler.onMessageSend(new SendMessageRequest(7, params("ping")));

        assertEquals(7, response.getId());
        assertSame(reply, response.getResult());
    }

    @Test
    public void testOnMessageSendMapsProtocolError() throws Exception {
        when(requestHandler.onMessageSend(any()))
                .thenThrow(new InvalidStateTransitionError("Task task-1 is in terminal state completed"));

        SendMessageResponse response = handler.onMessageSend(new SendMessageRequest("1", params("again")));

        assertNull(response.getResult());
        assertEquals(A2AErrorCodes.INVALID_STATE_TRANSITION_ERROR_CODE, response.getError().code());
        assertEquals("Task task-1 is in terminal state completed", response.getError().message());
    }

    @Test
    public void testOnMessageSendMapsUnexpectedExceptionToInternalError() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger(JSONRPCHandler.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            when(requestHandler.onMessageSend(any())).thenThrow(new IllegalStateException("boom"));

            SendMessageResponse response = handler.onMessageSend(new SendMessageRequest("1", params("hi")));

            assertEquals(A2AErrorCodes.INTERNAL_ERROR_CODE, response.getError().code());
            assertEquals("boom", response.getError().message());
            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                    && e.getFormattedMessage().contains(SendMessageRequest.METHOD)));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    public void testOnGetTaskNotFound() throws Exception {
        when(requestHandler.onGetTask(any())).thenThrow(new TaskNotFoundError());

        GetTaskResponse response = handler.onGetTask(new GetTaskRequest("g", new TaskQueryParams("missing")));

        assertEquals(A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE, response.getError().code());
        assertInstanceOf(TaskNotFoundError.class, response.getError().toA2AError());
    }

    @Test
    public void testOnCancelTask() throws Exception {
        when(requestHandler.onCancelTask(any())).thenReturn(CANCELED_TASK);

        CancelTaskResponse response = handler.onCancelTask(new CancelTaskRequest("c", new TaskIdParams("task-1")));

        assertEquals(TaskState.CANCELED, response.getResult().status().state());
    }

    @Test
    public void testOnCancelTaskBusy() throws Exception {
        when(requestHandler.onCancelTask(any())).thenThrow(new TaskBusyError());

        CancelTaskResponse response = handler.onCancelTask(new CancelTaskRequest("c", new TaskIdParams("task-1")));

        assertEquals(A2AErrorCodes.TASK_BUSY_ERROR_CODE, response.getError().code());
    }

    @Test
    public void testStreamRelaysEvents() throws Exception {
        when(requestHandler.onMessageSendStream(any())).thenReturn(ZeroPublisher.<StreamingEventKind>fromItems(
                status(TaskState.WORKING, false), status(TaskState.COMPLETED, true)));

        ResponseRecorder recorder = ResponseRecorder.subscribe(
                handler.onMessageSendStream(new SendStreamingMessageRequest("s", params("hi"))));

        assertTrue(recorder.awaitDone());
        assertTrue(recorder.isCompleted());
        List<JSONRPCResponse<?>> items = recorder.getItems();
        assertEquals(2, items.size());
        assertEquals("s", items.get(0).getId());
        assertEquals(TaskState.WORKING, ((TaskStatusUpdateEvent) items.get(0).getResult()).status().state());
        assertTrue(((TaskStatusUpdateEvent) items.get(1).getResult()).isFinal());
    }

    @Test
    public void testStreamFailureIsDeliveredAsLastItem() throws Exception {
        Flow.Publisher<StreamingEventKind> failing = ZeroPublisher.create(AsyncUtils.createTubeConfig(), tube -> {
            tube.send(status(TaskState.WORKING, false));
            tube.fail(new UpstreamUnavailableError("store down"));
        });
        when(requestHandler.onMessageSendStream(any())).thenReturn(failing);

        ResponseRecorder recorder = ResponseRecorder.subscribe(
                handler.onMessageSendStream(new SendStreamingMessageRequest("s", params("hi"))));

        assertTrue(recorder.awaitDone());
        assertTrue(recorder.isCompleted());
        assertNull(recorder.getError());
        List<JSONRPCResponse<?>> items = recorder.getItems();
        assertEquals(2, items.size());
        assertFalse(items.get(0).isError());
        assertEquals(A2AErrorCodes.UPSTREAM_UNAVAILABLE_ERROR_CODE, items.get(1).getError().code());
    }

    @Test
    public void testStreamUnexpectedFailureBecomesInternalError() throws Exception {
        when(requestHandler.onMessageSendStream(any()))
                .thenReturn(ZeroPublisher.<StreamingEventKind>fromFailure(new IllegalStateException("lost")));

        ResponseRecorder recorder = ResponseRecorder.subscribe(
                handler.onMessageSendStream(new SendStreamingMessageRequest("s", params("hi"))));

        assertTrue(recorder.awaitDone());
        assertTrue(recorder.isCompleted());
        assertEquals(1, recorder.getItems().size());
        assertEquals(A2AErrorCodes.INTERNAL_ERROR_CODE, recorder.getItems().get(0).getError().code());
    }

    @Test
    public void testStreamRejectedBeforeStartIsSingleErrorItem() throws Exception {
        when(requestHandler.onMessageSendStream(any()))
                .thenThrow(new TaskBusyError("Task task-1 is being processed by another request"));

        ResponseRecorder recorder = ResponseRecorder.subscribe(
                handler.onMessageSendStream(new SendStreamingMessageRequest("s", params("hi"))));

        assertTrue(recorder.awaitDone());
        assertEquals(1, recorder.getItems().size());
        assertEquals(A2AErrorCodes.TASK_BUSY_ERROR_CODE, recorder.getItems().get(0).getError().code());
    }

    @Test
    public void testStreamingDisabledByAgentCard() throws Exception {
        JSONRPCHandler nonStreaming = new JSONRPCHandler(card(false), requestHandler, executor);

        ResponseRecorder send = ResponseRecorder.subscribe(
                nonStreaming.onMessageSendStream(new SendStreamingMessageRequest("s", params("hi"))));
        ResponseRecorder resubscribe = ResponseRecorder.subscribe(
                nonStreaming.onResubscribeToTask(new TaskResubscriptionRequest("r", new TaskIdParams("task-1"))));

        assertTrue(send.awaitDone());
        assertTrue(resubscribe.awaitDone());
        assertEquals(A2AErrorCodes.INVALID_REQUEST_ERROR_CODE, send.getItems().get(0).getError().code());
        assertEquals(A2AErrorCodes.INVALID_REQUEST_ERROR_CODE, resubscribe.getItems().get(0).getError().code());
        verifyNoInteractions(requestHandler);
    }

    @Test
    public void testResubscribeRelaysEvents() throws Exception {
        when(requestHandler.onResubscribeToTask(any()))
                .thenReturn(ZeroPublisher.<StreamingEventKind>fromItems(status(TaskState.COMPLETED, true)));

        ResponseRecorder recorder = ResponseRecorder.subscribe(
                handler.onResubscribeToTask(new TaskResubscriptionRequest("r", new TaskIdParams("task-1"))));

        assertTrue(recorder.awaitDone());
        assertEquals(1, recorder.getItems().size());
        assertEquals("r", recorder.getItems().get(0).getId());
    }

    @Test
    public void testResponsesSerializeToJsonRpcShape() throws Exception {
        JsonNode success = Utils.OBJECT_MAPPER.readTree(Utils.toJsonString(
                new GetTaskResponse("g", WORKING_TASK)));
        assertEquals("2.0", success.get("jsonrpc").asText());
        assertEquals("g", success.get("id").asText());
        assertEquals("task", success.get("result").get("kind").asText());
        assertFalse(success.has("error"));

        JsonNode failure = Utils.OBJECT_MAPPER.readTree(Utils.toJsonString(
                new JSONRPCErrorResponse(new TaskNotFoundError())));
        assertTrue(failure.has("id"));
        assertTrue(failure.get("id").isNull());
        assertEquals(A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE, failure.get("error").get("code").asInt());
        assertFalse(failure.has("result"));
    }
}
