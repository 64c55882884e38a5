package io.taskrelay.server.requesthandlers;

import java.util.concurrent.Flow;

import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskQueryParams;

/**
 * The transport-independent operations of an agent server.
 */
public interface RequestHandler {

    Task onGetTask(TaskQueryParams params) throws A2AError;

    Task onCancelTask(TaskIdParams params) throws A2AError;

    EventKind onMessageSend(MessageSendParams params) throws A2AError;

    Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params) throws A2AError;

    Flow.Publisher<StreamingEventKind> onResubscribeToTask(TaskIdParams params) throws A2AError;
}
