package io.taskrelay.server.agentexecution;

import io.taskrelay.A2A;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.Task;
import io.taskrelay.util.Assert;

/**
 * Everything an {@link AgentExecutor} is told about the call it is serving.
 * <p>
 * {@link #getTask()} is the task as resolved for this call: for a new task it is in
 * {@code submitted} state, for a continuation it is already {@code working} with the new
 * input appended to its history.
 */
public class RequestContext {

    private final MessageSendParams params;
    private final Task task;
    private final boolean newTask;

    public RequestContext(MessageSendParams params, Task task, boolean newTask) {
        this.params = Assert.checkNotNullParam("params", params);
        this.task = Assert.checkNotNullParam("task", task);
        this.newTask = newTask;
    }

    public MessageSendParams getParams() {
        return params;
    }

    public Message getMessage() {
        return params.message();
    }

    public String getTaskId() {
        return task.id();
    }

    public String getContextId() {
        return task.contextId();
    }

    public Task getTask() {
        return task;
    }

    /**
     * @return true if this call created the task, false if it continues an existing one
     */
    public boolean isNewTask() {
        return newTask;
    }

    /**
     * @return the text parts of the incoming message, joined by newlines
     */
    public String getUserInput() {
        return getUserInput("\n");
    }

    public String getUserInput(String delimiter) {
        return A2A.getTextContent(params.message(), delimiter);
    }
}
