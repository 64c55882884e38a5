package io.taskrelay.server.tasks;

import static io.taskrelay.util.Assert.checkNotNullParam;

import java.util.UUID;

import io.taskrelay.server.agentexecution.TaskDelta;
import io.taskrelay.spec.InvalidParamsError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.UpstreamUnavailableError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the working copy of one task for the duration of a single call.
 * <p>
 * The working copy starts out either freshly created or loaded from the store and resumed with
 * the caller's input. It is not written to the store until the first transition is applied, so a
 * call that ends with a direct message reply leaves no trace. Every later transition is persisted
 * before it is returned; store failures surface as {@link UpstreamUnavailableError}.
 * <p>
 * Instances are not thread-safe. The request handler uses one per call, under the task's lease.
 */
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore taskStore;
    private final TaskLifecycle lifecycle;
    private final boolean newTask;
    private Task task;
    private boolean persisted;

    TaskManager(Task task, boolean newTask, boolean persisted, TaskStore taskStore, TaskLifecycle lifecycle) {
        this.task = checkNotNullParam("task", task);
        this.newTask = newTask;
        this.persisted = persisted;
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.lifecycle = checkNotNullParam("lifecycle", lifecycle);
    }

    /**
     * Resolves the task an incoming message addresses.
     * <p>
     * An id that is not in the store creates a new task, taking the message's {@code contextId}
     * or generating one. A known id is continued, provided the message does not name a different
     * context.
     *
     * @param taskId the task id, either from the message or generated by the caller
     * @param message the incoming message
     * @throws InvalidParamsError if the message's context does not match the stored task
     * @throws io.taskrelay.spec.InvalidStateTransitionError if the stored task is final
     * @throws UpstreamUnavailableError if the store cannot be read
     */
    public static TaskManager forMessage(String taskId, Message message, TaskStore taskStore, TaskLifecycle lifecycle) {
        Task existing = load(taskStore, taskId);
        if (existing == null) {
            String contextId = message.contextId() != null ? message.contextId() : UUID.randomUUID().toString();
            LOGGER.debug("Creating task {} in context {}", taskId, contextId);
            return new TaskManager(lifecycle.create(taskId, contextId, message), true, false, taskStore, lifecycle);
        }
        if (message.contextId() != null && !message.contextId().equals(existing.contextId())) {
            throw new InvalidParamsError(String.format("Message context %s does not match context %s of task %s",
                    message.contextId(), existing.contextId(), taskId));
        }
        LOGGER.debug("Continuing task {} from state {}", taskId, existing.status().state().asString());
        return new TaskManager(lifecycle.resume(existing, message), false, false, taskStore, lifecycle);
    }

    /**
     * Wraps a task that is already stored, without changing it.
     */
    public static TaskManager forStoredTask(Task task, TaskStore taskStore, TaskLifecycle lifecycle) {
        return new TaskManager(task, false, true, taskStore, lifecycle);
    }

    /**
     * Reads a task, translating store failures.
     *
     * @throws UpstreamUnavailableError if the store cannot be read
     */
    public static @Nullable Task load(TaskStore taskStore, String taskId) {
        try {
            return taskStore.get(taskId);
        } catch (TaskStoreException e) {
            LOGGER.error("Failed to load task {}", taskId, e);
            throw new UpstreamUnavailableError("Task store unavailable while loading task " + taskId, e);
        }
    }

    public Task getTask() {
        return task;
    }

    public String getTaskId() {
        return task.id();
    }

    public String getContextId() {
        return task.contextId();
    }

    public boolean isNewTask() {
        return newTask;
    }

    public boolean isPersisted() {
        return persisted;
    }

    /**
     * Applies an agent delta and persists the result.
     */
    public Task process(TaskDelta delta) {
        return saveTask(lifecycle.apply(task, delta));
    }

    public Task cancel() {
        return saveTask(lifecycle.cancel(task));
    }

    public Task fail(String reason) {
        return saveTask(lifecycle.fail(task, reason));
    }

    /**
     * Persists the working copy if no transition has done so yet.
     */
    public Task ensureSaved() {
        return persisted ? task : saveTask(task);
    }

    private Task saveTask(Task updated) {
        try {
            taskStore.save(updated);
        } catch (TaskStoreException e) {
            LOGGER.error("Failed to persist task {} in state {}", updated.id(), updated.status().state().asString(), e);
            throw new UpstreamUnavailableError("Task store unavailable while saving task " + updated.id(), e);
        }
        task = updated;
        persisted = true;
        return updated;
    }
}
