package io.taskrelay.server.requesthandlers;

import static io.taskrelay.util.Assert.checkNotNullParam;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.taskrelay.server.agentexecution.AgentExecutor;
import io.taskrelay.server.agentexecution.AgentResult;
import io.taskrelay.server.agentexecution.AgentStream;
import io.taskrelay.server.agentexecution.RequestContext;
import io.taskrelay.server.agentexecution.TaskDelta;
import io.taskrelay.server.config.A2AConfigProvider;
import io.taskrelay.server.config.A2AServerConfig;
import io.taskrelay.server.events.EventConsumer;
import io.taskrelay.server.events.EventQueue;
import io.taskrelay.server.tasks.TaskLifecycle;
import io.taskrelay.server.tasks.TaskManager;
import io.taskrelay.server.tasks.TaskStore;
import io.taskrelay.server.util.async.Internal;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.EventKind;
import io.taskrelay.spec.InternalError;
import io.taskrelay.spec.InvalidAgentResponseError;
import io.taskrelay.spec.InvalidStateTransitionError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.MessageSendParams;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskArtifactUpdateEvent;
import io.taskrelay.spec.TaskBusyError;
import io.taskrelay.spec.TaskIdParams;
import io.taskrelay.spec.TaskNotFoundError;
import io.taskrelay.spec.TaskQueryParams;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatusUpdateEvent;
import io.taskrelay.spec.UnsupportedOperationError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link RequestHandler}: resolves the addressed task, runs the {@link AgentExecutor},
 * folds what it reports through {@link TaskLifecycle} and persists every transition before the
 * caller sees it.
 *
 * <h2>Ownership</h2>
 * A mutating call first takes the task's {@link TaskLease}, then registers itself as the task's
 * active execution for as long as the agent is working. A streaming call hands both over to a
 * worker on the internal executor, which gives them back when the stream ends. While a call owns
 * a task:
 * <ul>
 *   <li>cancel requests are routed to the owner, which applies the cancellation itself;</li>
 *   <li>resubscribe requests attach a new channel to the owner's event sequence.</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * Agent exceptions and invalid agent updates fail the task; the caller gets the failed task or a
 * final {@code failed} status update, not an error. Store failures become
 * {@link io.taskrelay.spec.UpstreamUnavailableError}, on a stream as its terminal error event.
 */
@ApplicationScoped
public class DefaultRequestHandler implements RequestHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultRequestHandler.class);

    private AgentExecutor agentExecutor;
    private TaskStore taskStore;
    private TaskLifecycle lifecycle;
    private A2AServerConfig config;
    private TaskLockRegistry taskLocks;
    private Executor executor;

    private final ConcurrentMap<String, ActiveExecution> activeExecutions = new ConcurrentHashMap<>();

    @SuppressWarnings("NullAway")
    protected DefaultRequestHandler() {
        // For CDI
    }

    @Inject
    public DefaultRequestHandler(AgentExecutor agentExecutor, TaskStore taskStore,
                                 A2AConfigProvider configProvider, @Internal Executor executor) {
        this(agentExecutor, taskStore, new TaskLifecycle(), A2AServerConfig.from(configProvider), executor);
    }

    public DefaultRequestHandler(AgentExecutor agentExecutor, TaskStore taskStore, TaskLifecycle lifecycle,
                                 A2AServerConfig config, Executor executor) {
        this.agentExecutor = checkNotNullParam("agentExecutor", agentExecutor);
        this.taskStore = checkNotNullParam("taskStore", taskStore);
        this.lifecycle = checkNotNullParam("lifecycle", lifecycle);
        this.config = checkNotNullParam("config", config);
        this.executor = checkNotNullParam("executor", executor);
        this.taskLocks = new TaskLockRegistry(config.busyPolicy(), config.busyWait());
    }

    public static DefaultRequestHandler create(AgentExecutor agentExecutor, TaskStore taskStore, Executor executor) {
        return new DefaultRequestHandler(agentExecutor, taskStore, new TaskLifecycle(), A2AServerConfig.defaults(),
                executor);
    }

    @Override
    public Task onGetTask(TaskQueryParams params) throws A2AError {
        LOGGER.debug("onGetTask {}", params.id());
        Task task = TaskManager.load(taskStore, params.id());
        if (task == null) {
            LOGGER.debug("No task found for {}. Throwing TaskNotFoundError", params.id());
            throw new TaskNotFoundError();
        }
        return limitHistory(task, params.historyLength());
    }

    @Override
    public EventKind onMessageSend(MessageSendParams params) throws A2AError {
        Message message = params.message();
        LOGGER.debug("onMessageSend - task: {}; context {}", message.taskId(), message.contextId());
        String taskId = taskIdFor(message);
        TaskLease lease = taskLocks.acquire(taskId);
        ActiveExecution execution = null;
        try {
            TaskManager taskManager = TaskManager.forMessage(taskId, message, taskStore, lifecycle);
            RequestContext context = new RequestContext(params, taskManager.getTask(), taskManager.isNewTask());
            execution = register(taskId, false);

            AgentResult result;
            try {
                result = agentExecutor.sendMessage(context);
            } catch (RuntimeException e) {
                if (execution.isCancelRequested()) {
                    return applyCancel(taskManager, execution);
                }
                LOGGER.warn("Agent executor failed on task {}", taskId, e);
                return taskManager.fail(failureReason(e));
            }

            if (execution.isCancelRequested()) {
                LOGGER.debug("Discarding agent result for canceled task {}", taskId);
                return applyCancel(taskManager, execution);
            }
            if (result instanceof AgentResult.MessageResult messageResult) {
                LOGGER.debug("Agent answered task {} with a direct message, task left unchanged", taskId);
                return messageResult.message();
            }
            return applyOrFail(taskManager, ((AgentResult.TaskResult) result).delta());
        } finally {
            if (execution != null) {
                unregister(execution);
            }
            lease.release();
        }
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params) throws A2AError {
        Message message = params.message();
        LOGGER.debug("onMessageSendStream - task: {}; context {}", message.taskId(), message.contextId());
        String taskId = taskIdFor(message);
        TaskLease lease = taskLocks.acquire(taskId);
        ActiveExecution execution = null;
        try {
            TaskManager taskManager = TaskManager.forMessage(taskId, message, taskStore, lifecycle);
            RequestContext context = new RequestContext(params, taskManager.getTask(), taskManager.isNewTask());
            execution = register(taskId, true);
            EventQueue queue = subscribe(execution);
            startExecution(taskManager, execution, () -> agentExecutor.streamMessage(context), lease);
            return new EventConsumer(queue, executor).consumeAll();
        } catch (RuntimeException e) {
            if (execution != null) {
                unregister(execution);
            }
            lease.release();
            throw e;
        }
    }

    @Override
    public Task onCancelTask(TaskIdParams params) throws A2AError {
        String taskId = params.id();
        LOGGER.debug("onCancelTask {}", taskId);
        ActiveExecution active = activeExecutions.get(taskId);
        if (active != null) {
            Task canceled = cancelThroughOwner(active);
            if (canceled != null) {
                return canceled;
            }
            LOGGER.debug("Execution of task {} ended before it could be canceled", taskId);
        }

        try (TaskLease lease = taskLocks.acquire(taskId)) {
            Task task = TaskManager.load(taskStore, taskId);
            if (task == null) {
                throw new TaskNotFoundError();
            }
            Task canceled = TaskManager.forStoredTask(task, taskStore, lifecycle).cancel();
            notifyAgentCancel(taskId);
            LOGGER.debug("Canceled task {} (lease {})", taskId, lease.getTaskId());
            return canceled;
        }
    }

    @Override
    public Flow.Publisher<StreamingEventKind> onResubscribeToTask(TaskIdParams params) throws A2AError {
        String taskId = params.id();
        LOGGER.debug("onResubscribeToTask {}", taskId);
        ActiveExecution active = activeExecutions.get(taskId);
        if (active != null && active.isStreaming()) {
            EventQueue queue = active.subscribe(config.queueSize());
            if (queue != null) {
                LOGGER.debug("Attached a new subscriber to the running execution of task {}", taskId);
                return new EventConsumer(queue, executor).consumeAll();
            }
        }

        requireResumable(TaskManager.load(taskStore, taskId), taskId);
        TaskLease lease = taskLocks.acquire(taskId);
        ActiveExecution execution = null;
        try {
            Task task = requireResumable(TaskManager.load(taskStore, taskId), taskId);
            AgentStream stream = agentExecutor.resubscribe(taskId);
            execution = register(taskId, true);
            EventQueue queue = subscribe(execution);
            startExecution(TaskManager.forStoredTask(task, taskStore, lifecycle), execution, () -> stream, lease);
            return new EventConsumer(queue, executor).consumeAll();
        } catch (RuntimeException e) {
            if (execution != null) {
                unregister(execution);
            }
            lease.release();
            throw e;
        }
    }

    /**
     * @return true if a call is currently working on the task
     */
    public boolean isExecuting(String taskId) {
        return activeExecutions.containsKey(taskId);
    }

    private Task applyOrFail(TaskManager taskManager, TaskDelta delta) {
        try {
            return taskManager.process(delta);
        } catch (InvalidStateTransitionError | InvalidAgentResponseError e) {
            LOGGER.warn("Agent reported an invalid update for task {}: {}", taskManager.getTaskId(), e.getMessage());
            return taskManager.fail("Agent reported an invalid update: " + e.getMessage());
        }
    }

    private Task applyCancel(TaskManager taskManager, ActiveExecution execution) {
        Task canceled;
        try {
            canceled = taskManager.cancel();
        } catch (A2AError e) {
            execution.cancelFailed(e);
            throw e;
        }
        execution.cancelApplied(canceled);
        return canceled;
    }

    private @Nullable Task cancelThroughOwner(ActiveExecution active) {
        String taskId = active.getTaskId();
        CompletableFuture<@Nullable Task> outcome = active.requestCancel();
        notifyAgentCancel(taskId);
        long waitMillis = config.cancelWait().toMillis();
        try {
            return outcome.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warn("Task {} did not stop within {} ms of being canceled", taskId, waitMillis);
            throw new TaskBusyError("Task " + taskId + " did not stop within " + waitMillis + " ms");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof A2AError error) {
                throw error;
            }
            LOGGER.error("Cancellation of task {} failed", taskId, e.getCause());
            throw new InternalError("Cancellation of task " + taskId + " failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalError("Interrupted while waiting for task " + taskId + " to stop");
        }
    }

    private void notifyAgentCancel(String taskId) {
        try {
            agentExecutor.cancel(taskId);
        } catch (UnsupportedOperationError e) {
            LOGGER.debug("Agent does not support cancel; task {} is canceled without interrupting it", taskId);
        } catch (RuntimeException e) {
            LOGGER.warn("Agent executor failed to cancel task {}", taskId, e);
        }
    }

    private void startExecution(TaskManager taskManager, ActiveExecution execution, Supplier<AgentStream> source,
                                TaskLease lease) {
        try {
            executor.execute(() -> runExecution(taskManager, execution, source, lease));
        } catch (RejectedExecutionException e) {
            LOGGER.error("Could not schedule execution of task {}", taskManager.getTaskId(), e);
            throw new InternalError("Server is too busy to run the agent");
        }
    }

    private void runExecution(TaskManager taskManager, ActiveExecution execution, Supplier<AgentStream> source,
                              TaskLease lease) {
        String taskId = taskManager.getTaskId();
        try {
            driveStream(taskManager, execution, source);
        } catch (A2AError e) {
            LOGGER.error("Execution of task {} aborted: {}", taskId, e.getMessage(), e);
            execution.fail(e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure while executing task {}", taskId, e);
            execution.fail(new InternalError(e.getMessage()));
        } finally {
            unregister(execution);
            lease.release();
        }
    }

    private void driveStream(TaskManager taskManager, ActiveExecution execution, Supplier<AgentStream> source) {
        String taskId = taskManager.getTaskId();
        try {
            AgentStream stream = openStream(source);
            execution.attach(stream);
            TaskDelta delta;
            while ((delta = nextDelta(stream)) != null) {
                if (execution.isCancelRequested()) {
                    LOGGER.debug("Discarding {} update for canceled task {}", delta.state().asString(), taskId);
                    break;
                }
                Task task;
                try {
                    task = taskManager.process(delta);
                } catch (InvalidStateTransitionError | InvalidAgentResponseError e) {
                    LOGGER.warn("Agent reported an invalid update for task {}: {}", taskId, e.getMessage());
                    publishFailed(taskManager, execution, "Agent reported an invalid update: " + e.getMessage());
                    return;
                }
                boolean last = endsCall(delta.state());
                StreamingEventKind event = toEvent(task, delta, last);
                if (last) {
                    execution.publishFinal(event);
                    return;
                }
                execution.publish(event);
            }
        } catch (AgentFailure failure) {
            if (!execution.isCancelRequested()) {
                LOGGER.warn("Agent executor failed on task {}", taskId, failure.getCause());
                publishFailed(taskManager, execution, failureReason(failure.getCause()));
                return;
            }
        }

        if (execution.isCancelRequested()) {
            Task canceled = applyCancel(taskManager, execution);
            execution.publishFinal(statusEvent(canceled, true));
            return;
        }
        Task task = taskManager.ensureSaved();
        LOGGER.debug("Agent stream for task {} ended in state {} without a closing update",
                taskId, task.status().state().asString());
        execution.publishFinal(statusEvent(task, true));
    }

    private void publishFailed(TaskManager taskManager, ActiveExecution execution, String reason) {
        Task failed = taskManager.fail(reason);
        execution.publishFinal(statusEvent(failed, true));
    }

    private static AgentStream openStream(Supplier<AgentStream> source) {
        try {
            return checkNotNullParam("agentStream", source.get());
        } catch (RuntimeException e) {
            throw new AgentFailure(e);
        }
    }

    private static @Nullable TaskDelta nextDelta(AgentStream stream) {
        try {
            return stream.hasNext() ? stream.next() : null;
        } catch (RuntimeException e) {
            throw new AgentFailure(e);
        }
    }

    private static boolean endsCall(TaskState state) {
        return state.isFinal() || state == TaskState.INPUT_REQUIRED;
    }

    private static StreamingEventKind toEvent(Task task, TaskDelta delta, boolean last) {
        if (delta.artifact() != null) {
            return new TaskArtifactUpdateEvent(task.id(), task.contextId(), delta.artifact(), delta.append(),
                    delta.lastChunk() || last);
        }
        return statusEvent(task, last);
    }

    private static TaskStatusUpdateEvent statusEvent(Task task, boolean isFinal) {
        return new TaskStatusUpdateEvent(task.id(), task.contextId(), task.status(), isFinal);
    }

    private ActiveExecution register(String taskId, boolean streaming) {
        ActiveExecution execution = new ActiveExecution(taskId, streaming);
        ActiveExecution previous = activeExecutions.put(taskId, execution);
        if (previous != null) {
            LOGGER.warn("Task {} already had an active execution registered", taskId);
        }
        return execution;
    }

    private void unregister(ActiveExecution execution) {
        activeExecutions.remove(execution.getTaskId(), execution);
        execution.finish();
    }

    private EventQueue subscribe(ActiveExecution execution) {
        EventQueue queue = execution.subscribe(config.queueSize());
        if (queue == null) {
            throw new IllegalStateException("Execution of task " + execution.getTaskId() + " closed before it started");
        }
        return queue;
    }

    private static Task requireResumable(@Nullable Task task, String taskId) {
        if (task == null) {
            throw new TaskNotFoundError();
        }
        if (task.status().state().isFinal()) {
            throw new InvalidStateTransitionError(String.format("Task %s is in terminal state %s",
                    taskId, task.status().state().asString()));
        }
        return task;
    }

    private static String taskIdFor(Message message) {
        return message.taskId() != null ? message.taskId() : UUID.randomUUID().toString();
    }

    private static String failureReason(Throwable t) {
        String detail = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        return "Agent execution failed: " + detail;
    }

    private static Task limitHistory(Task task, @Nullable Integer historyLength) {
        List<Message> history = task.history();
        if (historyLength == null || historyLength >= history.size()) {
            return task;
        }
        return Task.builder(task)
                .history(history.subList(history.size() - historyLength, history.size()))
                .build();
    }

    /**
     * Marks an exception thrown by agent code, as opposed to one raised by the handler itself.
     */
    private static final class AgentFailure extends RuntimeException {
        AgentFailure(Throwable cause) {
            super(cause);
        }
    }
}
