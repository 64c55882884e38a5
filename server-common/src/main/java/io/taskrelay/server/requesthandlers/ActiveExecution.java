package io.taskrelay.server.requesthandlers;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import io.taskrelay.server.agentexecution.AgentStream;
import io.taskrelay.server.events.EventQueue;
import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.Event;
import io.taskrelay.spec.Task;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The call currently owning a task: its cancel flag, its agent stream and the channels its
 * events go out on.
 * <p>
 * Only the owning thread publishes. Other threads may attach channels, request cancellation and
 * wait for its outcome. Once the last event has been handed out, no channel can attach any more.
 */
final class ActiveExecution {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActiveExecution.class);

    private final String taskId;
    private final boolean streaming;
    private final List<EventQueue> channels = new CopyOnWriteArrayList<>();
    private final CompletableFuture<@Nullable Task> cancellation = new CompletableFuture<>();
    private volatile boolean cancelRequested;
    private volatile @Nullable AgentStream stream;
    private boolean closing;

    ActiveExecution(String taskId, boolean streaming) {
        this.taskId = taskId;
        this.streaming = streaming;
    }

    String getTaskId() {
        return taskId;
    }

    boolean isStreaming() {
        return streaming;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Opens a new channel that receives every event published from now on.
     *
     * @return the channel, or null if the execution has already published its last event
     */
    synchronized @Nullable EventQueue subscribe(int queueSize) {
        if (closing) {
            return null;
        }
        EventQueue queue = new EventQueue(queueSize);
        channels.add(queue);
        LOGGER.debug("Task {} now has {} subscriber(s)", taskId, channels.size());
        return queue;
    }

    void attach(AgentStream agentStream) {
        this.stream = agentStream;
        if (cancelRequested) {
            agentStream.close();
        }
    }

    /**
     * Flags the execution as canceled and closes the agent stream.
     *
     * @return completes with the canceled task once the owner applied it, or with null if the
     *         owner finished without doing so
     */
    CompletableFuture<@Nullable Task> requestCancel() {
        cancelRequested = true;
        closeStream();
        return cancellation;
    }

    void cancelApplied(Task canceled) {
        cancellation.complete(canceled);
    }

    void cancelFailed(A2AError error) {
        cancellation.completeExceptionally(error);
    }

    void publish(Event event) {
        channels.removeIf(EventQueue::isClosed);
        for (EventQueue channel : channels) {
            channel.enqueueEvent(event);
        }
    }

    /**
     * Publishes the last event of the execution.
     */
    void publishFinal(Event event) {
        synchronized (this) {
            closing = true;
        }
        publish(event);
    }

    /**
     * Ends every channel with an error instead of a final event.
     */
    void fail(A2AError error) {
        synchronized (this) {
            closing = true;
        }
        for (EventQueue channel : channels) {
            channel.fail(error);
        }
    }

    void closeStream() {
        AgentStream current = stream;
        if (current != null) {
            try {
                current.close();
            } catch (RuntimeException e) {
                LOGGER.warn("Error closing agent stream for task {}", taskId, e);
            }
        }
    }

    /**
     * Closes all channels and releases anyone waiting on a cancellation.
     */
    void finish() {
        synchronized (this) {
            closing = true;
        }
        closeStream();
        for (EventQueue channel : channels) {
            channel.close();
        }
        cancellation.complete(null);
    }
}
