package io.taskrelay.server.agentexecution;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import io.taskrelay.A2A;
import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.TaskState;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Producer side of an {@link AgentStream}, for agents that do their work on their own thread.
 * <p>
 * Deltas go through a bounded buffer: when the reader falls behind, {@link #emit(TaskDelta)}
 * blocks. Once the reader closes the stream, for example because the task was canceled,
 * every emit returns {@code false} and {@link #isCancelled()} becomes true so the agent can stop.
 *
 * <pre>{@code
 * public AgentStream streamMessage(RequestContext context) {
 *     AgentEmitter emitter = new AgentEmitter();
 *     workers.execute(() -> {
 *         emitter.startWork();
 *         emitter.addArtifact(List.of(new TextPart("partial")), false, false);
 *         emitter.complete();
 *     });
 *     return emitter.stream();
 * }
 * }</pre>
 */
public class AgentEmitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentEmitter.class);

    public static final int DEFAULT_CAPACITY = 64;
    private static final long OFFER_POLL_MILLIS = 100;

    private static final Object END = new Object();

    private final BlockingQueue<Object> buffer;
    private final Stream stream = new Stream();
    private volatile boolean cancelled;
    private volatile boolean ended;

    public AgentEmitter() {
        this(DEFAULT_CAPACITY);
    }

    public AgentEmitter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return the reading side, the same instance on every call
     */
    public AgentStream stream() {
        return stream;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Offers a delta to the reader, waiting while the buffer is full.
     *
     * @return false if the stream was closed or already ended and the delta was dropped
     */
    public boolean emit(TaskDelta delta) {
        Assert.checkNotNullParam("delta", delta);
        if (ended) {
            LOGGER.warn("Delta {} emitted after the stream ended, ignoring", delta.state());
            return false;
        }
        return put(delta);
    }

    public boolean startWork() {
        return emit(TaskDelta.working());
    }

    public boolean startWork(Message message) {
        return emit(TaskDelta.working(message));
    }

    public boolean addArtifact(List<Part<?>> parts, boolean append, boolean lastChunk) {
        return addArtifact(UUID.randomUUID().toString(), parts, append, lastChunk);
    }

    public boolean addArtifact(String artifactId, List<Part<?>> parts, boolean append, boolean lastChunk) {
        Artifact artifact = Artifact.builder()
                .artifactId(artifactId)
                .parts(parts)
                .build();
        return emit(TaskDelta.artifact(TaskState.WORKING, artifact, append, lastChunk));
    }

    public boolean requiresInput(String question) {
        return requiresInput(A2A.toAgentMessage(question));
    }

    public boolean requiresInput(Message question) {
        boolean accepted = emit(TaskDelta.inputRequired(question));
        end();
        return accepted;
    }

    public boolean complete() {
        return finish(TaskDelta.completed());
    }

    public boolean complete(Message message) {
        return finish(TaskDelta.completed(message));
    }

    /**
     * Reports that the agent gave up on the task. The task moves to {@code failed}.
     */
    public boolean fail(Message message) {
        return finish(TaskDelta.failed(message));
    }

    /**
     * Reports a producer crash. The reader sees it as an {@link AgentExecutionException}.
     */
    public void error(Throwable cause) {
        if (ended) {
            return;
        }
        ended = true;
        put(new Failure(cause));
    }

    /**
     * Signals that no more deltas follow. Safe to call more than once.
     */
    public void end() {
        if (ended) {
            return;
        }
        ended = true;
        put(END);
    }

    private boolean finish(TaskDelta delta) {
        boolean accepted = emit(delta);
        end();
        return accepted;
    }

    private boolean put(Object item) {
        try {
            while (!cancelled) {
                if (buffer.offer(item, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private record Failure(Throwable cause) {
    }

    private class Stream implements AgentStream {

        private @Nullable Object next;
        private boolean finished;

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            Object item;
            try {
                do {
                    item = buffer.poll(OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS);
                } while (item == null && !cancelled);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                finished = true;
                return false;
            }
            if (item == null || item == END) {
                finished = true;
                return false;
            }
            if (item instanceof Failure failure) {
                finished = true;
                throw new AgentExecutionException("Agent failed: " + failure.cause().getMessage(), failure.cause());
            }
            next = item;
            return true;
        }

        @Override
        public TaskDelta next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TaskDelta delta = (TaskDelta) next;
            next = null;
            return delta;
        }

        @Override
        public void close() {
            cancelled = true;
            buffer.clear();
        }
    }
}
