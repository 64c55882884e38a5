package io.taskrelay.server.agentexecution;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import io.taskrelay.util.Assert;

/**
 * A finite, ordered sequence of {@link TaskDelta}s produced by a streaming agent call.
 * <p>
 * The request handler pulls deltas one at a time, so a producer never runs further ahead than
 * the consumer allows. {@link #hasNext()} may block until the producer has something to offer.
 * {@link #close()} tells the producer that no more deltas will be read; it is called when the
 * call ends and when the task is canceled, possibly from a different thread than the reader.
 */
public interface AgentStream extends AutoCloseable {

    /**
     * @return true if another delta is available, blocking until this is known
     * @throws RuntimeException if the producer failed
     */
    boolean hasNext();

    /**
     * @return the next delta
     * @throws NoSuchElementException if the stream has no more deltas
     */
    TaskDelta next();

    @Override
    void close();

    static AgentStream of(TaskDelta... deltas) {
        return fromIterator(Arrays.asList(deltas).iterator());
    }

    static AgentStream fromIterator(Iterator<TaskDelta> deltas) {
        Assert.checkNotNullParam("deltas", deltas);
        return new AgentStream() {
            private volatile boolean closed;

            @Override
            public boolean hasNext() {
                return !closed && deltas.hasNext();
            }

            @Override
            public TaskDelta next() {
                if (closed) {
                    throw new NoSuchElementException("Stream is closed");
                }
                return deltas.next();
            }

            @Override
            public void close() {
                closed = true;
            }
        };
    }
}
