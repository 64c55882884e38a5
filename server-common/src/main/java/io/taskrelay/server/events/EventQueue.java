package io.taskrelay.server.events;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.Event;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, ordered channel carrying the events of one call from the task owner to one consumer.
 * <p>
 * The producer blocks in {@link #enqueueEvent(Event)} while {@code queueSize} events are waiting,
 * which is how a slow consumer holds back an agent. A queue is closed exactly once, either
 * gracefully with {@link #close()}, so the consumer drains what is left before seeing
 * {@link EventQueueClosedException}, or with {@link #fail(A2AError)}, which delivers the error as
 * the last event.
 */
public class EventQueue implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventQueue.class);

    public static final int DEFAULT_QUEUE_SIZE = 1000;
    private static final long ENQUEUE_POLL_MILLIS = 100;

    private final int queueSize;
    private final LinkedBlockingQueue<Event> queue = new LinkedBlockingQueue<>();
    private final Semaphore semaphore;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean immediateClose;

    public EventQueue() {
        this(DEFAULT_QUEUE_SIZE);
    }

    public EventQueue(int queueSize) {
        if (queueSize <= 0) {
            throw new IllegalArgumentException("Queue size must be greater than 0");
        }
        this.queueSize = queueSize;
        this.semaphore = new Semaphore(queueSize, true);
        LOGGER.trace("Creating {} with queue size: {}", this, queueSize);
    }

    public int getQueueSize() {
        return queueSize;
    }

    /**
     * Adds an event, blocking while the queue is full. Events offered after close are dropped.
     *
     * @param event the event
     */
    public void enqueueEvent(Event event) {
        try {
            while (!semaphore.tryAcquire(ENQUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (isClosed()) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Unable to acquire the semaphore to enqueue the event", e);
        }
        if (isClosed()) {
            LOGGER.warn("Queue is closed. Event will not be enqueued. {} {}", this, event);
            return;
        }
        queue.add(event);
        LOGGER.debug("Enqueued event {} {}", event instanceof Throwable ? event.toString() : event, this);
    }

    /**
     * Takes the next event.
     *
     * @param waitMilliSeconds how long to wait for an event, 0 to return immediately
     * @return the event, or null if none arrived in time
     * @throws EventQueueClosedException if the queue is closed and has nothing left
     */
    public @Nullable Event dequeueEvent(int waitMilliSeconds) throws EventQueueClosedException {
        if (isClosed() && (queue.isEmpty() || immediateClose)) {
            LOGGER.debug("Queue is closed{}, sending termination message. {}",
                    immediateClose ? " (immediate)" : " and empty", this);
            throw new EventQueueClosedException();
        }
        Event event;
        if (waitMilliSeconds <= 0) {
            event = queue.poll();
        } else {
            try {
                event = queue.poll(waitMilliSeconds, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                LOGGER.debug("Interrupted dequeue (waiting) {}", this);
                Thread.currentThread().interrupt();
                return null;
            }
        }
        if (event != null) {
            semaphore.release();
            LOGGER.debug("Dequeued event {} {}", event instanceof Throwable ? event.toString() : event, this);
        }
        return event;
    }

    /**
     * Delivers an error as the final event and closes the queue.
     */
    public void fail(A2AError error) {
        if (isClosed()) {
            LOGGER.debug("Queue already closed, dropping error {} {}", error, this);
            return;
        }
        queue.add(error);
        close();
    }

    public int size() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        close(false);
    }

    /**
     * @param immediate if true, pending events are discarded instead of being drained
     */
    public void close(boolean immediate) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOGGER.debug("Closing {} (immediate={})", this, immediate);
        if (immediate) {
            immediateClose = true;
            int cleared = queue.size();
            queue.clear();
            semaphore.release(cleared);
        }
    }
}
