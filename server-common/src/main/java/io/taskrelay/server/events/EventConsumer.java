package io.taskrelay.server.events;

import static io.taskrelay.server.util.async.AsyncUtils.createTubeConfig;

import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.Event;
import io.taskrelay.spec.InternalError;
import io.taskrelay.spec.StreamingEventKind;
import io.taskrelay.util.Assert;
import mutiny.zero.Tube;
import mutiny.zero.ZeroPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes an {@link EventQueue} as a {@link Flow.Publisher}.
 * <p>
 * Events are only taken from the queue while the subscriber has outstanding demand, so a
 * subscriber that stops requesting eventually blocks the producer. The publisher completes when
 * the queue is closed and drained, and fails with the {@link A2AError} put there by
 * {@link EventQueue#fail(A2AError)}. Cancelling the subscription closes the queue, which detaches
 * this consumer without affecting the task.
 */
public class EventConsumer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventConsumer.class);

    private static final int QUEUE_WAIT_MILLISECONDS = 500;

    private final EventQueue queue;
    private final Executor executor;

    public EventConsumer(EventQueue queue, Executor executor) {
        this.queue = Assert.checkNotNullParam("queue", queue);
        this.executor = Assert.checkNotNullParam("executor", executor);
    }

    public Flow.Publisher<StreamingEventKind> consumeAll() {
        return ZeroPublisher.create(createTubeConfig(), tube -> {
            Semaphore demandSignal = new Semaphore(0);
            tube.whenRequested(n -> demandSignal.release());
            tube.whenCancelled(() -> {
                LOGGER.debug("Subscriber cancelled, detaching from {}", queue);
                queue.close(true);
                demandSignal.release();
            });
            try {
                executor.execute(() -> pump(tube, demandSignal));
            } catch (RejectedExecutionException e) {
                LOGGER.error("Could not start event consumer for {}", queue, e);
                queue.close(true);
                tube.fail(new InternalError("Server is too busy to stream events"));
            }
        });
    }

    private void pump(Tube<StreamingEventKind> tube, Semaphore demandSignal) {
        try {
            while (!tube.cancelled()) {
                if (tube.outstandingRequests() <= 0) {
                    demandSignal.tryAcquire(QUEUE_WAIT_MILLISECONDS, TimeUnit.MILLISECONDS);
                    continue;
                }
                Event event = queue.dequeueEvent(QUEUE_WAIT_MILLISECONDS);
                if (event == null) {
                    continue;
                }
                if (event instanceof A2AError error) {
                    LOGGER.debug("Terminating stream with error {}", error.toString());
                    tube.fail(error);
                    return;
                }
                if (event instanceof StreamingEventKind streamingEvent) {
                    tube.send(streamingEvent);
                } else {
                    LOGGER.warn("Dropping event {} that cannot be streamed", event);
                }
            }
        } catch (EventQueueClosedException e) {
            tube.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.close(true);
            tube.fail(new InternalError("Interrupted while streaming events"));
        }
    }
}
