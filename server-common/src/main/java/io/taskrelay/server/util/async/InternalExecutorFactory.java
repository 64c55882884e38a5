package io.taskrelay.server.util.async;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.taskrelay.server.config.A2AConfigProvider;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the bounded thread pool that agent streams and event consumers run on.
 * <p>
 * Pool sizes come from the {@code a2a.executor.*} properties. Every streaming call holds two
 * workers for its whole duration, the agent driver and the event pump, so the pool starts new
 * threads up to the maximum size before it queues work. Only when all threads are busy is work
 * queued, and when the queue is full too it is rejected rather than run on the caller's thread.
 */
@ApplicationScoped
public class InternalExecutorFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(InternalExecutorFactory.class);

    public static final String CORE_POOL_SIZE = "a2a.executor.core-pool-size";
    public static final String MAX_POOL_SIZE = "a2a.executor.max-pool-size";
    public static final String KEEP_ALIVE_SECONDS = "a2a.executor.keep-alive-seconds";
    public static final String QUEUE_CAPACITY = "a2a.executor.queue-capacity";

    private A2AConfigProvider configProvider;
    private @Nullable ThreadPoolExecutor executor;

    @SuppressWarnings("NullAway")
    protected InternalExecutorFactory() {
        // For CDI
    }

    @Inject
    public InternalExecutorFactory(A2AConfigProvider configProvider) {
        this.configProvider = configProvider;
    }

    @Produces
    @Internal
    public synchronized Executor getExecutor() {
        if (executor == null) {
            executor = create(configProvider);
        }
        return executor;
    }

    @PreDestroy
    public synchronized void close() {
        if (executor != null) {
            LOGGER.debug("Shutting down internal executor");
            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    LOGGER.warn("Internal executor did not terminate in time, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            executor = null;
        }
    }

    /**
     * Creates a new pool from configuration. The caller owns it and must shut it down.
     */
    public static ThreadPoolExecutor create(A2AConfigProvider configProvider) {
        int corePoolSize = intValue(configProvider, CORE_POOL_SIZE);
        int maxPoolSize = intValue(configProvider, MAX_POOL_SIZE);
        long keepAliveSeconds = Long.parseLong(configProvider.getValue(KEEP_ALIVE_SECONDS).trim());
        int queueCapacity = intValue(configProvider, QUEUE_CAPACITY);
        if (maxPoolSize < corePoolSize) {
            throw new IllegalArgumentException(MAX_POOL_SIZE + " must not be smaller than " + CORE_POOL_SIZE);
        }
        LOGGER.debug("Creating internal executor: core={}, max={}, keepAlive={}s, queue={}",
                corePoolSize, maxPoolSize, keepAliveSeconds, queueCapacity);
        GrowFirstQueue queue = new GrowFirstQueue(queueCapacity);
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                corePoolSize,
                maxPoolSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                new TaskThreadFactory(),
                new QueueWhenSaturated());
        queue.pool = pool;
        return pool;
    }

    private static int intValue(A2AConfigProvider configProvider, String name) {
        String value = configProvider.getValue(name).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    /**
     * Refuses work while the pool may still add threads, which makes {@link ThreadPoolExecutor}
     * start a new thread instead of queueing. Idle threads above the core size time out.
     */
    private static class GrowFirstQueue extends LinkedBlockingQueue<Runnable> {

        private volatile @Nullable ThreadPoolExecutor pool;

        GrowFirstQueue(int capacity) {
            super(capacity);
        }

        @Override
        public boolean offer(Runnable task) {
            ThreadPoolExecutor executor = pool;
            if (executor != null && executor.getPoolSize() < executor.getMaximumPoolSize()) {
                return false;
            }
            return super.offer(task);
        }

        boolean enqueue(Runnable task) {
            return super.offer(task);
        }
    }

    /**
     * Queues work the pool could not start a thread for, rejecting it once the queue is full.
     */
    private static class QueueWhenSaturated implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            if (executor.isShutdown() || !((GrowFirstQueue) executor.getQueue()).enqueue(task)) {
                throw new RejectedExecutionException("Internal executor is saturated: " + executor);
            }
        }
    }

    private static class TaskThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "a2a-agent-executor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
