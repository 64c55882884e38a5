package io.taskrelay.server.requesthandlers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive right to mutate one task, handed out by {@link TaskLockRegistry}.
 * <p>
 * Releasing is idempotent and may happen on a different thread than the one that acquired the
 * lease, which is what a streaming call does when its worker finishes.
 */
public final class TaskLease implements AutoCloseable {

    private final String taskId;
    private final Runnable onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    TaskLease(String taskId, Runnable onRelease) {
        this.taskId = taskId;
        this.onRelease = onRelease;
    }

    public String getTaskId() {
        return taskId;
    }

    public boolean isReleased() {
        return released.get();
    }

    public void release() {
        if (released.compareAndSet(false, true)) {
            onRelease.run();
        }
    }

    @Override
    public void close() {
        release();
    }
}
