package io.taskrelay.server.requesthandlers;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import io.taskrelay.spec.TaskBusyError;
import io.taskrelay.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serializes mutating calls per task id.
 * <p>
 * Each id that is in use has a fair single-permit semaphore. The entry is removed again when the
 * last holder or waiter is gone, so the registry only ever holds ids with activity. Calls on
 * different ids never contend.
 */
public class TaskLockRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskLockRegistry.class);

    private final ConcurrentMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final TaskBusyPolicy policy;
    private final Duration waitTimeout;

    public TaskLockRegistry(TaskBusyPolicy policy, Duration waitTimeout) {
        this.policy = Assert.checkNotNullParam("policy", policy);
        this.waitTimeout = Assert.checkNotNullParam("waitTimeout", waitTimeout);
    }

    public TaskBusyPolicy getPolicy() {
        return policy;
    }

    /**
     * Acquires the lease for a task, waiting or failing according to the busy policy.
     *
     * @param taskId the task id
     * @return the lease, to be released exactly when the caller stops mutating the task
     * @throws TaskBusyError if the task is held by another call and the policy or timeout gives up
     */
    public TaskLease acquire(String taskId) {
        Assert.checkNotNullParam("taskId", taskId);
        Slot slot = slots.compute(taskId, (id, existing) -> {
            Slot s = existing != null ? existing : new Slot();
            s.users++;
            return s;
        });

        boolean acquired = false;
        try {
            if (policy == TaskBusyPolicy.REJECT) {
                acquired = slot.permit.tryAcquire();
            } else {
                acquired = slot.permit.tryAcquire(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!acquired) {
                leave(taskId);
            }
        }

        if (!acquired) {
            LOGGER.debug("Task {} is busy (policy {})", taskId, policy);
            throw new TaskBusyError("Task " + taskId + " is being processed by another request");
        }
        LOGGER.trace("Acquired lease on task {}", taskId);
        return new TaskLease(taskId, () -> release(taskId, slot));
    }

    /**
     * @return true if some call currently holds the lease for the task
     */
    public boolean isLocked(String taskId) {
        Slot slot = slots.get(taskId);
        return slot != null && slot.permit.availablePermits() == 0;
    }

    int size() {
        return slots.size();
    }

    private void release(String taskId, Slot slot) {
        slot.permit.release();
        leave(taskId);
        LOGGER.trace("Released lease on task {}", taskId);
    }

    private void leave(String taskId) {
        slots.computeIfPresent(taskId, (id, s) -> --s.users == 0 ? null : s);
    }

    private static final class Slot {
        private final Semaphore permit = new Semaphore(1, true);
        private int users;
    }
}
