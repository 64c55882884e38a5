package io.taskrelay.server.config;

import java.time.Duration;

import io.taskrelay.server.requesthandlers.TaskBusyPolicy;
import io.taskrelay.util.Assert;

/**
 * Typed view of the request handler settings.
 *
 * @param queueSize capacity of each per-call event channel ({@code a2a.stream.queue-size})
 * @param busyPolicy what a call does when its task is already being worked on ({@code a2a.task.busy-policy})
 * @param busyWait how long a queued call waits for the task ({@code a2a.task.busy-wait-millis})
 * @param cancelWait how long a cancel waits for the running call to stop ({@code a2a.task.cancel-wait-millis})
 */
public record A2AServerConfig(int queueSize, TaskBusyPolicy busyPolicy, Duration busyWait, Duration cancelWait) {

    public static final String QUEUE_SIZE = "a2a.stream.queue-size";
    public static final String BUSY_POLICY = "a2a.task.busy-policy";
    public static final String BUSY_WAIT_MILLIS = "a2a.task.busy-wait-millis";
    public static final String CANCEL_WAIT_MILLIS = "a2a.task.cancel-wait-millis";

    public A2AServerConfig {
        if (queueSize <= 0) {
            throw new IllegalArgumentException(QUEUE_SIZE + " must be positive");
        }
        Assert.checkNotNullParam("busyPolicy", busyPolicy);
        Assert.checkNotNullParam("busyWait", busyWait);
        Assert.checkNotNullParam("cancelWait", cancelWait);
    }

    public static A2AServerConfig from(A2AConfigProvider provider) {
        return new A2AServerConfig(
                intValue(provider, QUEUE_SIZE),
                TaskBusyPolicy.fromString(provider.getValue(BUSY_POLICY)),
                Duration.ofMillis(longValue(provider, BUSY_WAIT_MILLIS)),
                Duration.ofMillis(longValue(provider, CANCEL_WAIT_MILLIS)));
    }

    public static A2AServerConfig defaults() {
        return from(new DefaultValuesConfigProvider());
    }

    public A2AServerConfig withBusyPolicy(TaskBusyPolicy policy) {
        return new A2AServerConfig(queueSize, policy, busyWait, cancelWait);
    }

    static int intValue(A2AConfigProvider provider, String name) {
        String value = provider.getValue(name).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }

    static long longValue(A2AConfigProvider provider, String name) {
        String value = provider.getValue(name).trim();
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + name + ": " + value, e);
        }
    }
}
