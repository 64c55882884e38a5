package io.taskrelay.server.requesthandlers;

import java.util.Locale;

/**
 * What a call does when another call is already working on the same task.
 */
public enum TaskBusyPolicy {
    /** Wait for the task to become free, up to the configured limit. */
    QUEUE,
    /** Fail straight away with {@link io.taskrelay.spec.TaskBusyError}. */
    REJECT;

    public static TaskBusyPolicy fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown task busy policy: " + value, e);
        }
    }
}
