package io.taskrelay.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a task cannot be converted to or from its stored representation,
 * for example a corrupted or truncated task file.
 */
public class TaskSerializationException extends TaskStoreException {

    public TaskSerializationException() {
        super();
    }

    public TaskSerializationException(final String msg) {
        super(msg);
    }

    public TaskSerializationException(final Throwable cause) {
        super(cause);
    }

    public TaskSerializationException(final String msg, final Throwable cause) {
        super(msg, cause);
    }

    public TaskSerializationException(@Nullable final String taskId, final String msg) {
        super(taskId, msg);
    }

    public TaskSerializationException(@Nullable final String taskId, final String msg, final Throwable cause) {
        super(taskId, msg, cause);
    }
}
