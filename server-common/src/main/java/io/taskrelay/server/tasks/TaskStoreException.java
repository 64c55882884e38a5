package io.taskrelay.server.tasks;

import io.taskrelay.spec.A2AServerException;
import org.jspecify.annotations.Nullable;

/**
 * Base exception for {@link TaskStore} failures.
 * <p>
 * Subclasses narrow the failure down:
 * <ul>
 *   <li>{@link TaskSerializationException} - a stored task could not be written or read back</li>
 *   <li>{@link TaskPersistenceException} - the storage medium itself failed</li>
 * </ul>
 * The request handler never lets these escape to a caller. A failed read or write surfaces as
 * {@link io.taskrelay.spec.UpstreamUnavailableError}, with this exception as its cause.
 *
 * @see TaskStore
 */
public class TaskStoreException extends A2AServerException {

    @Nullable
    private final String taskId;

    public TaskStoreException() {
        super();
        this.taskId = null;
    }

    public TaskStoreException(final String msg) {
        super(msg);
        this.taskId = null;
    }

    public TaskStoreException(final Throwable cause) {
        super(cause);
        this.taskId = null;
    }

    public TaskStoreException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = null;
    }

    /**
     * Creates a new TaskStoreException for the given task.
     *
     * @param taskId the task identifier (may be null for operations not tied to a specific task)
     * @param msg the exception message
     */
    public TaskStoreException(@Nullable final String taskId, final String msg) {
        super(msg);
        this.taskId = taskId;
    }

    /**
     * Creates a new TaskStoreException for the given task.
     *
     * @param taskId the task identifier (may be null for operations not tied to a specific task)
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public TaskStoreException(@Nullable final String taskId, final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = taskId;
    }

    /**
     * Returns the task ID associated with this exception.
     *
     * @return the task ID, or null if not associated with a specific task
     */
    @Nullable
    public String getTaskId() {
        return taskId;
    }
}
