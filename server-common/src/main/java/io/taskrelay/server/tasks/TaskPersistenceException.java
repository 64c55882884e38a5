package io.taskrelay.server.tasks;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the storage medium behind a {@link TaskStore} fails: an unwritable directory,
 * a full disk, a lost connection.
 * <p>
 * {@link #isTransient()} tells callers whether the same operation may succeed when retried.
 * Failures are non-transient unless stated otherwise.
 */
public class TaskPersistenceException extends TaskStoreException {

    private final boolean isTransientFailure;

    public TaskPersistenceException() {
        super();
        this.isTransientFailure = false;
    }

    public TaskPersistenceException(final String msg) {
        super(msg);
        this.isTransientFailure = false;
    }

    public TaskPersistenceException(final Throwable cause) {
        super(cause);
        this.isTransientFailure = false;
    }

    public TaskPersistenceException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.isTransientFailure = false;
    }

    public TaskPersistenceException(@Nullable final String taskId, final String msg) {
        super(taskId, msg);
        this.isTransientFailure = false;
    }

    public TaskPersistenceException(@Nullable final String taskId, final String msg, final Throwable cause) {
        super(taskId, msg, cause);
        this.isTransientFailure = false;
    }

    /**
     * Creates a new TaskPersistenceException with an explicit transient flag.
     *
     * @param taskId the task identifier (may be null)
     * @param msg the exception message
     * @param cause the underlying cause
     * @param isTransient true if retrying the operation may succeed
     */
    public TaskPersistenceException(@Nullable final String taskId, final String msg, final Throwable cause,
                                    final boolean isTransient) {
        super(taskId, msg, cause);
        this.isTransientFailure = isTransient;
    }

    /**
     * @return true if the failure is temporary and the operation may be retried
     */
    public boolean isTransient() {
        return isTransientFailure;
    }
}
