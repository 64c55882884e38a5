package io.taskrelay.spec;

import static io.taskrelay.spec.A2AErrorCodes.TASK_NOT_FOUND_ERROR_CODE;

import org.jspecify.annotations.Nullable;

/**
 * An operation referenced a task id the store does not know.
 */
public class TaskNotFoundError extends A2AError {

    public TaskNotFoundError() {
        this(null, null);
    }

    public TaskNotFoundError(@Nullable String message) {
        this(message, null);
    }

    public TaskNotFoundError(@Nullable String message, @Nullable Object data) {
        super(TASK_NOT_FOUND_ERROR_CODE, message == null ? "Task not found" : message, data);
    }
}
