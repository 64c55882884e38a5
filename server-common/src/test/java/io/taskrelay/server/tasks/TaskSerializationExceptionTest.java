package io.taskrelay.server.tasks;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;

class TaskSerializationExceptionTest extends AbstractTaskStoreExceptionTest<TaskSerializationException> {

    @Override
    protected TaskSerializationException createException(String taskId, String message) {
        return new TaskSerializationException(taskId, message);
    }

    @Override
    protected TaskSerializationException createException(String taskId, String message, Throwable cause) {
        return new TaskSerializationException(taskId, message, cause);
    }

    @Test
    void testIsTaskStoreException() {
        assertInstanceOf(TaskStoreException.class, createException("task-1", "Failed to deserialize task file"));
    }
}
