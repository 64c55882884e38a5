package io.taskrelay.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import io.taskrelay.spec.A2AServerException;
import org.junit.jupiter.api.Test;

/**
 * Shared checks for the {@link TaskStoreException} hierarchy.
 *
 * @param <T> the exception type under test
 */
public abstract class AbstractTaskStoreExceptionTest<T extends TaskStoreException> {

    protected abstract T createException(String taskId, String message);

    protected abstract T createException(String taskId, String message, Throwable cause);

    @Test
    void testTaskIdIsKept() {
        assertEquals("task-123", createException("task-123", "Failed to save task").getTaskId());
    }

    @Test
    void testTaskIdMayBeNull() {
        assertNull(createException(null, "Failed to list tasks").getTaskId());
    }

    @Test
    void testMessageIsKept() {
        assertEquals("Failed to save task", createException("task-123", "Failed to save task").getMessage());
    }

    @Test
    void testCauseChain() {
        RuntimeException rootCause = new RuntimeException("disk full");
        IllegalStateException intermediate = new IllegalStateException("write failed", rootCause);
        T exception = createException("task-123", "Save failed", intermediate);

        assertSame(intermediate, exception.getCause());
        assertSame(rootCause, exception.getCause().getCause());
    }

    @Test
    void testIsServerException() {
        assertInstanceOf(A2AServerException.class, createException("task-123", "Save failed"));
    }
}
