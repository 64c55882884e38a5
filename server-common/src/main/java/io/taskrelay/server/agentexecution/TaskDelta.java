package io.taskrelay.server.agentexecution;

import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.TaskState;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * One step of progress reported by an {@link AgentExecutor} for a task.
 * <p>
 * A delta always names the state the task should be in after it is applied. It may carry a
 * message, which is appended to the task history and becomes the status message, and an
 * artifact chunk. With {@code append} set, the chunk's parts extend the artifact with the same
 * id; otherwise the chunk replaces it. {@code lastChunk} marks the chunk that closes the artifact.
 *
 * @param state the target state
 * @param message the message accompanying the transition, required for {@link TaskState#INPUT_REQUIRED}
 * @param artifact an artifact chunk, may be null
 * @param append whether the artifact chunk extends an existing artifact
 * @param lastChunk whether the artifact chunk is the final one
 */
public record TaskDelta(TaskState state,
                        @Nullable Message message,
                        @Nullable Artifact artifact,
                        boolean append,
                        boolean lastChunk) {

    public TaskDelta {
        Assert.checkNotNullParam("state", state);
    }

    public static TaskDelta of(TaskState state) {
        return new TaskDelta(state, null, null, false, false);
    }

    public static TaskDelta of(TaskState state, @Nullable Message message) {
        return new TaskDelta(state, message, null, false, false);
    }

    public static TaskDelta working() {
        return of(TaskState.WORKING);
    }

    public static TaskDelta working(Message message) {
        return of(TaskState.WORKING, message);
    }

    public static TaskDelta inputRequired(Message question) {
        return of(TaskState.INPUT_REQUIRED, Assert.checkNotNullParam("question", question));
    }

    public static TaskDelta completed() {
        return of(TaskState.COMPLETED);
    }

    public static TaskDelta completed(Message message) {
        return of(TaskState.COMPLETED, message);
    }

    public static TaskDelta failed(Message message) {
        return of(TaskState.FAILED, message);
    }

    /**
     * An artifact chunk that leaves the task in the given state.
     */
    public static TaskDelta artifact(TaskState state, Artifact artifact, boolean append, boolean lastChunk) {
        return new TaskDelta(state, null, Assert.checkNotNullParam("artifact", artifact), append, lastChunk);
    }
}
