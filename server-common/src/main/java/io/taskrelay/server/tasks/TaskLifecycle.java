package io.taskrelay.server.tasks;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import io.taskrelay.A2A;
import io.taskrelay.server.agentexecution.TaskDelta;
import io.taskrelay.spec.Artifact;
import io.taskrelay.spec.InvalidAgentResponseError;
import io.taskrelay.spec.InvalidStateTransitionError;
import io.taskrelay.spec.Message;
import io.taskrelay.spec.Part;
import io.taskrelay.spec.Task;
import io.taskrelay.spec.TaskState;
import io.taskrelay.spec.TaskStatus;
import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.taskrelay.spec.TaskState.CANCELED;
import static io.taskrelay.spec.TaskState.COMPLETED;
import static io.taskrelay.spec.TaskState.FAILED;
import static io.taskrelay.spec.TaskState.INPUT_REQUIRED;
import static io.taskrelay.spec.TaskState.WORKING;

/**
 * Pure task state machine. Every method takes a task value and returns the next one; nothing is
 * stored here and the input is never modified.
 *
 * <h2>Transitions</h2>
 * <pre>
 * submitted      -&gt; working | input_required | completed | failed
 * working        -&gt; working | input_required | completed | failed
 * input_required -&gt; working
 * any non-final  -&gt; canceled   (only through {@link #cancel(Task)})
 * any non-final  -&gt; failed     (also through {@link #fail(Task, String)})
 * </pre>
 * Final states ({@code completed}, {@code failed}, {@code canceled}) accept nothing. Nothing ever
 * goes back to {@code submitted}. A rejected transition throws
 * {@link InvalidStateTransitionError} and leaves the task untouched.
 */
public class TaskLifecycle {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskLifecycle.class);

    private static final Set<TaskState> FROM_ACTIVE = EnumSet.of(WORKING, INPUT_REQUIRED, COMPLETED, FAILED);
    private static final Set<TaskState> FROM_INPUT_REQUIRED = EnumSet.of(WORKING);

    private final Clock clock;

    public TaskLifecycle() {
        this(Clock.systemUTC());
    }

    public TaskLifecycle(Clock clock) {
        this.clock = Assert.checkNotNullParam("clock", clock);
    }

    /**
     * Creates a {@code submitted} task whose history starts with the given message.
     */
    public Task create(String taskId, String contextId, Message initialMessage) {
        Assert.checkNotBlankParam("taskId", taskId);
        Assert.checkNotBlankParam("contextId", contextId);
        Assert.checkNotNullParam("initialMessage", initialMessage);
        return Task.builder()
                .id(taskId)
                .contextId(contextId)
                .status(new TaskStatus(TaskState.SUBMITTED, null, now()))
                .history(stamp(initialMessage, taskId, contextId))
                .build();
    }

    /**
     * Continues a task with new caller input: the message is appended and the task moves to
     * {@code working}.
     *
     * @throws InvalidStateTransitionError if the task is already final
     */
    public Task resume(Task task, Message input) {
        rejectIfFinal(task);
        Message stamped = stamp(input, task.id(), task.contextId());
        return Task.builder(task)
                .history(Utils.append(task.history(), stamped))
                .status(new TaskStatus(WORKING, null, now()))
                .build();
    }

    /**
     * Applies an agent-reported delta.
     *
     * @throws InvalidStateTransitionError if the delta's state is not reachable from the current one
     * @throws InvalidAgentResponseError if an {@code input_required} delta carries no message
     */
    public Task apply(Task task, TaskDelta delta) {
        TaskState from = task.status().state();
        TaskState to = delta.state();
        if (!isLegalTransition(from, to)) {
            throw new InvalidStateTransitionError(
                    String.format("Task %s cannot move from %s to %s", task.id(), from.asString(), to.asString()));
        }
        if (to == INPUT_REQUIRED && delta.message() == null) {
            throw new InvalidAgentResponseError(
                    "Agent asked for input on task " + task.id() + " without saying what it needs");
        }

        Task.Builder builder = Task.builder(task);
        Message message = null;
        if (delta.message() != null) {
            message = stamp(delta.message(), task.id(), task.contextId());
            builder.history(Utils.append(task.history(), message));
        }
        if (delta.artifact() != null) {
            builder.artifacts(mergeArtifact(task, delta.artifact(), delta.append(), delta.lastChunk()));
        }
        return builder
                .status(new TaskStatus(to, message, now()))
                .build();
    }

    /**
     * Moves a non-final task to {@code canceled}.
     *
     * @throws InvalidStateTransitionError if the task is already final
     */
    public Task cancel(Task task) {
        rejectIfFinal(task);
        return Task.builder(task)
                .status(new TaskStatus(CANCELED, null, now()))
                .build();
    }

    /**
     * Moves a non-final task to {@code failed}, recording the reason as an agent message.
     *
     * @throws InvalidStateTransitionError if the task is already final
     */
    public Task fail(Task task, String reason) {
        rejectIfFinal(task);
        Message message = stamp(A2A.toAgentMessage(reason), task.id(), task.contextId());
        return Task.builder(task)
                .history(Utils.append(task.history(), message))
                .status(new TaskStatus(FAILED, message, now()))
                .build();
    }

    /**
     * @return true if an agent delta may move a task from {@code from} to {@code to}
     */
    public static boolean isLegalTransition(TaskState from, TaskState to) {
        if (from.isFinal()) {
            return false;
        }
        if (from == INPUT_REQUIRED) {
            return FROM_INPUT_REQUIRED.contains(to);
        }
        return FROM_ACTIVE.contains(to);
    }

    private void rejectIfFinal(Task task) {
        TaskState state = task.status().state();
        if (state.isFinal()) {
            throw new InvalidStateTransitionError(
                    String.format("Task %s is in terminal state %s", task.id(), state.asString()));
        }
    }

    private List<Artifact> mergeArtifact(Task task, Artifact chunk, boolean append, boolean lastChunk) {
        List<Artifact> artifacts = new ArrayList<>(task.artifacts());
        int existing = indexOf(artifacts, chunk.artifactId());

        if (existing < 0) {
            if (append) {
                LOGGER.warn("Received append=true for nonexistent artifact {} in task {}. Adding it as a new artifact.",
                        chunk.artifactId(), task.id());
            }
            artifacts.add(withLastChunk(chunk, lastChunk));
        } else if (append) {
            Artifact current = artifacts.get(existing);
            List<Part<?>> parts = new ArrayList<>(current.parts());
            parts.addAll(chunk.parts());
            artifacts.set(existing, Artifact.builder(current)
                    .parts(parts)
                    .lastChunk(lastChunk)
                    .build());
        } else {
            LOGGER.debug("Replacing artifact {} in task {}", chunk.artifactId(), task.id());
            artifacts.set(existing, withLastChunk(chunk, lastChunk));
        }
        return artifacts;
    }

    private static int indexOf(List<Artifact> artifacts, String artifactId) {
        for (int i = 0; i < artifacts.size(); i++) {
            if (artifacts.get(i).artifactId().equals(artifactId)) {
                return i;
            }
        }
        return -1;
    }

    private static Artifact withLastChunk(Artifact artifact, boolean lastChunk) {
        return Artifact.builder(artifact).lastChunk(lastChunk).build();
    }

    private static Message stamp(Message message, String taskId, String contextId) {
        if (taskId.equals(message.taskId()) && contextId.equals(message.contextId())) {
            return message;
        }
        return Message.builder(message)
                .taskId(taskId)
                .contextId(contextId)
                .build();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
