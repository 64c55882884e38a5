package io.taskrelay.server.agentexecution;

import io.taskrelay.spec.A2AError;
import io.taskrelay.spec.UnsupportedOperationError;

/**
 * The pluggable agent logic behind a {@link io.taskrelay.server.requesthandlers.RequestHandler}.
 * <p>
 * An executor never touches the task store. It only reports what should happen to the task:
 * the request handler validates every reported {@link TaskDelta}, persists the result and
 * forwards events to the caller. Exceptions thrown from any method, as well as deltas that
 * would break the task lifecycle, end the call with the task in {@code failed} state.
 * <p>
 * Implementations must be safe for concurrent calls on different tasks. Calls on the
 * same task are never concurrent.
 */
public interface AgentExecutor {

    /**
     * Handles a message and reports a single outcome.
     *
     * @param context the call context, including the resolved task
     * @return either a direct reply or a task delta
     * @throws A2AError to fail the call
     */
    AgentResult sendMessage(RequestContext context) throws A2AError;

    /**
     * Handles a message and reports progress incrementally. The call ends at the first delta
     * whose state is terminal or {@code input_required}, or when the stream is exhausted.
     *
     * @param context the call context, including the resolved task
     * @return the deltas for this call
     * @throws A2AError to fail the call
     */
    AgentStream streamMessage(RequestContext context) throws A2AError;

    /**
     * Asks the agent to stop working on a task. The task is marked {@code canceled} whether or
     * not the agent supports this, and any deltas it reports afterwards are discarded.
     *
     * @param taskId the task to stop
     * @throws UnsupportedOperationError if the agent cannot be interrupted
     */
    default void cancel(String taskId) throws A2AError {
        throw new UnsupportedOperationError("Agent does not support cancellation");
    }

    /**
     * Reopens the update stream of a non-terminal task that has no call in flight.
     *
     * @param taskId the task to resume streaming for
     * @return the remaining deltas for the task
     * @throws UnsupportedOperationError if the agent cannot resume streams
     */
    default AgentStream resubscribe(String taskId) throws A2AError {
        throw new UnsupportedOperationError("Agent does not support resubscription");
    }
}
