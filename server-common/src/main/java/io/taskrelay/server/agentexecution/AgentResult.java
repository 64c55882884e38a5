package io.taskrelay.server.agentexecution;

import io.taskrelay.spec.Message;
import io.taskrelay.util.Assert;

/**
 * The outcome of a synchronous {@link AgentExecutor#sendMessage(RequestContext)} call.
 * <p>
 * An agent either answers directly with a {@link Message}, in which case no task state is
 * changed or persisted, or reports a {@link TaskDelta} that is folded into the task.
 */
public sealed interface AgentResult permits AgentResult.MessageResult, AgentResult.TaskResult {

    static AgentResult message(Message message) {
        return new MessageResult(message);
    }

    static AgentResult task(TaskDelta delta) {
        return new TaskResult(delta);
    }

    record MessageResult(Message message) implements AgentResult {
        public MessageResult {
            Assert.checkNotNullParam("message", message);
        }
    }

    record TaskResult(TaskDelta delta) implements AgentResult {
        public TaskResult {
            Assert.checkNotNullParam("delta", delta);
        }
    }
}
