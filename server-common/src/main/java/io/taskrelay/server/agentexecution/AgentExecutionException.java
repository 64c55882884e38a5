package io.taskrelay.server.agentexecution;

/**
 * Raised by an {@link AgentStream} when the producing side reported a failure
 * through {@link AgentEmitter#error(Throwable)}.
 */
public class AgentExecutionException extends RuntimeException {

    public AgentExecutionException(String message) {
        super(message);
    }

    public AgentExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
