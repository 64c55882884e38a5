package io.taskrelay.client.http;

import io.taskrelay.spec.A2AClientError;

/**
 * An agent card was fetched but rejected by the configured {@link AgentCardVerifier}.
 */
public class AgentCardVerificationException extends A2AClientError {

    public AgentCardVerificationException(String message) {
        super(message);
    }

    public AgentCardVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
