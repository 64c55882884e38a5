package io.taskrelay.client.http;

import io.taskrelay.spec.AgentCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a fetched agent card may be trusted.
 * <p>
 * Agent cards are served without authentication. {@link A2ACardResolver} passes every card it
 * fetches through a verifier before returning it; the raw body is included so that signatures
 * can be checked against the exact bytes the agent served.
 */
@FunctionalInterface
public interface AgentCardVerifier {

    /**
     * Accepts every card and logs that it was not verified.
     */
    AgentCardVerifier ACCEPT_ALL = new Unverified();

    /**
     * @param card the parsed card
     * @param body the response body the card was parsed from
     * @throws AgentCardVerificationException if the card must not be used
     */
    void verify(AgentCard card, String body) throws AgentCardVerificationException;

    /**
     * A verifier that rejects cards carrying no signature, then delegates to this one.
     */
    default AgentCardVerifier requireSignature() {
        return (card, body) -> {
            if (card.signature() == null || card.signature().isBlank()) {
                throw new AgentCardVerificationException("Agent card for " + card.name() + " is not signed");
            }
            verify(card, body);
        };
    }

    final class Unverified implements AgentCardVerifier {

        private static final Logger LOGGER = LoggerFactory.getLogger(Unverified.class);

        private Unverified() {
        }

        @Override
        public void verify(AgentCard card, String body) {
            LOGGER.warn("Using agent card for {} at {} without verification", card.name(), card.url());
        }
    }
}
