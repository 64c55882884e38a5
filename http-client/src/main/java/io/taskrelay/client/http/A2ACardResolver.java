package io.taskrelay.client.http;

import static io.taskrelay.util.Utils.unmarshalFrom;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.A2A;
import io.taskrelay.spec.A2AClientError;
import io.taskrelay.spec.A2AClientJSONError;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches the agent card an agent publishes under {@code /.well-known/agent-card.json}.
 */
public class A2ACardResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2ACardResolver.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final URI cardUri;
    private final @Nullable Map<String, String> authHeaders;
    private final AgentCardVerifier verifier;

    /**
     * @param baseUrl the base URL of the agent; a path, if present, is kept as a prefix
     * @throws A2AClientError if the URL is invalid
     */
    public A2ACardResolver(String baseUrl) throws A2AClientError {
        this(HttpClient.newHttpClient(), baseUrl, null, null, AgentCardVerifier.ACCEPT_ALL);
    }

    public A2ACardResolver(String baseUrl, AgentCardVerifier verifier) throws A2AClientError {
        this(HttpClient.newHttpClient(), baseUrl, null, null, verifier);
    }

    /**
     * @param httpClient the http client to use
     * @param baseUrl the base URL of the agent
     * @param agentCardPath optional path of the card relative to the base URL,
     *                      defaults to {@value A2A#AGENT_CARD_PATH}
     * @param authHeaders headers to send with the request, may be null
     * @param verifier checks the card before it is returned
     * @throws A2AClientError if the URL is invalid
     */
    public A2ACardResolver(HttpClient httpClient, String baseUrl, @Nullable String agentCardPath,
                           @Nullable Map<String, String> authHeaders, AgentCardVerifier verifier) throws A2AClientError {
        this.httpClient = Assert.checkNotNullParam("httpClient", httpClient);
        this.verifier = Assert.checkNotNullParam("verifier", verifier);
        this.authHeaders = authHeaders;
        this.cardUri = resolveCardUri(Assert.checkNotNullParam("baseUrl", baseUrl), agentCardPath);
    }

    public URI getCardUri() {
        return cardUri;
    }

    /**
     * Fetches, parses and verifies the agent card.
     *
     * @return the agent card
     * @throws A2AClientError if the card could not be fetched
     * @throws A2AClientJSONError if the response body is not a valid agent card
     * @throws AgentCardVerificationException if the verifier rejected the card
     */
    public AgentCard getAgentCard() throws A2AClientError {
        HttpRequest.Builder builder = HttpRequest.newBuilder(cardUri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json")
                .GET();
        if (authHeaders != null) {
            for (Map.Entry<String, String> entry : authHeaders.entrySet()) {
                builder.header(entry.getKey(), entry.getValue());
            }
        }

        String body;
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new A2AClientError("Failed to obtain agent card: " + response.statusCode());
            }
            body = response.body();
        } catch (IOException e) {
            throw new A2AClientError("Failed to obtain agent card from " + cardUri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientError("Interrupted while fetching agent card from " + cardUri, e);
        }

        AgentCard card;
        try {
            card = unmarshalFrom(body, AgentCard.TYPE_REFERENCE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new A2AClientJSONError("Could not unmarshal agent card response", e);
        }
        verifier.verify(card, body);
        LOGGER.debug("Resolved agent card {} from {}", card.name(), cardUri);
        return card;
    }

    static URI resolveCardUri(String baseUrl, @Nullable String agentCardPath) throws A2AClientError {
        URI base;
        try {
            base = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new A2AClientError("Invalid agent URL: " + baseUrl, e);
        }
        if (base.getScheme() == null || base.getHost() == null) {
            throw new A2AClientError("Invalid agent URL: " + baseUrl);
        }

        String path = base.getPath() == null ? "" : base.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (agentCardPath != null && !agentCardPath.isEmpty()) {
            path = path + (agentCardPath.startsWith("/") ? agentCardPath : "/" + agentCardPath);
        } else if (!path.endsWith(A2A.AGENT_CARD_PATH)) {
            path = path + A2A.AGENT_CARD_PATH;
        }

        try {
            return new URI(base.getScheme(), null, base.getHost(), base.getPort(), path, null, null);
        } catch (URISyntaxException e) {
            throw new A2AClientError("Invalid agent card path: " + path, e);
        }
    }
}
