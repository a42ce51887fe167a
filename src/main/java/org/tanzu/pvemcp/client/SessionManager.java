package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.pvemcp.exception.PveAuthException;
import org.tanzu.pvemcp.exception.PveException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the authentication state of a single endpoint.
 *
 * A session is obtained by posting the credentials to {@code /access/ticket} and is
 * considered valid until a downstream 401 is observed: the remote ticket lifetime is
 * opaque to the client, so there is no expiry timer.
 *
 * Replacement is atomic. Logins are serialized, so concurrent callers that find no
 * session share one login instead of racing, and {@link #invalidate(Session)} only
 * clears the session it was handed, so a late 401 on an old ticket never discards a
 * newer one.
 *
 * Authentication failures are never retried here; retrying is the
 * {@link RequestExecutor}'s responsibility.
 */
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    static final String TICKET_PATH = "/access/ticket";

    private final EndpointConfig config;
    private final PveTransport transport;
    private final ObjectMapper objectMapper;

    private final AtomicReference<Session> session = new AtomicReference<>();
    private final Object loginLock = new Object();

    public SessionManager(EndpointConfig config, PveTransport transport, ObjectMapper objectMapper) {
        this.config = config;
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    /**
     * Logs in unconditionally and replaces any existing session.
     *
     * @return The new session
     * @throws PveAuthException if the credentials are rejected, the answer carries no
     *         ticket, or the ticket request could not be sent (the transport failure is kept as cause)
     */
    Session authenticate() {
        synchronized (loginLock) {
            Session fresh = login();
            session.set(fresh);
            return fresh;
        }
    }

    /**
     * Returns the current session, logging in first when there is none.
     *
     * @return A session believed valid
     * @throws PveAuthException if a login was needed and failed
     */
    Session currentOrAuthenticate() {
        Session current = session.get();
        if (current != null) {
            return current;
        }
        synchronized (loginLock) {
            current = session.get();
            if (current != null) {
                return current;
            }
            Session fresh = login();
            session.set(fresh);
            return fresh;
        }
    }

    /**
     * Checks whether a session is still the endpoint's current one.
     * @param candidate The session to check
     * @return true until the session is invalidated, replaced or discarded
     */
    boolean isValid(Session candidate) {
        return candidate != null && candidate == session.get();
    }

    /**
     * Drops the given session after the endpoint answered 401 to it.
     * @param stale The session that was rejected
     */
    void invalidate(Session stale) {
        if (session.compareAndSet(stale, null)) {
            logger.info("Session for endpoint '{}' invalidated after an unauthorized answer", config.getId());
        }
    }

    /** Forgets the session entirely (logout or endpoint removal). */
    void discard() {
        if (session.getAndSet(null) != null) {
            logger.info("Session for endpoint '{}' discarded", config.getId());
        }
    }

    Optional<Session> current() {
        return Optional.ofNullable(session.get());
    }

    /** @return true if a session is currently held */
    public boolean hasSession() {
        return session.get() != null;
    }

    private Session login() {
        Credentials credentials = config.getCredentials();
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", credentials.principal());
        form.put("password", credentials.getPassword());

        logger.debug("Requesting ticket for '{}' from endpoint '{}'", credentials.principal(), config.getId());
        TransportResponse response;
        try {
            response = transport.exchange(new TransportRequest(HttpMethod.POST, TICKET_PATH, form, Map.of()));
        } catch (TransportException e) {
            throw new PveAuthException("Authentication request to " + config.getHost() + " failed: " + e.getMessage(), e);
        }

        if (!response.isSuccessful()) {
            throw new PveAuthException("Authentication rejected by " + config.getHost() + ": "
                    + ResponseParser.describeError(objectMapper, response));
        }

        JsonNode data;
        try {
            data = ResponseParser.data(objectMapper, response);
        } catch (PveException e) {
            throw new PveAuthException("Authentication answer from " + config.getHost() + " was unreadable", e);
        }
        String ticket = data.path("ticket").asText("");
        String csrfToken = data.path("CSRFPreventionToken").asText("");
        if (ticket.isEmpty() || csrfToken.isEmpty()) {
            throw new PveAuthException("Authentication answer from " + config.getHost() + " carried no ticket");
        }

        String username = data.path("username").asText(credentials.principal());
        logger.info("Established session for '{}' on endpoint '{}'", username, config.getId());
        return new Session(ticket, csrfToken, username, Instant.now());
    }
}
