package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.pvemcp.exception.PveApiException;
import org.tanzu.pvemcp.exception.PveAuthException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.exception.PveTransientException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Issues logical calls against one endpoint.
 *
 * For every call the executor:
 * - logs in first when the endpoint has no session yet
 * - attaches the ticket cookie, and the anti-forgery token on mutating requests
 * - on a 401, invalidates the session, logs in again once and repeats the call; a
 *   second 401 fails with {@link PveAuthException}
 * - on a timeout, connection failure or 5xx, retries up to the retry budget with the
 *   delay given by the {@link RetryPolicy}; exhaustion fails with {@link PveTransientException}
 * - on any other 4xx, fails with {@link PveApiException} without retrying
 *
 * Every outcome is reported to the {@link StatusReporter}: answered calls mark the
 * endpoint connected, authentication and exhausted transient failures mark it in
 * error with the cause. Nothing else sets the connection status.
 */
public class RequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RequestExecutor.class);

    static final String VERSION_PATH = "/version";

    private final String endpointId;
    private final SessionManager sessionManager;
    private final PveTransport transport;
    private final RetryPolicy retryPolicy;
    private final StatusReporter statusReporter;
    private final ObjectMapper objectMapper;

    private volatile boolean closed;

    public RequestExecutor(String endpointId, SessionManager sessionManager, PveTransport transport,
                           RetryPolicy retryPolicy, StatusReporter statusReporter, ObjectMapper objectMapper) {
        this.endpointId = endpointId;
        this.sessionManager = sessionManager;
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.statusReporter = statusReporter;
        this.objectMapper = objectMapper;
    }

    /**
     * Executes a call with the default retry budget.
     *
     * @param method HTTP method
     * @param path Path relative to the API root, for example {@code /nodes}
     * @param params Query parameters (GET) or form fields; may be empty
     * @return The {@code data} member of the answer
     */
    public JsonNode execute(HttpMethod method, String path, Map<String, ?> params) {
        return execute(method, path, params, retryPolicy.getMaxRetries());
    }

    /**
     * Executes a call with an explicit retry budget for transient failures.
     *
     * @param method HTTP method
     * @param path Path relative to the API root
     * @param params Query parameters (GET) or form fields; may be empty
     * @param maxRetries Retries allowed after the first attempt
     * @return The {@code data} member of the answer
     * @throws PveAuthException if the endpoint keeps refusing the credentials
     * @throws PveTransientException if the retry budget is exhausted
     * @throws PveApiException if the endpoint rejects the request
     * @throws PveNotFoundException if the endpoint has been removed
     */
    public JsonNode execute(HttpMethod method, String path, Map<String, ?> params, int maxRetries) {
        ensureOpen();
        Map<String, String> form = stringify(params);
        int retries = 0;
        boolean reauthenticated = false;
        String lastCause;

        while (true) {
            ensureOpen();
            try {
                Session session = sessionManager.currentOrAuthenticate();
                TransportResponse response = transport.exchange(authorize(method, path, form, session));

                if (response.isUnauthorized()) {
                    sessionManager.invalidate(session);
                    if (reauthenticated) {
                        String cause = method + " " + path + " on '" + endpointId + "' still unauthorized after re-authentication";
                        statusReporter.failed(cause);
                        throw new PveAuthException(cause);
                    }
                    logger.warn("{} {} on '{}' answered 401, re-authenticating", method, path, endpointId);
                    reauthenticated = true;
                    continue;
                }

                if (response.isSuccessful()) {
                    statusReporter.connected();
                    return ResponseParser.data(objectMapper, response);
                }

                String description = ResponseParser.describeError(objectMapper, response);
                if (!response.isServerError()) {
                    // the endpoint is up and authenticated, it just refused this request
                    statusReporter.connected();
                    throw new PveApiException(response.getStatusCode(), description);
                }
                lastCause = description;
            } catch (TransportException e) {
                lastCause = e.getMessage();
            } catch (PveAuthException e) {
                if (!(e.getCause() instanceof TransportException)) {
                    statusReporter.failed(e.getMessage());
                    throw e;
                }
                lastCause = e.getMessage();
            }

            if (retries >= maxRetries) {
                String cause = method + " " + path + " on '" + endpointId + "' failed after "
                        + (retries + 1) + " attempt(s): " + lastCause;
                statusReporter.failed(cause);
                throw new PveTransientException(cause);
            }
            retries++;
            Duration delay = retryPolicy.delayBefore(retries);
            logger.warn("{} {} on '{}' failed ({}), retry {}/{} in {} ms",
                    method, path, endpointId, lastCause, retries, maxRetries, delay.toMillis());
            pause(delay);
        }
    }

    /**
     * Forces a fresh login followed by a lightweight version call, without retries.
     *
     * @return The version document
     * @throws PveAuthException if the credentials are rejected or the endpoint is unreachable
     */
    public JsonNode checkConnection() {
        ensureOpen();
        try {
            sessionManager.authenticate();
        } catch (PveAuthException e) {
            statusReporter.failed(e.getMessage());
            throw e;
        }
        return execute(HttpMethod.GET, VERSION_PATH, Map.of(), 0);
    }

    /**
     * Stops accepting calls and discards the session. Calls already past their
     * last open check finish normally.
     */
    public void close() {
        closed = true;
        sessionManager.discard();
    }

    public boolean isClosed() {
        return closed;
    }

    public String getEndpointId() {
        return endpointId;
    }

    private void ensureOpen() {
        if (closed) {
            throw new PveNotFoundException("Endpoint '" + endpointId + "' has been removed");
        }
    }

    private TransportRequest authorize(HttpMethod method, String path, Map<String, String> form, Session session) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Cookie", "PVEAuthCookie=" + session.getTicket());
        if (!HttpMethod.GET.equals(method)) {
            headers.put("CSRFPreventionToken", session.getCsrfToken());
        }
        return new TransportRequest(method, path, form, headers);
    }

    private static Map<String, String> stringify(Map<String, ?> params) {
        Map<String, String> form = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((key, value) -> {
                if (value != null) {
                    form.put(key, value instanceof Boolean ? ((Boolean) value ? "1" : "0") : value.toString());
                }
            });
        }
        return form;
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PveTransientException("Interrupted while waiting to retry a call on '" + endpointId + "'", e);
        }
    }
}
