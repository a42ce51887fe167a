package org.tanzu.pvemcp.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.client.EndpointConfig;
import org.tanzu.pvemcp.client.PveTransport;
import org.tanzu.pvemcp.client.PveTransportFactory;
import org.tanzu.pvemcp.client.RequestExecutor;
import org.tanzu.pvemcp.client.RetryPolicy;
import org.tanzu.pvemcp.client.SessionManager;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.exception.PveException;
import org.tanzu.pvemcp.exception.PveNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The set of configured endpoints.
 *
 * The registry owns one {@link EndpointConnection} per endpoint: a session manager, a
 * request executor and a status tracker built over a transport from the
 * {@link PveTransportFactory}. Adding an endpoint does not contact it; the first call
 * (usually the first poll) logs in lazily.
 *
 * Membership is copy-on-write: readers always see a complete map and never block.
 * {@link ConnectionListener}s hear about additions, removals and status transitions in
 * registration order.
 */
@Component
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final PveTransportFactory transportFactory;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Map<String, EndpointConnection> connections = Collections.emptyMap();

    public ConnectionRegistry(PveProperties pveProperties, PveTransportFactory transportFactory, ObjectMapper objectMapper) {
        this.transportFactory = transportFactory;
        this.objectMapper = objectMapper;
        this.retryPolicy = pveProperties.getRetry().toPolicy();
        logger.info("ConnectionRegistry initialized with {}", retryPolicy);
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Registers an endpoint without contacting it.
     *
     * @param config The endpoint configuration
     * @return The new connection, initially disconnected
     * @throws IllegalArgumentException if an endpoint with the same id is registered
     */
    public EndpointConnection add(EndpointConfig config) {
        EndpointConnection connection;
        synchronized (this) {
            if (connections.containsKey(config.getId())) {
                throw new IllegalArgumentException("Endpoint '" + config.getId() + "' is already registered");
            }
            PveTransport transport = transportFactory.create(config);
            SessionManager sessionManager = new SessionManager(config, transport, objectMapper);
            ConnectionStatusTracker tracker = new ConnectionStatusTracker(config.getId(), config.getName(), this::fireStatusChanged);
            RequestExecutor executor = new RequestExecutor(config.getId(), sessionManager, transport, retryPolicy, tracker, objectMapper);
            connection = new EndpointConnection(config, tracker, executor);

            Map<String, EndpointConnection> next = new LinkedHashMap<>(connections);
            next.put(config.getId(), connection);
            connections = Collections.unmodifiableMap(next);
        }
        logger.info("Endpoint added: {}", config);
        fire(listener -> listener.endpointAdded(connection));
        return connection;
    }

    /**
     * Unregisters an endpoint. Its executor is closed and its session discarded before
     * listeners are told, so no new call can start once removal is announced.
     *
     * @param id Endpoint identifier
     * @throws PveNotFoundException if no such endpoint is registered
     */
    public void remove(String id) {
        EndpointConnection connection;
        synchronized (this) {
            connection = connections.get(id);
            if (connection == null) {
                throw new PveNotFoundException("Endpoint '" + id + "' is not registered");
            }
            Map<String, EndpointConnection> next = new LinkedHashMap<>(connections);
            next.remove(id);
            connections = Collections.unmodifiableMap(next);
            connection.close();
        }
        logger.info("Endpoint removed: {}", id);
        fire(listener -> listener.endpointRemoved(connection));
    }

    /**
     * Forces a fresh login and a version call against the endpoint.
     *
     * The outcome updates the connection status like any other call but does not
     * touch the endpoint's poll schedule.
     *
     * @param id Endpoint identifier
     * @return true if the endpoint authenticated and answered
     * @throws PveNotFoundException if no such endpoint is registered
     */
    public boolean test(String id) {
        EndpointConnection connection = require(id);
        try {
            connection.getExecutor().checkConnection();
            logger.info("Endpoint '{}' test succeeded", id);
            return true;
        } catch (PveException e) {
            logger.warn("Endpoint '{}' test failed ({}): {}", id, e.getKind(), e.getMessage());
            return false;
        }
    }

    /**
     * @return The connection state of every endpoint, in registration order
     */
    public List<ConnectionState> list() {
        List<ConnectionState> states = new ArrayList<>();
        for (EndpointConnection connection : connections.values()) {
            states.add(connection.getState());
        }
        return states;
    }

    public List<EndpointConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public Optional<EndpointConnection> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(connections.get(id));
    }

    public EndpointConnection require(String id) {
        return find(id).orElseThrow(() -> new PveNotFoundException("Endpoint '" + id + "' is not registered"));
    }

    public boolean contains(String id) {
        return id != null && connections.containsKey(id);
    }

    public Set<String> ids() {
        return new LinkedHashSet<>(connections.keySet());
    }

    /**
     * Counts endpoints by status.
     * @return Totals and health ratio
     */
    public ConnectionStats stats() {
        int connected = 0;
        int disconnected = 0;
        int error = 0;
        for (ConnectionState state : list()) {
            switch (state.getStatus()) {
                case CONNECTED:
                    connected++;
                    break;
                case DISCONNECTED:
                    disconnected++;
                    break;
                default:
                    error++;
                    break;
            }
        }
        return new ConnectionStats(connected + disconnected + error, connected, disconnected, error);
    }

    private void fireStatusChanged(ConnectionState previous, ConnectionState current) {
        logger.debug("Endpoint '{}' status {} -> {}", current.getEndpointId(), previous.getStatus(), current.getStatus());
        fire(listener -> listener.statusChanged(previous, current));
    }

    private void fire(Consumer<ConnectionListener> notification) {
        for (ConnectionListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Connection listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
