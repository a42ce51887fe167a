package org.tanzu.pvemcp.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.pvemcp.client.StatusReporter;

import java.time.Instant;
import java.util.function.BiConsumer;

/**
 * Holds an endpoint's {@link ConnectionState} and turns request outcomes into transitions.
 *
 * Only the endpoint's {@link org.tanzu.pvemcp.client.RequestExecutor} reports to the
 * tracker. Listeners hear about a transition only when the status or the last error
 * actually changes, in the order the transitions happened.
 */
public class ConnectionStatusTracker implements StatusReporter {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionStatusTracker.class);

    private final BiConsumer<ConnectionState, ConnectionState> onTransition;
    private volatile ConnectionState state;

    public ConnectionStatusTracker(String endpointId, String name, BiConsumer<ConnectionState, ConnectionState> onTransition) {
        this.state = ConnectionState.initial(endpointId, name);
        this.onTransition = onTransition;
    }

    public ConnectionState current() {
        return state;
    }

    @Override
    public synchronized void connected() {
        ConnectionState previous = state;
        if (previous.getStatus() == ConnectionStatus.CONNECTED) {
            return;
        }
        transition(previous, previous.connected(Instant.now()));
        logger.info("Endpoint '{}' connected", previous.getEndpointId());
    }

    @Override
    public synchronized void failed(String cause) {
        ConnectionState previous = state;
        ConnectionState next = previous.failed(cause, Instant.now());
        if (previous.sameAs(next)) {
            state = next;
            return;
        }
        transition(previous, next);
        logger.warn("Endpoint '{}' in error: {}", previous.getEndpointId(), cause);
    }

    /** Marks the endpoint disconnected, used when it is removed. */
    synchronized void disconnected() {
        ConnectionState previous = state;
        if (previous.getStatus() != ConnectionStatus.DISCONNECTED) {
            state = previous.disconnected(Instant.now());
        }
    }

    private void transition(ConnectionState previous, ConnectionState next) {
        state = next;
        try {
            onTransition.accept(previous, next);
        } catch (RuntimeException e) {
            logger.error("Connection listener failed for endpoint '{}': {}", next.getEndpointId(), e.getMessage(), e);
        }
    }
}
