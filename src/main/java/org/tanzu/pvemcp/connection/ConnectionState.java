package org.tanzu.pvemcp.connection;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of an endpoint's connection status at one point in time.
 */
public final class ConnectionState {

    private final String endpointId;
    private final String name;
    private final ConnectionStatus status;
    private final String lastError;
    private final Instant lastConnectedAt;
    private final Instant updatedAt;

    public ConnectionState(String endpointId, String name, ConnectionStatus status, String lastError,
                           Instant lastConnectedAt, Instant updatedAt) {
        this.endpointId = endpointId;
        this.name = name;
        this.status = status;
        this.lastError = lastError;
        this.lastConnectedAt = lastConnectedAt;
        this.updatedAt = updatedAt;
    }

    /** State of an endpoint that has not been contacted yet. */
    static ConnectionState initial(String endpointId, String name) {
        return new ConnectionState(endpointId, name, ConnectionStatus.DISCONNECTED, null, null, Instant.now());
    }

    ConnectionState connected(Instant now) {
        return new ConnectionState(endpointId, name, ConnectionStatus.CONNECTED, null, now, now);
    }

    ConnectionState failed(String cause, Instant now) {
        return new ConnectionState(endpointId, name, ConnectionStatus.ERROR, cause, lastConnectedAt, now);
    }

    ConnectionState disconnected(Instant now) {
        return new ConnectionState(endpointId, name, ConnectionStatus.DISCONNECTED, lastError, lastConnectedAt, now);
    }

    /**
     * Two states are equivalent when a consumer would render them identically,
     * ignoring timestamps.
     */
    boolean sameAs(ConnectionState other) {
        return other != null && status == other.status && Objects.equals(lastError, other.lastError);
    }

    public String getEndpointId() { return endpointId; }
    public String getName() { return name; }
    public ConnectionStatus getStatus() { return status; }
    public String getLastError() { return lastError; }
    public Instant getLastConnectedAt() { return lastConnectedAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "ConnectionState{endpointId='" + endpointId + "', status=" + status +
               (lastError != null ? ", lastError='" + lastError + "'" : "") + "}";
    }
}
