package org.tanzu.pvemcp.connection;

/**
 * Observer of registry membership and connection transitions.
 */
public interface ConnectionListener {

    default void endpointAdded(EndpointConnection connection) {
    }

    default void endpointRemoved(EndpointConnection connection) {
    }

    default void statusChanged(ConnectionState previous, ConnectionState current) {
    }
}
