package org.tanzu.pvemcp.client;

/**
 * Creates the transport bound to one endpoint's base URL.
 */
@FunctionalInterface
public interface PveTransportFactory {

    PveTransport create(EndpointConfig config);
}
