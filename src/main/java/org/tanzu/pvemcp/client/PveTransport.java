package org.tanzu.pvemcp.client;

/**
 * Sends a single HTTP exchange to one endpoint.
 *
 * Implementations return every HTTP answer, whatever its status, and throw
 * {@link TransportException} only when no answer was received. They do not retry.
 */
public interface PveTransport {

    TransportResponse exchange(TransportRequest request);
}
