/**
 * Endpoint registry and connection status.
 *
 * <p>{@link org.tanzu.pvemcp.connection.ConnectionRegistry} owns one
 * {@link org.tanzu.pvemcp.connection.EndpointConnection} per configured endpoint and reports
 * membership and status transitions to {@link org.tanzu.pvemcp.connection.ConnectionListener}s.
 */
package org.tanzu.pvemcp.connection;
