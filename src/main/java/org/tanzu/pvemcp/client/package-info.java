/**
 * Per-endpoint client layer.
 *
 * <p>This package contains:
 * <ul>
 *   <li>{@link org.tanzu.pvemcp.client.SessionManager} – ticket and anti-forgery token lifecycle for one endpoint.</li>
 *   <li>{@link org.tanzu.pvemcp.client.RequestExecutor} – one logical call with re-authentication, bounded retry and status reporting.</li>
 *   <li>{@link org.tanzu.pvemcp.client.PveTransport} – the single-exchange seam, implemented over WebClient by
 *       {@link org.tanzu.pvemcp.client.WebClientPveTransport}.</li>
 * </ul>
 *
 * <p>Sessions never leave this package.
 */
package org.tanzu.pvemcp.client;
