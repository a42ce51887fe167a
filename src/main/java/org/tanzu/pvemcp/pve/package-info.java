/**
 * MCP tool surface and typed PVE API access.
 *
 * <p>{@link org.tanzu.pvemcp.pve.PveService} exposes the engine as MCP tools;
 * {@link org.tanzu.pvemcp.pve.PveApiClient} wraps an endpoint's request executor with typed calls.
 */
package org.tanzu.pvemcp.pve;
