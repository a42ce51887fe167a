/**
 * Configuration for the PVE fleet MCP server.
 *
 * <p>Provides endpoint, transport, polling, batch and alert settings
 * ({@link org.tanzu.pvemcp.config.PveProperties}), Cloud Foundry VCAP_SERVICES processing
 * ({@link org.tanzu.pvemcp.config.PveConfigProcessor}), WebClient setup with optional insecure
 * SSL ({@link org.tanzu.pvemcp.config.WebClientConfig}) and the engine's thread pools
 * ({@link org.tanzu.pvemcp.config.ExecutorConfig}).
 */
package org.tanzu.pvemcp.config;
