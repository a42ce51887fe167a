/**
 * Threshold alerts on polled metrics and connection health.
 *
 * <p>{@link org.tanzu.pvemcp.alert.AlertEngine} keeps {@link org.tanzu.pvemcp.alert.AlertRecord}s
 * and publishes their raising and resolution through the broadcaster.
 */
package org.tanzu.pvemcp.alert;
