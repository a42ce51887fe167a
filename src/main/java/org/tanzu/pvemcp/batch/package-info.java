/**
 * Concurrent dispatch of power, backup and shell actions.
 */
package org.tanzu.pvemcp.batch;
