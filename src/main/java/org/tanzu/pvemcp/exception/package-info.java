/**
 * Failure taxonomy shared by the client, dispatcher and tool layers.
 *
 * <p>{@link org.tanzu.pvemcp.exception.PveException} is unchecked; each subclass maps to one
 * {@link org.tanzu.pvemcp.exception.ErrorKind}.
 */
package org.tanzu.pvemcp.exception;
