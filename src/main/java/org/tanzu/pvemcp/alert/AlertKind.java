package org.tanzu.pvemcp.alert;

/**
 * Broad category of an alert, used for filtering.
 */
public enum AlertKind {
    PERFORMANCE,
    NETWORK,
    SYSTEM,
    CONNECTION
}
