package org.tanzu.pvemcp.alert;

/**
 * Severity, from most to least severe.
 */
public enum AlertLevel {
    CRITICAL,
    WARNING,
    INFO
}
