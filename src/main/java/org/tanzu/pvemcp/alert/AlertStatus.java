package org.tanzu.pvemcp.alert;

/**
 * Lifecycle of an alert record. Records only move forward; a re-breach after
 * resolution creates a new record.
 */
public enum AlertStatus {
    ACTIVE,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isOpen() {
        return this != RESOLVED;
    }
}
