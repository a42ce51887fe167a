package org.tanzu.pvemcp.event;

/**
 * Kinds of events delivered to subscribers.
 */
public enum EventType {
    /** Full state, sent first to every new subscriber and on request. */
    SNAPSHOT,
    ENDPOINT_ADDED,
    ENDPOINT_REMOVED,
    CONNECTION_STATUS_CHANGED,
    NODE_ADDED,
    NODE_REMOVED,
    NODE_CHANGED,
    VM_ADDED,
    VM_REMOVED,
    VM_CHANGED,
    /** Outcome of one batch target. */
    COMMAND_RESULT,
    ALERT_RAISED,
    ALERT_RESOLVED
}
