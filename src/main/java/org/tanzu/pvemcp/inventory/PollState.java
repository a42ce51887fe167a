package org.tanzu.pvemcp.inventory;

/**
 * Phase of an endpoint's poll loop.
 */
public enum PollState {
    /** Waiting for the next regular cycle. */
    IDLE,
    /** A cycle is fetching the inventory. */
    POLLING,
    /** The last cycle failed; the next one is delayed. */
    BACKOFF,
    /** Authentication failed; polling resumes once the endpoint is connected again. */
    HALTED
}
