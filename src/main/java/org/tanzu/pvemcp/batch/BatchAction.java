package org.tanzu.pvemcp.batch;

import java.util.Locale;

/**
 * Commands the dispatcher can run against a target.
 *
 * Power actions address a guest and are skipped when the guest is already in the
 * requested state. BACKUP addresses a guest, SHELL addresses a node.
 */
public enum BatchAction {
    START("start", true, false),
    STOP("stop", true, false),
    SHUTDOWN("shutdown", true, false),
    REBOOT("reboot", true, false),
    SUSPEND("suspend", true, true),
    RESUME("resume", true, true),
    BACKUP("backup", false, false),
    SHELL("shell", false, false);

    static final String RUNNING = "running";
    static final String STOPPED = "stopped";
    static final String PAUSED = "paused";

    private final String path;
    private final boolean power;
    private final boolean qemuOnly;

    BatchAction(String path, boolean power, boolean qemuOnly) {
        this.path = path;
        this.power = power;
        this.qemuOnly = qemuOnly;
    }

    /** API path segment of a power action. */
    public String getPath() { return path; }
    public boolean isPower() { return power; }
    /** Containers cannot be suspended or resumed. */
    public boolean isQemuOnly() { return qemuOnly; }
    public boolean isNodeLevel() { return this == SHELL; }

    /**
     * Whether a power action has nothing to do for a guest in the given state.
     *
     * @param status Effective guest status: running, stopped or paused
     */
    public boolean isSatisfiedBy(String status) {
        switch (this) {
            case START:
                return !STOPPED.equals(status);
            case STOP:
            case SHUTDOWN:
            case REBOOT:
            case SUSPEND:
                return !RUNNING.equals(status);
            case RESUME:
                return !PAUSED.equals(status);
            default:
                return false;
        }
    }

    /**
     * Parses an action case-insensitively.
     * @throws IllegalArgumentException for an unknown action
     */
    public static BatchAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Action is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown action: " + value, e);
        }
    }
}
