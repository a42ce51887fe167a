package org.tanzu.pvemcp.event;

import java.util.Locale;

/**
 * Parts of the state that can be requested as a snapshot.
 */
public enum SnapshotKind {
    CONNECTIONS,
    NODES,
    VMS,
    ALL;

    public boolean includesConnections() { return this == CONNECTIONS || this == ALL; }
    public boolean includesNodes() { return this == NODES || this == ALL; }
    public boolean includesVms() { return this == VMS || this == ALL; }

    /**
     * Parses a kind case-insensitively; null or blank means ALL.
     */
    public static SnapshotKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
