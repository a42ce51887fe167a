package org.tanzu.pvemcp.inventory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Guest type, which is also the API path segment for the guest.
 */
public enum VmKind {
    /** Full virtual machine */
    QEMU("qemu"),
    /** Container */
    LXC("lxc");

    private final String path;

    VmKind(String path) {
        this.path = path;
    }

    @JsonValue
    public String getPath() {
        return path;
    }

    /**
     * Parses a kind from its path segment or constant name, case-insensitively.
     *
     * @param value For example "qemu" or "LXC"
     * @return The kind, or null for a null or blank value
     * @throws IllegalArgumentException for an unknown value
     */
    @JsonCreator
    public static VmKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (VmKind kind : values()) {
            if (kind.path.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown VM kind: " + value);
    }
}
