package org.tanzu.pvemcp.alert;

import java.util.Locale;

/**
 * Operator actions that can be applied to several alerts at once.
 */
public enum AlertAction {
    ACKNOWLEDGE,
    RESOLVE,
    DELETE;

    public static AlertAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Alert action is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
