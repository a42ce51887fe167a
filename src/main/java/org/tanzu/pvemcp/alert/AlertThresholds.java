package org.tanzu.pvemcp.alert;

import org.tanzu.pvemcp.config.PveProperties;

/**
 * Threshold levels for one dimension, ordered critical &gt; warning &gt; info.
 * A value breaches a level when it is strictly above that level's threshold; unset
 * levels never fire.
 */
public final class AlertThresholds {

    private final Double critical;
    private final Double warning;
    private final Double info;

    public AlertThresholds(Double critical, Double warning, Double info) {
        requireAbove(critical, warning, "critical", "warning");
        requireAbove(critical, info, "critical", "info");
        requireAbove(warning, info, "warning", "info");
        this.critical = critical;
        this.warning = warning;
        this.info = info;
    }

    public static AlertThresholds from(PveProperties.Threshold threshold) {
        return new AlertThresholds(threshold.getCritical(), threshold.getWarning(), threshold.getInfo());
    }

    /**
     * @return The most severe level breached, or null
     */
    public AlertLevel levelFor(double value) {
        if (critical != null && value > critical) {
            return AlertLevel.CRITICAL;
        }
        if (warning != null && value > warning) {
            return AlertLevel.WARNING;
        }
        if (info != null && value > info) {
            return AlertLevel.INFO;
        }
        return null;
    }

    public Double thresholdFor(AlertLevel level) {
        switch (level) {
            case CRITICAL:
                return critical;
            case WARNING:
                return warning;
            default:
                return info;
        }
    }

    private static void requireAbove(Double higher, Double lower, String higherName, String lowerName) {
        if (higher != null && lower != null && higher <= lower) {
            throw new IllegalArgumentException(
                "Alert threshold " + higherName + " (" + higher + ") must be above " + lowerName + " (" + lower + ")");
        }
    }

    @Override
    public String toString() {
        return "AlertThresholds{critical=" + critical + ", warning=" + warning + ", info=" + info + "}";
    }
}
