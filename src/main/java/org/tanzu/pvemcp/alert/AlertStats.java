package org.tanzu.pvemcp.alert;

/**
 * Alert counts by status, and open alerts by level.
 */
public class AlertStats {
    private final int total;
    private final int active;
    private final int acknowledged;
    private final int resolved;
    private final int critical;
    private final int warning;
    private final int info;

    public AlertStats(int total, int active, int acknowledged, int resolved, int critical, int warning, int info) {
        this.total = total;
        this.active = active;
        this.acknowledged = acknowledged;
        this.resolved = resolved;
        this.critical = critical;
        this.warning = warning;
        this.info = info;
    }

    public int getTotal() { return total; }
    public int getActive() { return active; }
    public int getAcknowledged() { return acknowledged; }
    public int getResolved() { return resolved; }
    public int getCritical() { return critical; }
    public int getWarning() { return warning; }
    public int getInfo() { return info; }

    @Override
    public String toString() {
        return "AlertStats{total=" + total + ", active=" + active + ", acknowledged=" + acknowledged +
               ", resolved=" + resolved + ", critical=" + critical + ", warning=" + warning + ", info=" + info + "}";
    }
}
