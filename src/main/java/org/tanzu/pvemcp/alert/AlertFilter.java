package org.tanzu.pvemcp.alert;

/**
 * Criteria for listing alerts; null fields match everything.
 */
public class AlertFilter {

    public static final AlertFilter ALL = new AlertFilter(null, null, null, null);

    private final AlertStatus status;
    private final AlertLevel level;
    private final AlertKind kind;
    private final String endpointId;

    public AlertFilter(AlertStatus status, AlertLevel level, AlertKind kind, String endpointId) {
        this.status = status;
        this.level = level;
        this.kind = kind;
        this.endpointId = endpointId;
    }

    public AlertStatus getStatus() { return status; }
    public AlertLevel getLevel() { return level; }
    public AlertKind getKind() { return kind; }
    public String getEndpointId() { return endpointId; }

    public boolean matches(AlertRecord record) {
        return (status == null || record.getStatus() == status)
            && (level == null || record.getLevel() == level)
            && (kind == null || record.getKind() == kind)
            && (endpointId == null || endpointId.equals(record.getSource().getEndpointId()));
    }

    @Override
    public String toString() {
        return "AlertFilter{status=" + status + ", level=" + level + ", kind=" + kind + ", endpointId='" + endpointId + "'}";
    }
}
