package org.tanzu.pvemcp.alert;

import java.time.Instant;
import java.util.UUID;

/**
 * A raised condition. Records are immutable; every transition yields a new instance
 * with the same id.
 */
public final class AlertRecord {

    private final String id;
    private final AlertLevel level;
    private final AlertKind kind;
    private final AlertDimension dimension;
    private final AlertStatus status;
    private final AlertSource source;
    private final String title;
    private final String description;
    private final Double value;
    private final Double threshold;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;
    private final Instant resolvedAt;

    private AlertRecord(String id, AlertLevel level, AlertKind kind, AlertDimension dimension, AlertStatus status, AlertSource source,
                        String title, String description, Double value, Double threshold, Instant createdAt,
                        Instant updatedAt, Instant acknowledgedAt, String acknowledgedBy, Instant resolvedAt) {
        this.id = id;
        this.level = level;
        this.kind = kind;
        this.dimension = dimension;
        this.status = status;
        this.source = source;
        this.title = title;
        this.description = description;
        this.value = value;
        this.threshold = threshold;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.acknowledgedAt = acknowledgedAt;
        this.acknowledgedBy = acknowledgedBy;
        this.resolvedAt = resolvedAt;
    }

    static AlertRecord raise(AlertLevel level, AlertDimension dimension, AlertSource source, String title,
                             String description, Double value, Double threshold, Instant now) {
        return new AlertRecord("alert-" + UUID.randomUUID(), level, dimension.getKind(), dimension, AlertStatus.ACTIVE,
                source, title, description, value, threshold, now, now, null, null, null);
    }

    static AlertRecord report(AlertLevel level, AlertKind kind, AlertSource source, String title, String description,
                              Instant now) {
        return new AlertRecord("alert-" + UUID.randomUUID(), level, kind, AlertDimension.MANUAL, AlertStatus.ACTIVE,
                source, title, description, null, null, now, now, null, null, null);
    }

    AlertRecord acknowledged(String by, Instant now) {
        return new AlertRecord(id, level, kind, dimension, AlertStatus.ACKNOWLEDGED, source, title, description,
                value, threshold, createdAt, now, now, by, null);
    }

    AlertRecord resolved(Instant now) {
        return new AlertRecord(id, level, kind, dimension, AlertStatus.RESOLVED, source, title, description,
                value, threshold, createdAt, now, acknowledgedAt, acknowledgedBy, now);
    }

    public String getId() { return id; }
    public AlertLevel getLevel() { return level; }
    public AlertKind getKind() { return kind; }
    public AlertDimension getDimension() { return dimension; }
    public AlertStatus getStatus() { return status; }
    public AlertSource getSource() { return source; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public Double getValue() { return value; }
    public Double getThreshold() { return threshold; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getAcknowledgedAt() { return acknowledgedAt; }
    public String getAcknowledgedBy() { return acknowledgedBy; }
    public Instant getResolvedAt() { return resolvedAt; }

    public boolean isOpen() {
        return status.isOpen();
    }

    @Override
    public String toString() {
        return "AlertRecord{id='" + id + "', level=" + level + ", dimension=" + dimension + ", status=" + status +
               ", source=" + source + "}";
    }
}
