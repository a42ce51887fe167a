package org.tanzu.pvemcp.alert;

/**
 * The monitored quantity an alert is about.
 */
public enum AlertDimension {
    CPU(AlertKind.PERFORMANCE, "CPU usage", "%"),
    MEMORY(AlertKind.PERFORMANCE, "Memory usage", "%"),
    DISK(AlertKind.PERFORMANCE, "Disk usage", "%"),
    NETWORK(AlertKind.NETWORK, "Network throughput", "B/s"),
    NODE_STATUS(AlertKind.SYSTEM, "Node status", null),
    VM_STATUS(AlertKind.SYSTEM, "Guest status", null),
    CONNECTION(AlertKind.CONNECTION, "Connection", null),
    /** Raised by an operator or an external monitor, never evaluated against metrics. */
    MANUAL(AlertKind.SYSTEM, "Reported condition", null);

    private final AlertKind kind;
    private final String label;
    private final String unit;

    AlertDimension(AlertKind kind, String label, String unit) {
        this.kind = kind;
        this.label = label;
        this.unit = unit;
    }

    public AlertKind getKind() { return kind; }
    public String getLabel() { return label; }
    public String getUnit() { return unit; }
}
