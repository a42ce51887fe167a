package org.tanzu.pvemcp.connection;

/**
 * Counts of registered endpoints by status.
 */
public class ConnectionStats {
    private final int total;
    private final int connected;
    private final int disconnected;
    private final int error;

    public ConnectionStats(int total, int connected, int disconnected, int error) {
        this.total = total;
        this.connected = connected;
        this.disconnected = disconnected;
        this.error = error;
    }

    public int getTotal() { return total; }
    public int getConnected() { return connected; }
    public int getDisconnected() { return disconnected; }
    public int getError() { return error; }
    public double getHealthRatio() { return total > 0 ? (double) connected / total : 0; }

    @Override
    public String toString() {
        return "ConnectionStats{total=" + total + ", connected=" + connected +
               ", disconnected=" + disconnected + ", error=" + error + "}";
    }
}
