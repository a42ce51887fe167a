package org.tanzu.pvemcp.batch;

import com.fasterxml.jackson.databind.JsonNode;
import org.tanzu.pvemcp.exception.ErrorKind;

/**
 * Live status of one guest as read from its endpoint, or the reason it could not be read.
 */
public final class GuestStatus {

    private final BatchTarget target;
    private final String name;
    private final String status;
    private final long uptime;
    private final double cpu;
    private final long mem;
    private final long maxMem;
    private final ErrorKind errorKind;
    private final String error;

    private GuestStatus(BatchTarget target, String name, String status, long uptime, double cpu, long mem, long maxMem,
                        ErrorKind errorKind, String error) {
        this.target = target;
        this.name = name;
        this.status = status;
        this.uptime = uptime;
        this.cpu = cpu;
        this.mem = mem;
        this.maxMem = maxMem;
        this.errorKind = errorKind;
        this.error = error;
    }

    static GuestStatus fromJson(BatchTarget target, JsonNode json) {
        return new GuestStatus(target,
                json.path("name").asText(null),
                BatchDispatcher.effectiveStatus(json),
                json.path("uptime").asLong(0),
                json.path("cpu").asDouble(0),
                json.path("mem").asLong(0),
                json.path("maxmem").asLong(0),
                null, null);
    }

    static GuestStatus failure(BatchTarget target, ErrorKind errorKind, String error) {
        return new GuestStatus(target, null, "unknown", 0, 0, 0, 0, errorKind, error);
    }

    public BatchTarget getTarget() { return target; }
    public String getName() { return name; }
    public String getStatus() { return status; }
    public long getUptime() { return uptime; }
    /** CPU load as a fraction of the guest's cores. */
    public double getCpu() { return cpu; }
    public long getMem() { return mem; }
    public long getMaxMem() { return maxMem; }
    public ErrorKind getErrorKind() { return errorKind; }
    public String getError() { return error; }

    public boolean isAvailable() {
        return errorKind == null;
    }

    @Override
    public String toString() {
        return "GuestStatus{target=" + target + ", status=" + status +
               (errorKind != null ? ", errorKind=" + errorKind + ", error='" + error + "'" : "") + "}";
    }
}
