package org.tanzu.pvemcp.inventory;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One cluster node as of one poll.
 *
 * {@code cpu} is the fraction (0..1) reported by the API; the percent helpers return
 * null when the capacity is unknown.
 */
public final class NodeSnapshot {

    public static final String ONLINE = "online";

    private final String endpointId;
    private final String node;
    private final String status;
    private final double cpu;
    private final int maxCpu;
    private final long mem;
    private final long maxMem;
    private final long disk;
    private final long maxDisk;
    private final long uptime;
    private final Instant capturedAt;

    public NodeSnapshot(String endpointId, String node, String status, double cpu, int maxCpu,
                        long mem, long maxMem, long disk, long maxDisk, long uptime, Instant capturedAt) {
        this.endpointId = endpointId;
        this.node = node;
        this.status = status;
        this.cpu = cpu;
        this.maxCpu = maxCpu;
        this.mem = mem;
        this.maxMem = maxMem;
        this.disk = disk;
        this.maxDisk = maxDisk;
        this.uptime = uptime;
        this.capturedAt = capturedAt;
    }

    /**
     * Builds a snapshot from one element of {@code GET /nodes}.
     */
    public static NodeSnapshot fromJson(String endpointId, JsonNode json, Instant capturedAt) {
        return new NodeSnapshot(
            endpointId,
            json.path("node").asText(),
            json.path("status").asText("unknown"),
            json.path("cpu").asDouble(0),
            json.path("maxcpu").asInt(0),
            json.path("mem").asLong(0),
            json.path("maxmem").asLong(0),
            json.path("disk").asLong(0),
            json.path("maxdisk").asLong(0),
            json.path("uptime").asLong(0),
            capturedAt
        );
    }

    public String getEndpointId() { return endpointId; }
    public String getNode() { return node; }
    public String getStatus() { return status; }
    public double getCpu() { return cpu; }
    public int getMaxCpu() { return maxCpu; }
    public long getMem() { return mem; }
    public long getMaxMem() { return maxMem; }
    public long getDisk() { return disk; }
    public long getMaxDisk() { return maxDisk; }
    public long getUptime() { return uptime; }
    public Instant getCapturedAt() { return capturedAt; }

    public boolean isOnline() {
        return ONLINE.equals(status);
    }

    public Double getCpuPercent() { return cpu * 100.0; }
    public Double getMemPercent() { return Usage.percent(mem, maxMem); }
    public Double getDiskPercent() { return Usage.percent(disk, maxDisk); }

    @Override
    public String toString() {
        return "NodeSnapshot{endpointId='" + endpointId + "', node='" + node + "', status='" + status + "'}";
    }
}
