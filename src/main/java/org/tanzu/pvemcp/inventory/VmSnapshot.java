package org.tanzu.pvemcp.inventory;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One guest (full VM or container) as of one poll.
 *
 * Identity is the {@link VmKey}; the vmid alone is not unique across endpoints.
 */
public final class VmSnapshot {

    public static final String RUNNING = "running";
    public static final String STOPPED = "stopped";

    private final VmKey key;
    private final String name;
    private final VmKind kind;
    private final String status;
    private final double cpu;
    private final int cpus;
    private final long mem;
    private final long maxMem;
    private final long disk;
    private final long maxDisk;
    private final long netIn;
    private final long netOut;
    private final long uptime;
    private final boolean template;
    private final Instant capturedAt;

    public VmSnapshot(VmKey key, String name, VmKind kind, String status, double cpu, int cpus,
                      long mem, long maxMem, long disk, long maxDisk, long netIn, long netOut,
                      long uptime, boolean template, Instant capturedAt) {
        this.key = key;
        this.name = name;
        this.kind = kind;
        this.status = status;
        this.cpu = cpu;
        this.cpus = cpus;
        this.mem = mem;
        this.maxMem = maxMem;
        this.disk = disk;
        this.maxDisk = maxDisk;
        this.netIn = netIn;
        this.netOut = netOut;
        this.uptime = uptime;
        this.template = template;
        this.capturedAt = capturedAt;
    }

    /**
     * Builds a snapshot from one element of {@code GET /nodes/{node}/qemu} or {@code /lxc}.
     */
    public static VmSnapshot fromJson(String endpointId, String node, VmKind kind, JsonNode json, Instant capturedAt) {
        int vmid = json.path("vmid").asInt();
        return new VmSnapshot(
            new VmKey(endpointId, node, vmid),
            json.path("name").asText(kind.getPath() + "-" + vmid),
            kind,
            json.path("status").asText("unknown"),
            json.path("cpu").asDouble(0),
            json.path("cpus").asInt(json.path("maxcpu").asInt(0)),
            json.path("mem").asLong(0),
            json.path("maxmem").asLong(0),
            json.path("disk").asLong(0),
            json.path("maxdisk").asLong(0),
            json.path("netin").asLong(0),
            json.path("netout").asLong(0),
            json.path("uptime").asLong(0),
            json.path("template").asInt(0) == 1 || json.path("template").asBoolean(false),
            capturedAt
        );
    }

    public VmKey getKey() { return key; }
    public String getEndpointId() { return key.getEndpointId(); }
    public String getNode() { return key.getNode(); }
    public int getVmid() { return key.getVmid(); }
    public String getName() { return name; }
    public VmKind getKind() { return kind; }
    public String getStatus() { return status; }
    public double getCpu() { return cpu; }
    public int getCpus() { return cpus; }
    public long getMem() { return mem; }
    public long getMaxMem() { return maxMem; }
    public long getDisk() { return disk; }
    public long getMaxDisk() { return maxDisk; }
    public long getNetIn() { return netIn; }
    public long getNetOut() { return netOut; }
    public long getUptime() { return uptime; }
    public boolean isTemplate() { return template; }
    public Instant getCapturedAt() { return capturedAt; }

    public boolean isRunning() {
        return RUNNING.equals(status);
    }

    public Double getCpuPercent() { return cpu * 100.0; }
    public Double getMemPercent() { return Usage.percent(mem, maxMem); }
    public Double getDiskPercent() { return Usage.percent(disk, maxDisk); }

    @Override
    public String toString() {
        return "VmSnapshot{key=" + key + ", name='" + name + "', kind=" + kind + ", status='" + status + "'}";
    }
}
