package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A storage of a node that accepts backups, with its usage figures.
 */
public class BackupStorage {

    private final String endpointId;
    private final String node;
    private final String storage;
    private final String type;
    private final boolean active;
    private final long total;
    private final long used;
    private final long available;

    public BackupStorage(String endpointId, String node, String storage, String type, boolean active,
                         long total, long used, long available) {
        this.endpointId = endpointId;
        this.node = node;
        this.storage = storage;
        this.type = type;
        this.active = active;
        this.total = total;
        this.used = used;
        this.available = available;
    }

    static BackupStorage fromJson(String endpointId, String node, JsonNode json) {
        return new BackupStorage(endpointId, node,
                json.path("storage").asText(),
                json.path("type").asText(null),
                json.path("active").asInt(1) == 1,
                json.path("total").asLong(0),
                json.path("used").asLong(0),
                json.path("avail").asLong(0));
    }

    /**
     * True when the storage's content list includes backups. Nodes that ignore the
     * content filter still report the list.
     */
    static boolean acceptsBackups(JsonNode json) {
        JsonNode content = json.path("content");
        if (content.isMissingNode() || content.isNull()) {
            return true;
        }
        for (String type : content.asText().split(",")) {
            if ("backup".equals(type.trim())) {
                return true;
            }
        }
        return false;
    }

    public String getEndpointId() { return endpointId; }
    public String getNode() { return node; }
    public String getStorage() { return storage; }
    public String getType() { return type; }
    public boolean isActive() { return active; }
    public long getTotal() { return total; }
    public long getUsed() { return used; }
    public long getAvailable() { return available; }

    @Override
    public String toString() {
        return "BackupStorage{" + endpointId + "/" + node + "/" + storage + ", type=" + type + ", active=" + active + "}";
    }
}
