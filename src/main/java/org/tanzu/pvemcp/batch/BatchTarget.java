package org.tanzu.pvemcp.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.tanzu.pvemcp.inventory.VmKind;

/**
 * One unit of a batch: a guest (endpoint, node, vmid) or, for shell commands, a node
 * (vmid null). The kind is optional; the dispatcher resolves it from the inventory.
 */
public final class BatchTarget {

    private final String endpointId;
    private final String node;
    private final Integer vmid;
    private final VmKind kind;

    @JsonCreator
    public BatchTarget(@JsonProperty("endpointId") String endpointId,
                       @JsonProperty("node") String node,
                       @JsonProperty("vmid") Integer vmid,
                       @JsonProperty("kind") VmKind kind) {
        this.endpointId = endpointId;
        this.node = node;
        this.vmid = vmid;
        this.kind = kind;
    }

    public static BatchTarget vm(String endpointId, String node, int vmid) {
        return new BatchTarget(endpointId, node, vmid, null);
    }

    public static BatchTarget node(String endpointId, String node) {
        return new BatchTarget(endpointId, node, null, null);
    }

    BatchTarget withKind(VmKind resolved) {
        return new BatchTarget(endpointId, node, vmid, resolved);
    }

    public String getEndpointId() { return endpointId; }
    public String getNode() { return node; }
    public Integer getVmid() { return vmid; }
    public VmKind getKind() { return kind; }

    @Override
    public String toString() {
        return endpointId + "/" + node + (vmid != null ? "/" + vmid : "");
    }
}
