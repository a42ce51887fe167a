package org.tanzu.pvemcp.inventory;

import java.util.Objects;

/**
 * Composite identity of a guest: vmids are only unique within one endpoint, and a guest
 * is addressed through the node that hosts it.
 */
public final class VmKey {

    private final String endpointId;
    private final String node;
    private final int vmid;

    public VmKey(String endpointId, String node, int vmid) {
        this.endpointId = Objects.requireNonNull(endpointId, "endpointId");
        this.node = Objects.requireNonNull(node, "node");
        this.vmid = vmid;
    }

    public String getEndpointId() { return endpointId; }
    public String getNode() { return node; }
    public int getVmid() { return vmid; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VmKey)) return false;
        VmKey other = (VmKey) o;
        return vmid == other.vmid && endpointId.equals(other.endpointId) && node.equals(other.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpointId, node, vmid);
    }

    @Override
    public String toString() {
        return endpointId + "/" + node + "/" + vmid;
    }
}
