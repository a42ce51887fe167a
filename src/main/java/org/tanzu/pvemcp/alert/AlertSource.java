package org.tanzu.pvemcp.alert;

import java.util.Objects;

/**
 * The resource an alert refers to: an endpoint, one of its nodes, or a guest on a node.
 *
 * Identity is (endpointId, node, vmid); the label is for display only.
 */
public final class AlertSource {

    private final String endpointId;
    private final String node;
    private final Integer vmid;
    private final String label;

    public AlertSource(String endpointId, String node, Integer vmid, String label) {
        this.endpointId = Objects.requireNonNull(endpointId, "endpointId");
        this.node = node;
        this.vmid = vmid;
        this.label = label;
    }

    public static AlertSource endpoint(String endpointId, String name) {
        return new AlertSource(endpointId, null, null, name);
    }

    public static AlertSource node(String endpointId, String node) {
        return new AlertSource(endpointId, node, null, node);
    }

    public static AlertSource vm(String endpointId, String node, int vmid, String name) {
        return new AlertSource(endpointId, node, vmid, name + " (" + vmid + ")");
    }

    public String getEndpointId() { return endpointId; }
    public String getNode() { return node; }
    public Integer getVmid() { return vmid; }
    public String getLabel() { return label; }

    public boolean isEndpoint() { return node == null && vmid == null; }
    public boolean isNode() { return node != null && vmid == null; }
    public boolean isVm() { return vmid != null; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AlertSource)) return false;
        AlertSource other = (AlertSource) o;
        return endpointId.equals(other.endpointId) && Objects.equals(node, other.node) && Objects.equals(vmid, other.vmid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpointId, node, vmid);
    }

    @Override
    public String toString() {
        return endpointId + (node != null ? "/" + node : "") + (vmid != null ? "/" + vmid : "");
    }
}
