package org.tanzu.pvemcp.inventory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One generation of an endpoint's nodes and guests, as fetched by a single poll.
 *
 * Generations are immutable and replaced wholesale; nothing merges into them.
 */
public final class EndpointInventory {

    private final String endpointId;
    private final long generation;
    private final Map<String, NodeSnapshot> nodes;
    private final Map<VmKey, VmSnapshot> vms;
    private final Instant capturedAt;

    public EndpointInventory(String endpointId, long generation, List<NodeSnapshot> nodes, List<VmSnapshot> vms, Instant capturedAt) {
        this.endpointId = endpointId;
        this.generation = generation;
        Map<String, NodeSnapshot> nodeMap = new LinkedHashMap<>();
        for (NodeSnapshot node : nodes) {
            nodeMap.put(node.getNode(), node);
        }
        Map<VmKey, VmSnapshot> vmMap = new LinkedHashMap<>();
        for (VmSnapshot vm : vms) {
            vmMap.put(vm.getKey(), vm);
        }
        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.vms = Collections.unmodifiableMap(vmMap);
        this.capturedAt = capturedAt;
    }

    public String getEndpointId() { return endpointId; }
    public long getGeneration() { return generation; }
    public Instant getCapturedAt() { return capturedAt; }

    public Map<String, NodeSnapshot> getNodes() { return nodes; }
    public Map<VmKey, VmSnapshot> getVms() { return vms; }

    public NodeSnapshot node(String name) {
        return nodes.get(name);
    }

    public VmSnapshot vm(VmKey key) {
        return vms.get(key);
    }

    /**
     * A node that is listed but not online reports no fresh metrics for itself or its guests.
     */
    public boolean isNodeOnline(String name) {
        NodeSnapshot node = nodes.get(name);
        return node != null && node.isOnline();
    }

    @Override
    public String toString() {
        return "EndpointInventory{endpointId='" + endpointId + "', generation=" + generation +
               ", nodes=" + nodes.size() + ", vms=" + vms.size() + "}";
    }
}
