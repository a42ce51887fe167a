package org.tanzu.pvemcp.event;

import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.inventory.NodeSnapshot;
import org.tanzu.pvemcp.inventory.VmSnapshot;

import java.util.List;

/**
 * Consistent view of the engine's state as of one broadcast sequence number.
 * Parts not requested are empty.
 */
public class StateSnapshot {

    private final SnapshotKind kind;
    private final long sequence;
    private final List<ConnectionState> connections;
    private final List<NodeSnapshot> nodes;
    private final List<VmSnapshot> vms;

    public StateSnapshot(SnapshotKind kind, long sequence, List<ConnectionState> connections,
                         List<NodeSnapshot> nodes, List<VmSnapshot> vms) {
        this.kind = kind;
        this.sequence = sequence;
        this.connections = List.copyOf(connections);
        this.nodes = List.copyOf(nodes);
        this.vms = List.copyOf(vms);
    }

    public SnapshotKind getKind() { return kind; }
    public long getSequence() { return sequence; }
    public List<ConnectionState> getConnections() { return connections; }
    public List<NodeSnapshot> getNodes() { return nodes; }
    public List<VmSnapshot> getVms() { return vms; }

    @Override
    public String toString() {
        return "StateSnapshot{kind=" + kind + ", sequence=" + sequence + ", connections=" + connections.size() +
               ", nodes=" + nodes.size() + ", vms=" + vms.size() + "}";
    }
}
