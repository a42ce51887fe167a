package org.tanzu.pvemcp.inventory;

import java.util.ArrayList;
import java.util.List;

/**
 * Material differences between two generations of one endpoint's inventory.
 * Removed entries carry the last known snapshot; added and changed entries the new one.
 */
public class InventoryDiff {

    private final List<NodeSnapshot> addedNodes = new ArrayList<>();
    private final List<NodeSnapshot> removedNodes = new ArrayList<>();
    private final List<NodeSnapshot> changedNodes = new ArrayList<>();
    private final List<VmSnapshot> addedVms = new ArrayList<>();
    private final List<VmSnapshot> removedVms = new ArrayList<>();
    private final List<VmSnapshot> changedVms = new ArrayList<>();

    public List<NodeSnapshot> getAddedNodes() { return addedNodes; }
    public List<NodeSnapshot> getRemovedNodes() { return removedNodes; }
    public List<NodeSnapshot> getChangedNodes() { return changedNodes; }
    public List<VmSnapshot> getAddedVms() { return addedVms; }
    public List<VmSnapshot> getRemovedVms() { return removedVms; }
    public List<VmSnapshot> getChangedVms() { return changedVms; }

    public boolean isEmpty() {
        return addedNodes.isEmpty() && removedNodes.isEmpty() && changedNodes.isEmpty()
            && addedVms.isEmpty() && removedVms.isEmpty() && changedVms.isEmpty();
    }

    public int size() {
        return addedNodes.size() + removedNodes.size() + changedNodes.size()
            + addedVms.size() + removedVms.size() + changedVms.size();
    }

    @Override
    public String toString() {
        return "InventoryDiff{nodes +" + addedNodes.size() + " -" + removedNodes.size() + " ~" + changedNodes.size() +
               ", vms +" + addedVms.size() + " -" + removedVms.size() + " ~" + changedVms.size() + "}";
    }
}
