package org.tanzu.pvemcp.inventory;

import java.util.Objects;

/**
 * Compares two generations of an endpoint's inventory by composite key.
 *
 * Status, name, capacity and the template flag compare exactly. CPU, memory and disk
 * usage compare as percentages and count as changed only when they moved by at least
 * the threshold (in percentage points) since the previous generation. Uptime and
 * network counters move on every poll and are not compared.
 */
public class SnapshotDiffer {

    private final double threshold;

    public SnapshotDiffer(double threshold) {
        if (threshold < 0) {
            throw new IllegalArgumentException("Change threshold must not be negative: " + threshold);
        }
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    /**
     * @param previous Previous generation, or null before the first successful poll
     * @param next New generation
     * @return The material differences
     */
    public InventoryDiff diff(EndpointInventory previous, EndpointInventory next) {
        InventoryDiff diff = new InventoryDiff();

        for (NodeSnapshot node : next.getNodes().values()) {
            NodeSnapshot before = previous == null ? null : previous.node(node.getNode());
            if (before == null) {
                diff.getAddedNodes().add(node);
            } else if (changed(before, node)) {
                diff.getChangedNodes().add(node);
            }
        }
        for (VmSnapshot vm : next.getVms().values()) {
            VmSnapshot before = previous == null ? null : previous.vm(vm.getKey());
            if (before == null) {
                diff.getAddedVms().add(vm);
            } else if (changed(before, vm)) {
                diff.getChangedVms().add(vm);
            }
        }
        if (previous != null) {
            for (NodeSnapshot node : previous.getNodes().values()) {
                if (next.node(node.getNode()) == null) {
                    diff.getRemovedNodes().add(node);
                }
            }
            for (VmSnapshot vm : previous.getVms().values()) {
                if (next.vm(vm.getKey()) == null) {
                    diff.getRemovedVms().add(vm);
                }
            }
        }
        return diff;
    }

    public boolean changed(NodeSnapshot before, NodeSnapshot after) {
        return !Objects.equals(before.getStatus(), after.getStatus())
            || before.getMaxCpu() != after.getMaxCpu()
            || before.getMaxMem() != after.getMaxMem()
            || before.getMaxDisk() != after.getMaxDisk()
            || beyond(before.getCpuPercent(), after.getCpuPercent())
            || beyond(before.getMemPercent(), after.getMemPercent())
            || beyond(before.getDiskPercent(), after.getDiskPercent());
    }

    public boolean changed(VmSnapshot before, VmSnapshot after) {
        return !Objects.equals(before.getStatus(), after.getStatus())
            || !Objects.equals(before.getName(), after.getName())
            || before.isTemplate() != after.isTemplate()
            || before.getCpus() != after.getCpus()
            || before.getMaxMem() != after.getMaxMem()
            || before.getMaxDisk() != after.getMaxDisk()
            || beyond(before.getCpuPercent(), after.getCpuPercent())
            || beyond(before.getMemPercent(), after.getMemPercent())
            || beyond(before.getDiskPercent(), after.getDiskPercent());
    }

    private boolean beyond(Double before, Double after) {
        if (Objects.equals(before, after)) {
            return false;
        }
        if (before == null || after == null) {
            return true;
        }
        return Math.abs(after - before) >= threshold;
    }
}
