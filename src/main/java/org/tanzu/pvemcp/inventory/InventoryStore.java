package org.tanzu.pvemcp.inventory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Latest inventory generation per endpoint.
 *
 * Single writer per endpoint (its poll loop, or the purge on removal), any number of
 * readers. The map is replaced copy-on-write, so a reader sees either the previous or
 * the next generation of an endpoint, never a mix.
 */
@Component
public class InventoryStore {

    private volatile Map<String, EndpointInventory> inventories = Collections.emptyMap();

    public Optional<EndpointInventory> get(String endpointId) {
        return Optional.ofNullable(inventories.get(endpointId));
    }

    /**
     * Installs a new generation for its endpoint.
     * @return The generation it replaced, or null
     */
    public synchronized EndpointInventory replace(EndpointInventory next) {
        Map<String, EndpointInventory> copy = new LinkedHashMap<>(inventories);
        EndpointInventory previous = copy.put(next.getEndpointId(), next);
        inventories = Collections.unmodifiableMap(copy);
        return previous;
    }

    /**
     * Drops everything known about an endpoint.
     * @return The purged generation, or null if there was none
     */
    public synchronized EndpointInventory purge(String endpointId) {
        if (!inventories.containsKey(endpointId)) {
            return null;
        }
        Map<String, EndpointInventory> copy = new LinkedHashMap<>(inventories);
        EndpointInventory previous = copy.remove(endpointId);
        inventories = Collections.unmodifiableMap(copy);
        return previous;
    }

    /**
     * @param endpointId Endpoint to list, or null for all endpoints
     */
    public List<NodeSnapshot> listNodes(String endpointId) {
        List<NodeSnapshot> result = new ArrayList<>();
        for (EndpointInventory inventory : select(endpointId)) {
            result.addAll(inventory.getNodes().values());
        }
        return result;
    }

    /**
     * @param endpointId Endpoint to list, or null for all endpoints
     */
    public List<VmSnapshot> listVms(String endpointId) {
        List<VmSnapshot> result = new ArrayList<>();
        for (EndpointInventory inventory : select(endpointId)) {
            result.addAll(inventory.getVms().values());
        }
        return result;
    }

    public Optional<NodeSnapshot> findNode(String endpointId, String node) {
        return get(endpointId).map(inventory -> inventory.node(node));
    }

    public Optional<VmSnapshot> findVm(VmKey key) {
        return get(key.getEndpointId()).map(inventory -> inventory.vm(key));
    }

    private List<EndpointInventory> select(String endpointId) {
        Map<String, EndpointInventory> current = inventories;
        if (endpointId == null || endpointId.isBlank()) {
            return new ArrayList<>(current.values());
        }
        EndpointInventory inventory = current.get(endpointId);
        return inventory == null ? List.of() : List.of(inventory);
    }
}
