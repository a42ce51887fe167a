package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.tanzu.pvemcp.alert.AlertAction;
import org.tanzu.pvemcp.alert.AlertActionReport;
import org.tanzu.pvemcp.alert.AlertEngine;
import org.tanzu.pvemcp.alert.AlertFilter;
import org.tanzu.pvemcp.alert.AlertKind;
import org.tanzu.pvemcp.alert.AlertLevel;
import org.tanzu.pvemcp.alert.AlertRecord;
import org.tanzu.pvemcp.alert.AlertSource;
import org.tanzu.pvemcp.alert.AlertStats;
import org.tanzu.pvemcp.alert.AlertStatus;
import org.tanzu.pvemcp.batch.ActionRequest;
import org.tanzu.pvemcp.batch.BatchAction;
import org.tanzu.pvemcp.batch.BatchDispatcher;
import org.tanzu.pvemcp.batch.BatchResult;
import org.tanzu.pvemcp.batch.BatchTarget;
import org.tanzu.pvemcp.batch.GuestStatus;
import org.tanzu.pvemcp.client.Credentials;
import org.tanzu.pvemcp.client.EndpointConfig;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.connection.ConnectionStats;
import org.tanzu.pvemcp.event.Broadcaster;
import org.tanzu.pvemcp.event.PveEvent;
import org.tanzu.pvemcp.event.SnapshotKind;
import org.tanzu.pvemcp.event.StateSnapshot;
import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PveException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.inventory.InventoryStore;
import org.tanzu.pvemcp.inventory.NodeSnapshot;
import org.tanzu.pvemcp.inventory.VmKey;
import org.tanzu.pvemcp.inventory.VmSnapshot;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Service class that provides MCP (Model Context Protocol) tools for PVE fleet operations.
 *
 * This service is the downstream surface of the engine. It exposes as MCP tools:
 * - endpoint administration: addEndpoint, removeEndpoint, testEndpoint
 * - state pulls: listConnections, getConnectionStats, listNodes, listVMs
 * - commands: dispatchAction, dispatchBatch, getVmStatuses, listBackupStorages, getVmConfig,
 *   updateVmConfig, getTaskStatus
 * - alerts: listAlerts, createAlert, getAlertStats, acknowledgeAlert, resolveAlert, deleteAlert,
 *   applyAlertAction
 *
 * In-process consumers can also {@link #subscribe()} to the event stream and
 * {@link #requestSnapshot(String)}.
 *
 * Administrative tools report failures in an {@link OperationResult}; batch tools
 * report them per target. Other tools log the failure and rethrow it with a readable
 * message. Credentials are never echoed back.
 */
@Service
public class PveService {

    private static final Logger logger = LoggerFactory.getLogger(PveService.class);

    private static final String BACKUP_CONTENT = "backup";

    private final PveProperties pveProperties;
    private final ConnectionRegistry connectionRegistry;
    private final InventoryStore inventoryStore;
    private final BatchDispatcher batchDispatcher;
    private final AlertEngine alertEngine;
    private final Broadcaster broadcaster;

    public PveService(PveProperties pveProperties, ConnectionRegistry connectionRegistry, InventoryStore inventoryStore,
                      BatchDispatcher batchDispatcher, AlertEngine alertEngine, Broadcaster broadcaster) {
        this.pveProperties = pveProperties;
        this.connectionRegistry = connectionRegistry;
        this.inventoryStore = inventoryStore;
        this.batchDispatcher = batchDispatcher;
        this.alertEngine = alertEngine;
        this.broadcaster = broadcaster;
        logger.info("PveService initialized");
    }

    /**
     * Registers the endpoints found in configuration once the application is ready.
     * An invalid entry is logged and skipped.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void registerConfiguredEndpoints() {
        for (PveProperties.Endpoint endpoint : pveProperties.getEndpoints()) {
            if (!endpoint.isComplete()) {
                logger.warn("Skipping incomplete endpoint configuration: {}", endpoint);
                continue;
            }
            try {
                connectionRegistry.add(endpoint.toEndpointConfig());
            } catch (RuntimeException e) {
                logger.error("Failed to register configured endpoint '{}': {}", endpoint.getId(), e.getMessage(), e);
            }
        }
    }

    /**
     * MCP tool: Registers a PVE endpoint. The endpoint is not contacted until it is
     * first polled or tested.
     *
     * @return ok, or the reason the endpoint could not be added
     */
    @Tool(description = "Register a PVE cluster endpoint. Parameters: id (String) - unique identifier, name (String, optional) - display name, " +
            "host (String) - host name or IP, port (Integer, optional, default 8006), username (String), password (String), " +
            "realm (String, optional, default pam), ssl (Boolean, optional, default true)")
    public OperationResult addEndpoint(String id, String name, String host, Integer port, String username,
                                       String password, String realm, Boolean ssl) {
        logger.info("=== MCP TOOL CALLED: addEndpoint({}, {}) ===", id, host);
        try {
            if (isBlank(id) || isBlank(host) || isBlank(username) || isBlank(password)) {
                return OperationResult.error("id, host, username and password are required");
            }
            EndpointConfig config = new EndpointConfig(id, name, host, port == null ? EndpointConfig.DEFAULT_PORT : port,
                    new Credentials(username, realm, password), ssl == null || ssl);
            connectionRegistry.add(config);
            return OperationResult.ok("Endpoint '" + id + "' added");
        } catch (RuntimeException e) {
            logger.warn("Failed to add endpoint '{}': {}", id, e.getMessage());
            return OperationResult.error(e.getMessage());
        }
    }

    /**
     * MCP tool: Removes an endpoint, stopping its polling and forgetting its inventory.
     */
    @Tool(description = "Remove a PVE endpoint, stop polling it and discard its nodes and VMs. Parameter: id (String) - the endpoint id")
    public OperationResult removeEndpoint(String id) {
        logger.info("=== MCP TOOL CALLED: removeEndpoint({}) ===", id);
        try {
            connectionRegistry.remove(id);
            return OperationResult.ok("Endpoint '" + id + "' removed");
        } catch (PveException e) {
            return OperationResult.error(e.getMessage());
        }
    }

    /**
     * MCP tool: Logs in to an endpoint and calls its version API.
     */
    @Tool(description = "Test a PVE endpoint by logging in and reading its version. Parameter: id (String) - the endpoint id")
    public OperationResult testEndpoint(String id) {
        logger.info("=== MCP TOOL CALLED: testEndpoint({}) ===", id);
        try {
            if (connectionRegistry.test(id)) {
                return OperationResult.ok("Endpoint '" + id + "' is reachable");
            }
            String cause = connectionRegistry.require(id).getState().getLastError();
            return OperationResult.error("Endpoint '" + id + "' test failed" + (cause != null ? ": " + cause : ""));
        } catch (PveException e) {
            return OperationResult.error(e.getMessage());
        }
    }

    @Tool(description = "List all registered PVE endpoints with their connection status and last error")
    public List<ConnectionState> listConnections() {
        logger.info("=== MCP TOOL CALLED: listConnections() ===");
        return connectionRegistry.list();
    }

    @Tool(description = "Get counts of PVE endpoints by connection status and the share of connected endpoints")
    public ConnectionStats getConnectionStats() {
        logger.info("=== MCP TOOL CALLED: getConnectionStats() ===");
        return connectionRegistry.stats();
    }

    /**
     * MCP tool: Lists nodes as of the last successful poll.
     *
     * @param endpointId Endpoint to list, or null for all
     */
    @Tool(description = "List cluster nodes with status, CPU, memory and disk usage as of the last poll. " +
            "Parameter: endpointId (String, optional) - restrict to one endpoint")
    public List<NodeSnapshot> listNodes(String endpointId) {
        logger.info("=== MCP TOOL CALLED: listNodes({}) ===", endpointId);
        return inventoryStore.listNodes(endpointId);
    }

    /**
     * MCP tool: Lists VMs and containers as of the last successful poll.
     *
     * @param endpointId Endpoint to list, or null for all
     */
    @Tool(description = "List VMs and containers with status and resource usage as of the last poll. " +
            "Parameter: endpointId (String, optional) - restrict to one endpoint")
    public List<VmSnapshot> listVMs(String endpointId) {
        logger.info("=== MCP TOOL CALLED: listVMs({}) ===", endpointId);
        return inventoryStore.listVms(endpointId);
    }

    /**
     * MCP tool: Runs one action against one target.
     */
    @Tool(description = "Run one action against one target. Parameters: endpointId (String), node (String), " +
            "vmid (Integer, omit for shell), action (String) - start, stop, shutdown, reboot, suspend, resume, backup or shell, " +
            "command (String, shell only), storage (String, backup only), mode (String, backup only) - snapshot (default), " +
            "suspend or stop, compress (String, backup only) - zstd (default), lzo, gzip or 0, notes (String, backup only, optional)")
    public BatchResult dispatchAction(String endpointId, String node, Integer vmid, String action,
                                      String command, String storage, String mode, String compress, String notes) {
        logger.info("=== MCP TOOL CALLED: dispatchAction({}, {}, {}, {}) ===", endpointId, node, vmid, action);
        List<BatchResult> results = batchDispatcher.dispatch(
                List.of(new BatchTarget(endpointId, node, vmid, null)), request(action, command, storage, mode, compress, notes));
        return results.get(0);
    }

    /**
     * MCP tool: Runs one action against many targets concurrently.
     */
    @Tool(description = "Run one action against many targets concurrently; each target gets its own result. Parameters: " +
            "targets (List of {endpointId, node, vmid}), action (String) - start, stop, shutdown, reboot, suspend, resume, backup or shell, " +
            "command (String, shell only), storage (String, backup only), mode (String, backup only) - snapshot (default), " +
            "suspend or stop, compress (String, backup only) - zstd (default), lzo, gzip or 0, notes (String, backup only, optional)")
    public BatchReport dispatchBatch(List<BatchTarget> targets, String action, String command, String storage,
                                     String mode, String compress, String notes) {
        logger.info("=== MCP TOOL CALLED: dispatchBatch({} targets, {}) ===", targets == null ? 0 : targets.size(), action);
        ActionRequest request = request(action, command, storage, mode, compress, notes);
        return new BatchReport(request.getAction(), batchDispatcher.dispatch(targets, request));
    }

    /**
     * MCP tool: Reads the live status of several guests concurrently.
     */
    @Tool(description = "Read the live status of several VMs or containers directly from their endpoints, concurrently. " +
            "Parameter: targets (List of {endpointId, node, vmid}). Guests that cannot be read carry the cause")
    public List<GuestStatus> getVmStatuses(List<BatchTarget> targets) {
        logger.info("=== MCP TOOL CALLED: getVmStatuses({} targets) ===", targets == null ? 0 : targets.size());
        return batchDispatcher.statuses(targets);
    }

    /**
     * MCP tool: Lists the storages of an endpoint that accept backups.
     */
    @Tool(description = "List the storages that accept backups, to choose the storage of a backup action. " +
            "Parameters: endpointId (String), node (String, optional) - only this node, otherwise every online node")
    public List<BackupStorage> listBackupStorages(String endpointId, String node) {
        logger.info("=== MCP TOOL CALLED: listBackupStorages({}, {}) ===", endpointId, node);
        try {
            PveApiClient api = connectionRegistry.require(endpointId).getApi();
            List<String> nodes = new ArrayList<>();
            if (!isBlank(node)) {
                nodes.add(node);
            } else {
                for (JsonNode json : api.nodes().list()) {
                    if (NodeSnapshot.ONLINE.equals(json.path("status").asText())) {
                        nodes.add(json.path("node").asText());
                    }
                }
            }
            List<BackupStorage> storages = new ArrayList<>();
            for (String name : nodes) {
                for (JsonNode json : api.nodes().storages(name, BACKUP_CONTENT)) {
                    if (BackupStorage.acceptsBackups(json)) {
                        storages.add(BackupStorage.fromJson(endpointId, name, json));
                    }
                }
            }
            logger.info("Found {} backup storage(s) on '{}'", storages.size(), endpointId);
            return storages;
        } catch (Exception e) {
            logger.error("Failed to list backup storages of {}: {}", endpointId, e.getMessage(), e);
            throw new RuntimeException("Failed to list backup storages of " + endpointId + ": " + e.getMessage(), e);
        }
    }

    @Tool(description = "Read the configuration of a VM or container. Parameters: endpointId (String), node (String), vmid (Integer)")
    public JsonNode getVmConfig(String endpointId, String node, Integer vmid) {
        logger.info("=== MCP TOOL CALLED: getVmConfig({}, {}, {}) ===", endpointId, node, vmid);
        try {
            VmSnapshot vm = requireVm(endpointId, node, vmid);
            return connectionRegistry.require(endpointId).getApi().vms().config(node, vm.getKind(), vmid);
        } catch (Exception e) {
            logger.error("Failed to read config of {}/{}/{}: {}", endpointId, node, vmid, e.getMessage(), e);
            throw new RuntimeException("Failed to read config of " + endpointId + "/" + node + "/" + vmid + ": " + e.getMessage(), e);
        }
    }

    @Tool(description = "Update configuration keys of a VM or container. Parameters: endpointId (String), node (String), " +
            "vmid (Integer), changes (Map of configuration key to new value, for example memory=4096)")
    public OperationResult updateVmConfig(String endpointId, String node, Integer vmid, Map<String, String> changes) {
        logger.info("=== MCP TOOL CALLED: updateVmConfig({}, {}, {}) ===", endpointId, node, vmid);
        if (changes == null || changes.isEmpty()) {
            return OperationResult.error("No configuration changes given");
        }
        try {
            VmSnapshot vm = requireVm(endpointId, node, vmid);
            connectionRegistry.require(endpointId).getApi().vms().updateConfig(node, vm.getKind(), vmid, changes);
            return OperationResult.ok("Updated " + changes.keySet() + " of " + vm.getKey());
        } catch (PveException e) {
            logger.warn("Failed to update config of {}/{}/{}: {}", endpointId, node, vmid, e.getMessage());
            return OperationResult.error(e.getMessage());
        }
    }

    @Tool(description = "Get the status of an asynchronous PVE task. Parameters: endpointId (String), node (String), upid (String) - the task id")
    public JsonNode getTaskStatus(String endpointId, String node, String upid) {
        logger.info("=== MCP TOOL CALLED: getTaskStatus({}, {}, {}) ===", endpointId, node, upid);
        try {
            return connectionRegistry.require(endpointId).getApi().tasks().status(node, upid);
        } catch (Exception e) {
            logger.error("Failed to read task {} on {}/{}: {}", upid, endpointId, node, e.getMessage(), e);
            throw new RuntimeException("Failed to read task " + upid + ": " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: Lists alerts, newest first.
     */
    @Tool(description = "List alerts, newest first. Parameters (all optional): status (String) - active, acknowledged or resolved, " +
            "level (String) - critical, warning or info, kind (String) - performance, network, system or connection, endpointId (String)")
    public List<AlertRecord> listAlerts(String status, String level, String kind, String endpointId) {
        logger.info("=== MCP TOOL CALLED: listAlerts({}, {}, {}, {}) ===", status, level, kind, endpointId);
        try {
            AlertFilter filter = new AlertFilter(parse(AlertStatus.class, status), parse(AlertLevel.class, level),
                    parse(AlertKind.class, kind), isBlank(endpointId) ? null : endpointId);
            return alertEngine.list(filter);
        } catch (Exception e) {
            logger.error("Failed to list alerts: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list alerts: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: Records an alert reported by an operator or an external monitor.
     */
    @Tool(description = "Create an alert for a condition noticed outside the automatic checks. Parameters: " +
            "title (String), description (String, optional), level (String, optional) - critical, warning (default) or info, " +
            "kind (String, optional) - performance, network, system (default) or connection, endpointId (String), " +
            "node (String, optional), vmid (Integer, optional, requires node)")
    public AlertRecord createAlert(String title, String description, String level, String kind,
                                   String endpointId, String node, Integer vmid) {
        logger.info("=== MCP TOOL CALLED: createAlert({}, {}, {}) ===", level, kind, endpointId);
        try {
            return alertEngine.report(parse(AlertLevel.class, level), parse(AlertKind.class, kind),
                    alertSource(endpointId, node, vmid), title, description);
        } catch (Exception e) {
            logger.error("Failed to create alert on {}: {}", endpointId, e.getMessage());
            throw new RuntimeException("Failed to create alert: " + e.getMessage(), e);
        }
    }

    @Tool(description = "Get alert counts by status and open alert counts by level")
    public AlertStats getAlertStats() {
        logger.info("=== MCP TOOL CALLED: getAlertStats() ===");
        return alertEngine.stats();
    }

    @Tool(description = "Acknowledge an open alert. Parameters: id (String) - the alert id, by (String, optional) - who acknowledges it")
    public AlertRecord acknowledgeAlert(String id, String by) {
        logger.info("=== MCP TOOL CALLED: acknowledgeAlert({}) ===", id);
        try {
            return alertEngine.acknowledge(id, by);
        } catch (Exception e) {
            logger.error("Failed to acknowledge alert {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to acknowledge alert " + id + ": " + e.getMessage(), e);
        }
    }

    @Tool(description = "Resolve an open alert. Parameter: id (String) - the alert id")
    public AlertRecord resolveAlert(String id) {
        logger.info("=== MCP TOOL CALLED: resolveAlert({}) ===", id);
        try {
            return alertEngine.resolve(id);
        } catch (Exception e) {
            logger.error("Failed to resolve alert {}: {}", id, e.getMessage());
            throw new RuntimeException("Failed to resolve alert " + id + ": " + e.getMessage(), e);
        }
    }

    @Tool(description = "Delete an alert. Parameter: id (String) - the alert id")
    public OperationResult deleteAlert(String id) {
        logger.info("=== MCP TOOL CALLED: deleteAlert({}) ===", id);
        try {
            alertEngine.delete(id);
            return OperationResult.ok("Alert '" + id + "' deleted");
        } catch (PveNotFoundException e) {
            return OperationResult.error(e.getMessage());
        }
    }

    @Tool(description = "Apply one action to several alerts. Parameters: ids (List of String) - alert ids, " +
            "action (String) - acknowledge, resolve or delete, by (String, optional) - who applies it")
    public AlertActionReport applyAlertAction(List<String> ids, String action, String by) {
        logger.info("=== MCP TOOL CALLED: applyAlertAction({} ids, {}) ===", ids == null ? 0 : ids.size(), action);
        try {
            return alertEngine.apply(ids == null ? List.of() : ids, AlertAction.fromValue(action), by);
        } catch (Exception e) {
            logger.error("Failed to apply alert action {}: {}", action, e.getMessage());
            throw new RuntimeException("Failed to apply alert action " + action + ": " + e.getMessage(), e);
        }
    }

    /**
     * Subscribes to the event stream: a SNAPSHOT first, then every change in order.
     */
    public Flux<PveEvent> subscribe() {
        return broadcaster.subscribe();
    }

    /**
     * @param kind connections, nodes, vms or all (default)
     */
    public StateSnapshot requestSnapshot(String kind) {
        return broadcaster.request(SnapshotKind.fromValue(kind));
    }

    private ActionRequest request(String action, String command, String storage, String mode, String compress,
                                  String notes) {
        try {
            return new ActionRequest(BatchAction.fromValue(action), command, storage, mode, compress, notes);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid action '{}': {}", action, e.getMessage());
            throw new RuntimeException("Invalid action '" + action + "': " + e.getMessage(), e);
        }
    }

    private AlertSource alertSource(String endpointId, String node, Integer vmid) {
        if (isBlank(endpointId)) {
            throw new InvalidRequestException("An alert needs an endpoint");
        }
        if (vmid != null) {
            if (isBlank(node)) {
                throw new InvalidRequestException("A guest alert needs the guest's node");
            }
            String name = inventoryStore.findVm(new VmKey(endpointId, node, vmid))
                    .map(VmSnapshot::getName)
                    .orElse("guest");
            return AlertSource.vm(endpointId, node, vmid, name);
        }
        if (!isBlank(node)) {
            return AlertSource.node(endpointId, node);
        }
        String name = connectionRegistry.find(endpointId).map(connection -> connection.getConfig().getName()).orElse(endpointId);
        return AlertSource.endpoint(endpointId, name);
    }

    private VmSnapshot requireVm(String endpointId, String node, Integer vmid) {
        if (vmid == null) {
            throw new PveNotFoundException("A guest id is required");
        }
        connectionRegistry.require(endpointId);
        return inventoryStore.findVm(new VmKey(endpointId, node, vmid))
                .orElseThrow(() -> new PveNotFoundException("Guest " + endpointId + "/" + node + "/" + vmid + " not found"));
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value) {
        if (isBlank(value)) {
            return null;
        }
        return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
