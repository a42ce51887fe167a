package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.pvemcp.client.RequestExecutor;
import org.tanzu.pvemcp.inventory.VmKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed access to the PVE REST API of one endpoint.
 *
 * Every call goes through the endpoint's {@link RequestExecutor}, which attaches the
 * session, retries transient failures and records the connection status. The client is
 * organized into service interfaces by resource:
 * - NodeService: node listing, storages, shell execution and backups
 * - VmService: guest listing, status, power actions and configuration
 * - TaskService: asynchronous task status
 *
 * Results are the {@code data} member of the API answer. A client normally uses the
 * executor's retry budget; {@link #singleAttempt()} gives a view that makes exactly one
 * attempt per call, so the cost of an unreachable endpoint stays bounded by one call
 * timeout.
 */
public class PveApiClient {

    private static final Logger logger = LoggerFactory.getLogger(PveApiClient.class);

    private static final int DEFAULT_RETRIES = -1;

    private final RequestExecutor executor;
    private final int maxRetries;
    private final NodeService nodeService = new NodeService();
    private final VmService vmService = new VmService();
    private final TaskService taskService = new TaskService();

    public PveApiClient(RequestExecutor executor) {
        this(executor, DEFAULT_RETRIES);
    }

    private PveApiClient(RequestExecutor executor, int maxRetries) {
        this.executor = executor;
        this.maxRetries = maxRetries;
    }

    /**
     * @return A client over the same executor that never retries transient failures
     */
    public PveApiClient singleAttempt() {
        return new PveApiClient(executor, 0);
    }

    /**
     * Gets the API version document ({@code GET /version}).
     * @return The version, release and repository id
     */
    public JsonNode version() {
        return call(HttpMethod.GET, "/version", Map.of());
    }

    private JsonNode call(HttpMethod method, String path, Map<String, ?> params) {
        if (maxRetries == DEFAULT_RETRIES) {
            return executor.execute(method, path, params);
        }
        return executor.execute(method, path, params, maxRetries);
    }

    public NodeService nodes() { return nodeService; }
    public VmService vms() { return vmService; }
    public TaskService tasks() { return taskService; }

    /**
     * Service interface for node operations.
     */
    public class NodeService {

        /**
         * Lists the cluster's nodes ({@code GET /nodes}).
         * @return Array of node documents
         */
        public JsonNode list() {
            logger.debug("PVE NODE SERVICE: list() on '{}'", executor.getEndpointId());
            return call(HttpMethod.GET, "/nodes", Map.of());
        }

        /**
         * Lists the storages of a node ({@code GET /nodes/{node}/storage}).
         *
         * @param node Node name
         * @param content Content type the storage must accept, for example {@code backup}; null for all
         * @return Array of storage documents with usage figures
         */
        public JsonNode storages(String node, String content) {
            logger.debug("PVE NODE SERVICE: storages({}) on '{}/{}'", content, executor.getEndpointId(), node);
            Map<String, Object> params = new LinkedHashMap<>();
            if (content != null) {
                params.put("content", content);
            }
            return call(HttpMethod.GET, "/nodes/" + node + "/storage", params);
        }

        /**
         * Runs a shell command on a node ({@code POST /nodes/{node}/execute}).
         *
         * @param node Node name
         * @param command Command line, already checked against the denylist
         * @return The command output
         */
        public JsonNode execute(String node, String command) {
            logger.info("PVE NODE SERVICE: execute on '{}/{}'", executor.getEndpointId(), node);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("command", command);
            return call(HttpMethod.POST, "/nodes/" + node + "/execute", params);
        }

        /**
         * Starts a backup of one guest ({@code POST /nodes/{node}/vzdump}).
         *
         * @param node Node hosting the guest
         * @param vmid Guest id
         * @param storage Target storage id
         * @param mode Backup mode (snapshot, suspend or stop)
         * @param compress Compression algorithm
         * @param notes Optional notes template; may be null
         * @return The task id (UPID)
         */
        public JsonNode backup(String node, int vmid, String storage, String mode, String compress, String notes) {
            logger.info("PVE NODE SERVICE: backup({}) on '{}/{}' to '{}'", vmid, executor.getEndpointId(), node, storage);
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("vmid", vmid);
            params.put("storage", storage);
            params.put("mode", mode);
            params.put("compress", compress);
            params.put("notes-template", notes);
            return call(HttpMethod.POST, "/nodes/" + node + "/vzdump", params);
        }
    }

    /**
     * Service interface for guest operations.
     */
    public class VmService {

        /**
         * Lists the guests of one kind on a node ({@code GET /nodes/{node}/qemu|lxc}).
         */
        public JsonNode list(String node, VmKind kind) {
            logger.debug("PVE VM SERVICE: list({}) on '{}/{}'", kind.getPath(), executor.getEndpointId(), node);
            return call(HttpMethod.GET, "/nodes/" + node + "/" + kind.getPath(), Map.of());
        }

        /**
         * Gets the live status of a guest ({@code GET .../status/current}).
         * Full VMs also report {@code qmpstatus}, which distinguishes paused from running.
         */
        public JsonNode status(String node, VmKind kind, int vmid) {
            return call(HttpMethod.GET, guestPath(node, kind, vmid) + "/status/current", Map.of());
        }

        /**
         * Requests a power state change ({@code POST .../status/{action}}).
         *
         * @param action One of start, stop, shutdown, reboot, suspend, resume
         * @return The task id (UPID)
         */
        public JsonNode power(String node, VmKind kind, int vmid, String action) {
            logger.info("PVE VM SERVICE: {}({}) on '{}/{}'", action, vmid, executor.getEndpointId(), node);
            return call(HttpMethod.POST, guestPath(node, kind, vmid) + "/status/" + action, Map.of());
        }

        /**
         * Reads a guest's configuration ({@code GET .../config}).
         */
        public JsonNode config(String node, VmKind kind, int vmid) {
            return call(HttpMethod.GET, guestPath(node, kind, vmid) + "/config", Map.of());
        }

        /**
         * Updates configuration keys of a guest ({@code PUT .../config}).
         *
         * @param changes Configuration keys and their new values
         */
        public JsonNode updateConfig(String node, VmKind kind, int vmid, Map<String, ?> changes) {
            logger.info("PVE VM SERVICE: updateConfig({}) keys {} on '{}/{}'", vmid, changes.keySet(), executor.getEndpointId(), node);
            return call(HttpMethod.PUT, guestPath(node, kind, vmid) + "/config", changes);
        }

        private String guestPath(String node, VmKind kind, int vmid) {
            return "/nodes/" + node + "/" + kind.getPath() + "/" + vmid;
        }
    }

    /**
     * Service interface for task operations.
     */
    public class TaskService {

        /**
         * Gets the status of an asynchronous task ({@code GET /nodes/{node}/tasks/{upid}/status}).
         */
        public JsonNode status(String node, String upid) {
            return call(HttpMethod.GET, "/nodes/" + node + "/tasks/" + upid + "/status", Map.of());
        }
    }
}
