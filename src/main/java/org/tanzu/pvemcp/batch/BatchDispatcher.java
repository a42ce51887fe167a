package org.tanzu.pvemcp.batch;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.connection.EndpointConnection;
import org.tanzu.pvemcp.event.Broadcaster;
import org.tanzu.pvemcp.event.EventType;
import org.tanzu.pvemcp.event.PveEvent;
import org.tanzu.pvemcp.exception.ErrorKind;
import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PveException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.exception.PveTransientException;
import org.tanzu.pvemcp.inventory.InventoryStore;
import org.tanzu.pvemcp.inventory.VmKey;
import org.tanzu.pvemcp.inventory.VmKind;
import org.tanzu.pvemcp.inventory.VmSnapshot;
import org.tanzu.pvemcp.pve.PveApiClient;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs one action against many targets concurrently.
 *
 * Every target yields exactly one {@link BatchResult}, in the order of the targets:
 * - targets that fail pre-flight (missing or incomplete target, unknown endpoint, node or
 *   guest, action not applicable, denied shell command) get a failure without any remote call
 * - the others run on the shared bounded worker pool, each through its endpoint's
 *   request executor; a failure stays in its own result
 * - every remote call makes a single attempt, so an unreachable endpoint costs its
 *   targets one call timeout instead of a whole retry budget
 * - targets without a result when the dispatch deadline elapses are cancelled and get
 *   a TIMEOUT failure
 *
 * Every result is published as a COMMAND_RESULT event once the dispatch completes.
 * Nothing is stored; callers derive counts with {@link BatchResult#succeeded} and friends.
 *
 * {@link #statuses} reads the live status of many guests the same way, without any event.
 */
@Component
public class BatchDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BatchDispatcher.class);

    private final ConnectionRegistry connectionRegistry;
    private final InventoryStore inventoryStore;
    private final Broadcaster broadcaster;
    private final ExecutorService executor;
    private final CommandPolicy commandPolicy;
    private final Duration timeout;

    public BatchDispatcher(PveProperties pveProperties, ConnectionRegistry connectionRegistry, InventoryStore inventoryStore,
                           Broadcaster broadcaster, @Qualifier("pveBatchExecutor") ExecutorService executor) {
        this.connectionRegistry = connectionRegistry;
        this.inventoryStore = inventoryStore;
        this.broadcaster = broadcaster;
        this.executor = executor;
        this.commandPolicy = new CommandPolicy(pveProperties.getBatch().getDeniedCommands());
        this.timeout = pveProperties.getBatch().getTimeout();
        logger.info("BatchDispatcher initialized (timeout={}, denied command fragments={})",
                timeout, commandPolicy.getDenied().size());
    }

    /**
     * Dispatches an action to every target.
     *
     * @param targets Targets, possibly on different endpoints; may be empty
     * @param request The action and its parameters
     * @return One result per target, in target order; empty for no targets
     */
    public List<BatchResult> dispatch(List<BatchTarget> targets, ActionRequest request) {
        if (targets == null || targets.isEmpty()) {
            return List.of();
        }
        BatchAction action = request.getAction();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        BatchResult[] results = new BatchResult[targets.size()];

        PveException rejection = validate(request);
        List<Integer> indexes = new ArrayList<>();
        List<Callable<BatchResult>> tasks = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            BatchTarget target = targets.get(i);
            if (rejection != null) {
                results[i] = BatchResult.failure(target, action, rejection.getKind(), rejection.getMessage(), startedAt, 0);
                continue;
            }
            try {
                PreparedTarget prepared = preflight(target, action);
                indexes.add(i);
                tasks.add(() -> execute(prepared, request));
            } catch (PveException e) {
                results[i] = BatchResult.failure(target, action, e.getKind(), e.getMessage(), startedAt, 0);
            } catch (RuntimeException e) {
                logger.error("Pre-flight of {} on {} failed unexpectedly: {}", action, target, e.getMessage(), e);
                results[i] = BatchResult.failure(target, action, ErrorKind.INTERNAL, "Unexpected failure: " + e.getMessage(),
                        startedAt, 0);
            }
        }

        if (!tasks.isEmpty()) {
            collect(tasks, indexes, targets, action, results, startedAt, start);
        }

        List<BatchResult> list = Arrays.asList(results);
        for (BatchResult result : list) {
            BatchTarget target = result.getTarget();
            broadcaster.publish(PveEvent.of(EventType.COMMAND_RESULT, target == null ? null : target.getEndpointId(), result));
        }
        logger.info("Dispatched {} to {} target(s) in {} ms: {} succeeded ({} skipped), {} failed",
                action, list.size(), elapsedMillis(start), BatchResult.succeeded(list), BatchResult.skipped(list),
                BatchResult.failed(list));
        return list;
    }

    /**
     * Reads the live status of several guests concurrently, one attempt per guest.
     *
     * @param targets Guests, possibly on different endpoints; may be empty
     * @return One status per target, in target order; unreadable guests carry the cause
     */
    public List<GuestStatus> statuses(List<BatchTarget> targets) {
        if (targets == null || targets.isEmpty()) {
            return List.of();
        }
        GuestStatus[] statuses = new GuestStatus[targets.size()];
        List<Integer> indexes = new ArrayList<>();
        List<Callable<GuestStatus>> tasks = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            BatchTarget target = targets.get(i);
            try {
                PreparedTarget prepared = resolveGuest(target);
                indexes.add(i);
                tasks.add(() -> readStatus(prepared));
            } catch (PveException e) {
                statuses[i] = GuestStatus.failure(target, e.getKind(), e.getMessage());
            }
        }
        if (!tasks.isEmpty()) {
            List<Future<GuestStatus>> futures;
            try {
                futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PveTransientException("Status read interrupted", e);
            }
            for (int j = 0; j < futures.size(); j++) {
                int index = indexes.get(j);
                try {
                    statuses[index] = futures.get(j).get();
                } catch (CancellationException e) {
                    statuses[index] = GuestStatus.failure(targets.get(index), ErrorKind.TIMEOUT,
                            "No status within " + timeout);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    logger.error("Status read of {} crashed: {}", targets.get(index), cause.getMessage(), cause);
                    statuses[index] = GuestStatus.failure(targets.get(index), ErrorKind.INTERNAL,
                            "Unexpected failure: " + cause.getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PveTransientException("Status read interrupted", e);
                }
            }
        }
        return Arrays.asList(statuses);
    }

    private GuestStatus readStatus(PreparedTarget prepared) {
        BatchTarget target = prepared.target;
        try {
            JsonNode status = prepared.connection.getSingleAttemptApi().vms().status(target.getNode(), target.getKind(),
                    target.getVmid());
            return GuestStatus.fromJson(target, status);
        } catch (PveException e) {
            logger.warn("Status of {} unavailable ({}): {}", target, e.getKind(), e.getMessage());
            return GuestStatus.failure(target, e.getKind(), e.getMessage());
        }
    }

    private void collect(List<Callable<BatchResult>> tasks, List<Integer> indexes, List<BatchTarget> targets,
                         BatchAction action, BatchResult[] results, Instant startedAt, long start) {
        List<Future<BatchResult>> futures;
        try {
            futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (int index : indexes) {
                results[index] = BatchResult.failure(targets.get(index), action, ErrorKind.INTERNAL,
                        "Dispatch interrupted", startedAt, elapsedMillis(start));
            }
            return;
        }
        for (int j = 0; j < futures.size(); j++) {
            int index = indexes.get(j);
            BatchTarget target = targets.get(index);
            Future<BatchResult> future = futures.get(j);
            try {
                results[index] = future.get();
            } catch (CancellationException e) {
                results[index] = BatchResult.failure(target, action, ErrorKind.TIMEOUT,
                        "No result within the dispatch timeout of " + timeout, startedAt, elapsedMillis(start));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Batch target {} crashed: {}", target, cause.getMessage(), cause);
                results[index] = BatchResult.failure(target, action, ErrorKind.INTERNAL,
                        "Unexpected failure: " + cause.getMessage(), startedAt, elapsedMillis(start));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results[index] = BatchResult.failure(target, action, ErrorKind.INTERNAL,
                        "Dispatch interrupted", startedAt, elapsedMillis(start));
            }
        }
    }

    /**
     * Checks that apply to the request as a whole.
     * @return The rejection shared by every target, or null
     */
    private PveException validate(ActionRequest request) {
        try {
            if (request.getAction() == BatchAction.SHELL) {
                commandPolicy.check(request.getCommand());
            }
            if (request.getAction() == BatchAction.BACKUP && (request.getStorage() == null || request.getStorage().isBlank())) {
                throw new InvalidRequestException("Backup requires a target storage");
            }
            return null;
        } catch (PveException e) {
            logger.warn("Rejected {} before dispatch: {}", request.getAction(), e.getMessage());
            return e;
        }
    }

    private PreparedTarget preflight(BatchTarget target, BatchAction action) {
        if (action.isNodeLevel()) {
            EndpointConnection connection = resolveEndpoint(target);
            if (target.getVmid() != null) {
                throw new InvalidRequestException(action + " applies to nodes, not to guest " + target.getVmid());
            }
            if (inventoryStore.findNode(target.getEndpointId(), target.getNode()).isEmpty()) {
                throw new PveNotFoundException("Node '" + target.getNode() + "' not found on endpoint '" + target.getEndpointId() + "'");
            }
            return new PreparedTarget(target, connection);
        }

        PreparedTarget prepared = resolveGuest(target);
        if (action.isQemuOnly() && prepared.target.getKind() != VmKind.QEMU) {
            throw new InvalidRequestException(action + " applies to full VMs only, " + target + " is a container");
        }
        return prepared;
    }

    private EndpointConnection resolveEndpoint(BatchTarget target) {
        if (target == null) {
            throw new InvalidRequestException("Missing target");
        }
        if (target.getEndpointId() == null || target.getEndpointId().isBlank()) {
            throw new InvalidRequestException("Target " + target + " names no endpoint");
        }
        if (target.getNode() == null || target.getNode().isBlank()) {
            throw new InvalidRequestException("Target " + target + " names no node");
        }
        return connectionRegistry.find(target.getEndpointId())
            .orElseThrow(() -> new PveNotFoundException("Endpoint '" + target.getEndpointId() + "' is not registered"));
    }

    /**
     * Resolves a guest target against the inventory, filling in its kind.
     */
    private PreparedTarget resolveGuest(BatchTarget target) {
        EndpointConnection connection = resolveEndpoint(target);
        if (target.getVmid() == null) {
            throw new InvalidRequestException("Target " + target + " names no guest id");
        }
        VmSnapshot vm = inventoryStore.findVm(new VmKey(target.getEndpointId(), target.getNode(), target.getVmid()))
            .orElseThrow(() -> new PveNotFoundException("Guest " + target + " not found"));
        if (target.getKind() != null && target.getKind() != vm.getKind()) {
            throw new InvalidRequestException("Guest " + target + " is " + vm.getKind().getPath() + ", not " + target.getKind().getPath());
        }
        return new PreparedTarget(target.withKind(vm.getKind()), connection);
    }

    private BatchResult execute(PreparedTarget prepared, ActionRequest request) {
        BatchTarget target = prepared.target;
        BatchAction action = request.getAction();
        Instant startedAt = Instant.now();
        long start = System.nanoTime();
        try {
            PveApiClient api = prepared.connection.getSingleAttemptApi();
            switch (action) {
                case SHELL: {
                    JsonNode output = api.nodes().execute(target.getNode(), request.getCommand());
                    return BatchResult.success(target, action, null, text(output), startedAt, elapsedMillis(start));
                }
                case BACKUP: {
                    JsonNode upid = api.nodes().backup(target.getNode(), target.getVmid(), request.getStorage(),
                            request.getMode(), request.getCompress(), request.getNotes());
                    return BatchResult.success(target, action, null, text(upid), startedAt, elapsedMillis(start));
                }
                default: {
                    VmKind kind = target.getKind();
                    String status = effectiveStatus(api.vms().status(target.getNode(), kind, target.getVmid()));
                    if (action.isSatisfiedBy(status)) {
                        logger.debug("{} on {} skipped, guest is {}", action, target, status);
                        return BatchResult.skipped(target, action, status, startedAt, elapsedMillis(start));
                    }
                    JsonNode upid = api.vms().power(target.getNode(), kind, target.getVmid(), action.getPath());
                    return BatchResult.success(target, action, status, text(upid), startedAt, elapsedMillis(start));
                }
            }
        } catch (PveException e) {
            logger.warn("{} on {} failed ({}): {}", action, target, e.getKind(), e.getMessage());
            return BatchResult.failure(target, action, e.getKind(), e.getMessage(), startedAt, elapsedMillis(start));
        } catch (RuntimeException e) {
            logger.error("{} on {} failed unexpectedly: {}", action, target, e.getMessage(), e);
            return BatchResult.failure(target, action, ErrorKind.INTERNAL, "Unexpected failure: " + e.getMessage(),
                    startedAt, elapsedMillis(start));
        }
    }

    /**
     * A running VM whose QEMU monitor reports paused is paused.
     */
    static String effectiveStatus(JsonNode status) {
        if (BatchAction.PAUSED.equals(status.path("qmpstatus").asText())) {
            return BatchAction.PAUSED;
        }
        return status.path("status").asText("unknown");
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static long elapsedMillis(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    private static final class PreparedTarget {
        private final BatchTarget target;
        private final EndpointConnection connection;

        PreparedTarget(BatchTarget target, EndpointConnection connection) {
            this.target = target;
            this.connection = connection;
        }
    }
}
