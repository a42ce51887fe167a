package org.tanzu.pvemcp.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.alert.AlertEngine;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionListener;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.connection.ConnectionStatus;
import org.tanzu.pvemcp.connection.EndpointConnection;
import org.tanzu.pvemcp.event.Broadcaster;
import org.tanzu.pvemcp.event.EventType;
import org.tanzu.pvemcp.event.PveEvent;
import org.tanzu.pvemcp.exception.PveAuthException;
import org.tanzu.pvemcp.exception.PveException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.pve.PveApiClient;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps every endpoint's inventory current.
 *
 * Each registered endpoint gets its own poll loop. The scheduler only times the loop;
 * each cycle runs on the poll worker pool, which grows with the cycles in flight, so
 * endpoints are polled independently however slow some of them are. A cycle
 * fetches the node list, then the full VMs and containers of every online node, diffs
 * the result against the previous generation and commits the new generation together
 * with its change events through the {@link Broadcaster}. The {@link AlertEngine} then
 * evaluates the committed generation. A loop schedules its next cycle only when the
 * current one has finished, so cycles of one endpoint never overlap.
 *
 * A failed cycle keeps the previous generation and delays the next cycle, doubling the
 * delay from the poll interval up to the configured ceiling. An authentication failure
 * halts the loop until the endpoint is seen connected again, for example after a
 * successful test.
 *
 * Removing an endpoint cancels its loop, interrupting a cycle in flight, and purges its
 * inventory. A cycle that finishes after the removal cannot commit.
 */
@Component
public class StatePoller implements ConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(StatePoller.class);

    enum Outcome { SUCCESS, FAILED, HALTED, CANCELLED }

    private final ConnectionRegistry connectionRegistry;
    private final InventoryStore inventoryStore;
    private final Broadcaster broadcaster;
    private final AlertEngine alertEngine;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final SnapshotDiffer differ;
    private final Duration interval;
    private final Duration maxBackoff;
    private final Map<String, PollTask> tasks = new ConcurrentHashMap<>();

    public StatePoller(PveProperties pveProperties, ConnectionRegistry connectionRegistry, InventoryStore inventoryStore,
                       Broadcaster broadcaster, AlertEngine alertEngine,
                       @Qualifier("pvePollScheduler") ScheduledExecutorService scheduler,
                       @Qualifier("pvePollWorkers") ExecutorService workers) {
        this.connectionRegistry = connectionRegistry;
        this.inventoryStore = inventoryStore;
        this.broadcaster = broadcaster;
        this.alertEngine = alertEngine;
        this.scheduler = scheduler;
        this.workers = workers;
        PveProperties.Polling polling = pveProperties.getPolling();
        this.differ = new SnapshotDiffer(polling.getChangeThreshold());
        this.interval = polling.getInterval();
        this.maxBackoff = polling.getMaxBackoff();
        logger.info("StatePoller initialized (interval={}, maxBackoff={}, changeThreshold={})",
                interval, maxBackoff, polling.getChangeThreshold());
    }

    @PostConstruct
    public void register() {
        connectionRegistry.addListener(this);
    }

    @Override
    public void endpointAdded(EndpointConnection connection) {
        PollTask task = new PollTask(connection);
        PollTask replaced = tasks.put(connection.getId(), task);
        if (replaced != null) {
            replaced.cancel();
        }
        task.scheduleNext(Duration.ZERO);
    }

    @Override
    public void endpointRemoved(EndpointConnection connection) {
        String id = connection.getId();
        PollTask task = tasks.get(id);
        if (task != null && task.connection == connection) {
            tasks.remove(id, task);
            task.cancel();
        }
        broadcaster.publishWith(
            () -> {
                inventoryStore.purge(id);
                return true;
            },
            () -> List.of(PveEvent.of(EventType.ENDPOINT_REMOVED, id, id)));
        logger.info("Stopped polling and purged inventory of endpoint '{}'", id);
    }

    @Override
    public void statusChanged(ConnectionState previous, ConnectionState current) {
        if (current.getStatus() == ConnectionStatus.CONNECTED) {
            PollTask task = tasks.get(current.getEndpointId());
            if (task != null) {
                task.resume();
            }
        }
    }

    /**
     * Runs one cycle for an endpoint on the calling thread, outside its schedule.
     *
     * @return true if a new generation was committed
     * @throws PveNotFoundException if the endpoint is not polled
     */
    public boolean pollNow(String endpointId) {
        return require(endpointId).runCycle() == Outcome.SUCCESS;
    }

    public PollState getState(String endpointId) {
        return require(endpointId).state;
    }

    /**
     * Delay after the given number of consecutive failures.
     */
    Duration backoffFor(int failures) {
        Duration delay = interval;
        for (int i = 0; i < failures && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private PollTask require(String endpointId) {
        PollTask task = endpointId == null ? null : tasks.get(endpointId);
        if (task == null) {
            throw new PveNotFoundException("Endpoint '" + endpointId + "' is not polled");
        }
        return task;
    }

    /**
     * The poll loop of one endpoint.
     */
    final class PollTask implements Runnable {

        private final EndpointConnection connection;
        private final String endpointId;
        private final AtomicBoolean halted = new AtomicBoolean();
        private final Object scheduleLock = new Object();

        private volatile PollState state = PollState.IDLE;
        private volatile boolean cancelled;

        // guarded by scheduleLock
        private ScheduledFuture<?> timer;
        private Future<?> cycle;

        // guarded by this
        private int failures;
        private long generation;

        PollTask(EndpointConnection connection) {
            this.connection = connection;
            this.endpointId = connection.getId();
        }

        @Override
        public void run() {
            Outcome outcome = runCycle();
            if (outcome == Outcome.SUCCESS) {
                scheduleNext(interval);
            } else if (outcome == Outcome.FAILED) {
                scheduleNext(currentBackoff());
            }
        }

        synchronized Outcome runCycle() {
            if (cancelled) {
                return Outcome.CANCELLED;
            }
            if (halted.get()) {
                return Outcome.HALTED;
            }
            state = PollState.POLLING;
            try {
                EndpointInventory previous = inventoryStore.get(endpointId).orElse(null);
                EndpointInventory next = fetch(previous);
                InventoryDiff diff = differ.diff(previous, next);
                boolean committed = broadcaster.publishWith(() -> commit(next), () -> events(diff));
                state = PollState.IDLE;
                if (!committed) {
                    logger.debug("Discarded poll result of removed endpoint '{}'", endpointId);
                    return Outcome.CANCELLED;
                }
                failures = 0;
                logger.debug("Polled endpoint '{}': generation {}, {}", endpointId, next.getGeneration(), diff);
                alertEngine.evaluate(previous, next);
                return Outcome.SUCCESS;
            } catch (PveAuthException e) {
                halt(e);
                return Outcome.HALTED;
            } catch (PveNotFoundException e) {
                state = PollState.IDLE;
                if (cancelled || connection.isClosed()) {
                    return Outcome.CANCELLED;
                }
                return failed(e);
            } catch (PveException e) {
                return failed(e);
            } catch (RuntimeException e) {
                logger.error("Unexpected failure polling endpoint '{}': {}", endpointId, e.getMessage(), e);
                return failed(e);
            }
        }

        void scheduleNext(Duration delay) {
            synchronized (scheduleLock) {
                if (cancelled) {
                    return;
                }
                timer = scheduler.schedule(this::startCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private void startCycle() {
            synchronized (scheduleLock) {
                if (cancelled) {
                    return;
                }
                try {
                    cycle = workers.submit(this);
                } catch (RejectedExecutionException e) {
                    logger.debug("Poll workers shut down, loop of endpoint '{}' ends", endpointId);
                }
            }
        }

        void cancel() {
            synchronized (scheduleLock) {
                cancelled = true;
                if (timer != null) {
                    timer.cancel(false);
                }
                if (cycle != null) {
                    cycle.cancel(true);
                }
            }
        }

        void resume() {
            if (halted.compareAndSet(true, false)) {
                logger.info("Endpoint '{}' connected again, resuming polling", endpointId);
                state = PollState.IDLE;
                scheduleNext(Duration.ZERO);
            }
        }

        private EndpointInventory fetch(EndpointInventory previous) {
            Instant now = Instant.now();
            PveApiClient api = connection.getApi();
            List<NodeSnapshot> nodes = new ArrayList<>();
            List<VmSnapshot> vms = new ArrayList<>();

            for (JsonNode json : api.nodes().list()) {
                nodes.add(NodeSnapshot.fromJson(endpointId, json, now));
            }
            for (NodeSnapshot node : nodes) {
                if (node.isOnline()) {
                    for (VmKind kind : VmKind.values()) {
                        for (JsonNode json : api.vms().list(node.getNode(), kind)) {
                            vms.add(VmSnapshot.fromJson(endpointId, node.getNode(), kind, json, now));
                        }
                    }
                } else if (previous != null) {
                    // guests of an unreachable node keep their last known state
                    for (VmSnapshot vm : previous.getVms().values()) {
                        if (vm.getNode().equals(node.getNode())) {
                            vms.add(vm);
                        }
                    }
                }
            }
            return new EndpointInventory(endpointId, ++generation, nodes, vms, now);
        }

        private boolean commit(EndpointInventory next) {
            if (cancelled || connectionRegistry.find(endpointId).orElse(null) != connection) {
                return false;
            }
            inventoryStore.replace(next);
            return true;
        }

        private List<PveEvent> events(InventoryDiff diff) {
            List<PveEvent> events = new ArrayList<>(diff.size());
            for (NodeSnapshot node : diff.getAddedNodes()) {
                events.add(PveEvent.of(EventType.NODE_ADDED, endpointId, node));
            }
            for (NodeSnapshot node : diff.getChangedNodes()) {
                events.add(PveEvent.of(EventType.NODE_CHANGED, endpointId, node));
            }
            for (NodeSnapshot node : diff.getRemovedNodes()) {
                events.add(PveEvent.of(EventType.NODE_REMOVED, endpointId, node));
            }
            for (VmSnapshot vm : diff.getAddedVms()) {
                events.add(PveEvent.of(EventType.VM_ADDED, endpointId, vm));
            }
            for (VmSnapshot vm : diff.getChangedVms()) {
                events.add(PveEvent.of(EventType.VM_CHANGED, endpointId, vm));
            }
            for (VmSnapshot vm : diff.getRemovedVms()) {
                events.add(PveEvent.of(EventType.VM_REMOVED, endpointId, vm));
            }
            return events;
        }

        private Outcome failed(RuntimeException e) {
            failures++;
            state = PollState.BACKOFF;
            logger.warn("Poll of endpoint '{}' failed ({} in a row), next attempt in {}: {}",
                    endpointId, failures, backoffFor(failures), e.getMessage());
            return Outcome.FAILED;
        }

        private synchronized Duration currentBackoff() {
            return backoffFor(failures);
        }

        private void halt(PveAuthException e) {
            halted.set(true);
            state = PollState.HALTED;
            logger.warn("Polling of endpoint '{}' halted after authentication failure: {}", endpointId, e.getMessage());
            if (connection.getState().getStatus() == ConnectionStatus.CONNECTED) {
                resume();
            }
        }
    }
}
