package org.tanzu.pvemcp.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.tanzu.pvemcp.alert.AlertEngine;
import org.tanzu.pvemcp.batch.BatchDispatcher;
import org.tanzu.pvemcp.client.Credentials;
import org.tanzu.pvemcp.client.EndpointConfig;
import org.tanzu.pvemcp.client.TransportException;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.event.Broadcaster;
import org.tanzu.pvemcp.inventory.InventoryStore;
import org.tanzu.pvemcp.inventory.StatePoller;
import org.tanzu.pvemcp.pve.PveService;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.mockito.Mockito.mock;

/**
 * Wires the engine the way the application context does, against fake clusters.
 *
 * By default the poll scheduler is a mock, so nothing runs on its own: tests drive poll
 * cycles with {@link StatePoller#pollNow(String)}. Batch dispatch uses a real pool. Tests
 * of the poll loops themselves pass real executors.
 *
 * The no-argument constructor uses default settings without retry delays; passing
 * properties keeps them as given.
 */
public class PveTestEngine implements AutoCloseable {

    public final PveProperties properties;
    public final ScheduledExecutorService scheduler;
    public final ExecutorService pollWorkers;
    public final ExecutorService batchExecutor;
    public final ConnectionRegistry registry;
    public final InventoryStore inventory;
    public final Broadcaster broadcaster;
    public final AlertEngine alerts;
    public final StatePoller poller;
    public final BatchDispatcher dispatcher;
    public final PveService service;

    private final Map<String, FakePveCluster> clusters = new ConcurrentHashMap<>();

    public PveTestEngine() {
        this(withoutRetryDelay(new PveProperties()));
    }

    public PveTestEngine(PveProperties properties) {
        this(properties, mock(ScheduledExecutorService.class), Executors.newCachedThreadPool());
    }

    public PveTestEngine(PveProperties properties, ScheduledExecutorService scheduler, ExecutorService pollWorkers) {
        this.properties = properties;
        this.scheduler = scheduler;
        this.pollWorkers = pollWorkers;
        this.batchExecutor = Executors.newFixedThreadPool(properties.getBatch().getConcurrency());
        this.registry = new ConnectionRegistry(properties, config -> {
            FakePveCluster cluster = clusters.get(config.getHost());
            if (cluster == null) {
                return request -> {
                    throw new TransportException("Unknown host " + config.getHost());
                };
            }
            return cluster;
        }, new ObjectMapper());
        this.inventory = new InventoryStore();
        this.broadcaster = new Broadcaster(registry, inventory);
        this.alerts = new AlertEngine(properties, registry, broadcaster, scheduler);
        this.poller = new StatePoller(properties, registry, inventory, broadcaster, alerts, scheduler, pollWorkers);
        this.dispatcher = new BatchDispatcher(properties, registry, inventory, broadcaster, batchExecutor);
        this.service = new PveService(properties, registry, inventory, dispatcher, alerts, broadcaster);

        broadcaster.register();
        alerts.start();
        poller.register();
    }

    public static PveProperties withoutRetryDelay(PveProperties properties) {
        properties.getRetry().setBaseDelay(Duration.ZERO);
        return properties;
    }

    /** Serves a fake cluster under a host name. */
    public FakePveCluster serve(String host, FakePveCluster cluster) {
        clusters.put(host, cluster);
        return cluster;
    }

    /** Serves a fake cluster and registers it as an endpoint. */
    public FakePveCluster add(String id, FakePveCluster cluster) {
        serve(id + ".pve.test", cluster);
        registry.add(endpoint(id));
        return cluster;
    }

    public static EndpointConfig endpoint(String id) {
        return new EndpointConfig(id, id.toUpperCase(), id + ".pve.test", EndpointConfig.DEFAULT_PORT,
                new Credentials(FakePveCluster.USERNAME, "pam", FakePveCluster.PASSWORD), true);
    }

    /** A healthy two-node cluster with a few guests. */
    public static FakePveCluster standardCluster() {
        return new FakePveCluster()
                .node("pve1", "online", 0.12, 8L << 30, 64L << 30)
                .node("pve2", "online", 0.30, 16L << 30, 64L << 30)
                .qemu("pve1", 100, "web", "running")
                .qemu("pve1", 101, "db", "stopped")
                .lxc("pve2", 200, "cache", "running")
                .storage("local", "dir", "iso,vztmpl,backup")
                .storage("local-lvm", "lvmthin", "images,rootdir");
    }

    @Override
    public void close() {
        batchExecutor.shutdownNow();
        pollWorkers.shutdownNow();
        scheduler.shutdownNow();
    }
}
