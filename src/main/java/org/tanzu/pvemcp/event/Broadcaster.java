package org.tanzu.pvemcp.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.connection.ConnectionListener;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.connection.EndpointConnection;
import org.tanzu.pvemcp.inventory.InventoryStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Fans events out to every subscriber.
 *
 * All publication happens under one lock and stamps events from one global sequence,
 * so every subscriber sees the same events in the same order and none twice. A new
 * subscriber first receives a SNAPSHOT taken under the same lock, then every event
 * published after it: no window is skipped or repeated.
 *
 * Each subscriber has its own unbounded buffer; a slow consumer never blocks
 * publishers or other consumers. Cancelled subscriptions are dropped.
 *
 * The connection part of a snapshot is the fold of the connection events published so
 * far, and inventory changes are committed through {@link #publishWith}, so a snapshot
 * and the events that follow it always line up.
 */
@Component
public class Broadcaster implements ConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry connectionRegistry;
    private final InventoryStore inventoryStore;
    private final List<Sinks.Many<PveEvent>> subscribers = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    // guarded by lock
    private final Map<String, ConnectionState> connections = new LinkedHashMap<>();
    private long sequence;

    public Broadcaster(ConnectionRegistry connectionRegistry, InventoryStore inventoryStore) {
        this.connectionRegistry = connectionRegistry;
        this.inventoryStore = inventoryStore;
    }

    @PostConstruct
    public void register() {
        connectionRegistry.addListener(this);
    }

    /**
     * Subscribes to the event stream. Nothing is registered until the returned stream is
     * subscribed to; each subscription gets its own buffer and its own SNAPSHOT.
     *
     * @return A stream starting with a SNAPSHOT event followed by every later event
     */
    public Flux<PveEvent> subscribe() {
        return Flux.defer(() -> {
            Sinks.Many<PveEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
            synchronized (lock) {
                StateSnapshot snapshot = snapshot(SnapshotKind.ALL);
                sink.tryEmitNext(PveEvent.of(EventType.SNAPSHOT, null, snapshot).withSequence(sequence));
                subscribers.add(sink);
            }
            logger.info("Subscriber added ({} active)", subscribers.size());
            return sink.asFlux().doFinally(signal -> {
                subscribers.remove(sink);
                logger.info("Subscriber removed on {} ({} active)", signal, subscribers.size());
            });
        });
    }

    /**
     * Publishes one event to every subscriber.
     * @return The event as delivered, with its sequence number
     */
    public PveEvent publish(PveEvent event) {
        synchronized (lock) {
            return emit(event);
        }
    }

    /**
     * Applies a state change and publishes the events describing it as one step: a
     * subscriber joining concurrently sees either the old state and the events, or the
     * new state and none of them.
     *
     * @param commit Applies the change; returns false if it was abandoned
     * @param events Events to publish when the change was applied
     * @return The commit's result
     */
    public boolean publishWith(BooleanSupplier commit, Supplier<List<PveEvent>> events) {
        synchronized (lock) {
            if (!commit.getAsBoolean()) {
                return false;
            }
            for (PveEvent event : events.get()) {
                emit(event);
            }
            return true;
        }
    }

    /**
     * Pull-style refresh.
     * @param kind Part of the state to include
     * @return The current state, consistent with the last published sequence
     */
    public StateSnapshot request(SnapshotKind kind) {
        synchronized (lock) {
            return snapshot(kind);
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public long getSequence() {
        synchronized (lock) {
            return sequence;
        }
    }

    @Override
    public void endpointAdded(EndpointConnection connection) {
        publish(PveEvent.of(EventType.ENDPOINT_ADDED, connection.getId(), connection.getState()));
    }

    @Override
    public void statusChanged(ConnectionState previous, ConnectionState current) {
        if (!connectionRegistry.contains(current.getEndpointId())) {
            logger.debug("Ignoring status change of removed endpoint '{}'", current.getEndpointId());
            return;
        }
        publish(PveEvent.of(EventType.CONNECTION_STATUS_CHANGED, current.getEndpointId(), current));
    }

    private PveEvent emit(PveEvent event) {
        PveEvent stamped = event.withSequence(++sequence);
        track(stamped);
        for (Sinks.Many<PveEvent> subscriber : subscribers) {
            Sinks.EmitResult result = subscriber.tryEmitNext(stamped);
            if (result.isFailure()) {
                logger.debug("Dropping subscriber after emit failure {}", result);
                subscribers.remove(subscriber);
            }
        }
        logger.debug("Published {}", stamped);
        return stamped;
    }

    private void track(PveEvent event) {
        switch (event.getType()) {
            case ENDPOINT_ADDED:
            case CONNECTION_STATUS_CHANGED:
                connections.put(event.getEndpointId(), (ConnectionState) event.getPayload());
                break;
            case ENDPOINT_REMOVED:
                connections.remove(event.getEndpointId());
                break;
            default:
                break;
        }
    }

    private StateSnapshot snapshot(SnapshotKind kind) {
        return new StateSnapshot(
            kind,
            sequence,
            kind.includesConnections() ? new ArrayList<>(connections.values()) : List.of(),
            kind.includesNodes() ? inventoryStore.listNodes(null) : List.of(),
            kind.includesVms() ? inventoryStore.listVms(null) : List.of()
        );
    }
}
