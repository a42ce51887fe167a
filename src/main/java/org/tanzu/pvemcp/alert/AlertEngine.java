package org.tanzu.pvemcp.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionListener;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.connection.ConnectionStatus;
import org.tanzu.pvemcp.connection.EndpointConnection;
import org.tanzu.pvemcp.event.Broadcaster;
import org.tanzu.pvemcp.event.EventType;
import org.tanzu.pvemcp.event.PveEvent;
import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PveException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.inventory.EndpointInventory;
import org.tanzu.pvemcp.inventory.NodeSnapshot;
import org.tanzu.pvemcp.inventory.VmSnapshot;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Raises, keeps and resolves alert records.
 *
 * After every successful poll of an endpoint, {@link #evaluate} compares each node's and
 * guest's metrics with the configured thresholds. For every (resource, dimension) key at
 * most one record is open (active or acknowledged):
 * - a breach with no open record raises one at the most severe level breached
 * - a breach at the open record's level leaves it untouched
 * - a breach at another level resolves the open record and raises a new one
 * - no breach resolves the open record
 *
 * Metrics that cannot be known from the poll (offline node, guests on an offline node,
 * network throughput without a previous sample) neither raise nor resolve. Resources
 * that disappear from a successful poll have their open records resolved.
 *
 * Connection alerts follow the endpoint's status instead: a transition to error raises a
 * critical record that only a transition back to connected resolves.
 */
@Component
public class AlertEngine implements ConnectionListener {

    private static final Logger logger = LoggerFactory.getLogger(AlertEngine.class);

    static final Duration CLEANUP_PERIOD = Duration.ofDays(1);

    private final ConnectionRegistry connectionRegistry;
    private final Broadcaster broadcaster;
    private final ScheduledExecutorService scheduler;
    private final Map<AlertDimension, AlertThresholds> thresholds = new EnumMap<>(AlertDimension.class);
    private final Duration retention;
    private final Clock clock;

    // guarded by this
    private final Map<String, AlertRecord> alerts = new LinkedHashMap<>();
    private final Map<String, String> openByKey = new HashMap<>();

    @Autowired
    public AlertEngine(PveProperties pveProperties, ConnectionRegistry connectionRegistry, Broadcaster broadcaster,
                       @Qualifier("pvePollScheduler") ScheduledExecutorService scheduler) {
        this(pveProperties, connectionRegistry, broadcaster, scheduler, Clock.systemUTC());
    }

    AlertEngine(PveProperties pveProperties, ConnectionRegistry connectionRegistry, Broadcaster broadcaster,
                ScheduledExecutorService scheduler, Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.broadcaster = broadcaster;
        this.scheduler = scheduler;
        this.clock = clock;
        PveProperties.Alerts alertProperties = pveProperties.getAlerts();
        thresholds.put(AlertDimension.CPU, AlertThresholds.from(alertProperties.getCpu()));
        thresholds.put(AlertDimension.MEMORY, AlertThresholds.from(alertProperties.getMemory()));
        thresholds.put(AlertDimension.DISK, AlertThresholds.from(alertProperties.getDisk()));
        thresholds.put(AlertDimension.NETWORK, AlertThresholds.from(alertProperties.getNetwork()));
        this.retention = alertProperties.getRetention();
        logger.info("AlertEngine initialized with thresholds {} and retention {}", thresholds, retention);
    }

    @PostConstruct
    public void start() {
        connectionRegistry.addListener(this);
        scheduler.scheduleAtFixedRate(this::purgeExpired,
                CLEANUP_PERIOD.toMillis(), CLEANUP_PERIOD.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Evaluates one freshly polled generation of an endpoint.
     *
     * @param previous The generation it replaced, or null; used for throughput
     * @param next The new generation
     */
    public synchronized void evaluate(EndpointInventory previous, EndpointInventory next) {
        String endpointId = next.getEndpointId();
        if (!connectionRegistry.contains(endpointId)) {
            logger.debug("Skipping alert evaluation for removed endpoint '{}'", endpointId);
            return;
        }
        Set<AlertSource> present = new HashSet<>();

        for (NodeSnapshot node : next.getNodes().values()) {
            AlertSource source = AlertSource.node(endpointId, node.getNode());
            present.add(source);
            if (!node.isOnline()) {
                breach(source, AlertDimension.NODE_STATUS, AlertLevel.CRITICAL, null, null,
                        "Node " + node.getNode() + " is " + node.getStatus(),
                        "Node " + node.getNode() + " reports status '" + node.getStatus() + "'");
                continue;
            }
            clear(source, AlertDimension.NODE_STATUS);
            check(source, AlertDimension.CPU, node.getCpuPercent());
            check(source, AlertDimension.MEMORY, node.getMemPercent());
            check(source, AlertDimension.DISK, node.getDiskPercent());
        }

        for (VmSnapshot vm : next.getVms().values()) {
            AlertSource source = AlertSource.vm(endpointId, vm.getNode(), vm.getVmid(), vm.getName());
            present.add(source);
            if (!next.isNodeOnline(vm.getNode()) || vm.isTemplate()) {
                continue;
            }
            String status = vm.getStatus();
            if (VmSnapshot.RUNNING.equals(status) || VmSnapshot.STOPPED.equals(status)) {
                clear(source, AlertDimension.VM_STATUS);
            } else {
                breach(source, AlertDimension.VM_STATUS, AlertLevel.WARNING, null, null,
                        "Guest " + source.getLabel() + " is " + status,
                        "Guest " + source.getLabel() + " on " + vm.getNode() + " reports status '" + status + "'");
            }
            check(source, AlertDimension.CPU, vm.getCpuPercent());
            check(source, AlertDimension.MEMORY, vm.getMemPercent());
            check(source, AlertDimension.DISK, vm.getDiskPercent());
            check(source, AlertDimension.NETWORK, throughput(previous == null ? null : previous.vm(vm.getKey()), vm));
        }

        for (AlertRecord record : openRecords()) {
            AlertSource source = record.getSource();
            if (endpointId.equals(source.getEndpointId()) && !source.isEndpoint() && !present.contains(source)) {
                logger.info("Resolving alert {} of vanished resource {}", record.getId(), source);
                resolveRecord(record);
            }
        }
    }

    /**
     * Records a condition reported from outside the metric evaluation, for example by an
     * operator or an external monitor. Reported alerts are never deduplicated and never
     * resolved by a poll; they close by operator action or when their endpoint is removed.
     *
     * @param source The endpoint, node or guest the condition concerns
     * @throws PveNotFoundException if the source's endpoint is not registered
     * @throws InvalidRequestException if the title is missing
     */
    public synchronized AlertRecord report(AlertLevel level, AlertKind kind, AlertSource source, String title,
                                           String description) {
        if (title == null || title.isBlank()) {
            throw new InvalidRequestException("An alert needs a title");
        }
        connectionRegistry.require(source.getEndpointId());
        AlertRecord record = AlertRecord.report(level == null ? AlertLevel.WARNING : level,
                kind == null ? AlertDimension.MANUAL.getKind() : kind, source, title, description, clock.instant());
        alerts.put(record.getId(), record);
        logger.info("Alert reported: {} {} on {} ({})", record.getLevel(), record.getKind(), source, record.getId());
        broadcaster.publish(PveEvent.of(EventType.ALERT_RAISED, source.getEndpointId(), record));
        return record;
    }

    /**
     * Marks an open alert as seen by an operator. Acknowledged alerts still count as open
     * for their key.
     *
     * @throws PveNotFoundException if the alert does not exist
     * @throws InvalidRequestException if the alert is already resolved
     */
    public synchronized AlertRecord acknowledge(String id, String by) {
        AlertRecord record = require(id);
        if (record.getStatus() == AlertStatus.RESOLVED) {
            throw new InvalidRequestException("Alert '" + id + "' is resolved and cannot be acknowledged");
        }
        if (record.getStatus() == AlertStatus.ACKNOWLEDGED) {
            return record;
        }
        AlertRecord updated = record.acknowledged(by == null || by.isBlank() ? "operator" : by, clock.instant());
        alerts.put(id, updated);
        logger.info("Alert {} acknowledged by {}", id, updated.getAcknowledgedBy());
        return updated;
    }

    /**
     * Resolves an alert by operator action. If the condition persists, the next poll
     * raises a new record. A connection alert stays open while its endpoint is not
     * connected.
     *
     * @throws PveNotFoundException if the alert does not exist
     * @throws InvalidRequestException for a connection alert of an endpoint still not connected
     */
    public synchronized AlertRecord resolve(String id) {
        AlertRecord record = require(id);
        if (!record.isOpen()) {
            return record;
        }
        if (record.getDimension() == AlertDimension.CONNECTION && !isConnected(record.getSource().getEndpointId())) {
            throw new InvalidRequestException("Alert '" + id + "' resolves when endpoint '"
                    + record.getSource().getEndpointId() + "' reconnects");
        }
        return resolveRecord(record);
    }

    /**
     * @throws PveNotFoundException if the alert does not exist
     */
    public synchronized AlertRecord delete(String id) {
        AlertRecord record = require(id);
        alerts.remove(id);
        openByKey.remove(key(record.getSource(), record.getDimension()), id);
        logger.info("Alert {} deleted", id);
        return record;
    }

    /**
     * Applies one action to several alerts; a failure on one id does not stop the others.
     */
    public synchronized AlertActionReport apply(List<String> ids, AlertAction action, String by) {
        List<String> processed = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String id : ids) {
            try {
                switch (action) {
                    case ACKNOWLEDGE:
                        acknowledge(id, by);
                        break;
                    case RESOLVE:
                        resolve(id);
                        break;
                    default:
                        delete(id);
                        break;
                }
                processed.add(id);
            } catch (PveException e) {
                failed.put(id, e.getMessage());
            }
        }
        logger.info("Applied {} to {} alert(s), {} failed", action, processed.size(), failed.size());
        return new AlertActionReport(action, processed, failed);
    }

    /**
     * @return Matching alerts, newest first
     */
    public synchronized List<AlertRecord> list(AlertFilter filter) {
        List<AlertRecord> result = new ArrayList<>();
        for (AlertRecord record : alerts.values()) {
            if (filter.matches(record)) {
                result.add(record);
            }
        }
        Collections.reverse(result);
        return result;
    }

    public synchronized AlertRecord get(String id) {
        return require(id);
    }

    public synchronized AlertStats stats() {
        int active = 0, acknowledged = 0, resolved = 0, critical = 0, warning = 0, info = 0;
        for (AlertRecord record : alerts.values()) {
            switch (record.getStatus()) {
                case ACTIVE:
                    active++;
                    break;
                case ACKNOWLEDGED:
                    acknowledged++;
                    break;
                default:
                    resolved++;
                    break;
            }
            if (record.isOpen()) {
                switch (record.getLevel()) {
                    case CRITICAL:
                        critical++;
                        break;
                    case WARNING:
                        warning++;
                        break;
                    default:
                        info++;
                        break;
                }
            }
        }
        return new AlertStats(alerts.size(), active, acknowledged, resolved, critical, warning, info);
    }

    /**
     * Deletes resolved alerts whose resolution is older than the retention period.
     * @return The number of alerts deleted
     */
    public synchronized int purgeResolvedOlderThan(Duration age) {
        Instant cutoff = clock.instant().minus(age);
        int purged = 0;
        Iterator<AlertRecord> iterator = alerts.values().iterator();
        while (iterator.hasNext()) {
            AlertRecord record = iterator.next();
            if (!record.isOpen() && record.getResolvedAt().isBefore(cutoff)) {
                iterator.remove();
                purged++;
            }
        }
        if (purged > 0) {
            logger.info("Purged {} resolved alert(s) older than {}", purged, age);
        }
        return purged;
    }

    @Override
    public synchronized void statusChanged(ConnectionState previous, ConnectionState current) {
        if (!connectionRegistry.contains(current.getEndpointId())) {
            return;
        }
        AlertSource source = AlertSource.endpoint(current.getEndpointId(), current.getName());
        if (current.getStatus() == ConnectionStatus.ERROR) {
            breach(source, AlertDimension.CONNECTION, AlertLevel.CRITICAL, null, null,
                    "Connection lost: " + current.getName(), current.getLastError());
        } else if (current.getStatus() == ConnectionStatus.CONNECTED) {
            clear(source, AlertDimension.CONNECTION);
        }
    }

    @Override
    public synchronized void endpointRemoved(EndpointConnection connection) {
        List<AlertRecord> open = new ArrayList<>();
        for (AlertRecord record : alerts.values()) {
            if (record.isOpen() && connection.getId().equals(record.getSource().getEndpointId())) {
                open.add(record);
            }
        }
        for (AlertRecord record : open) {
            resolveRecord(record);
        }
    }

    private void purgeExpired() {
        try {
            purgeResolvedOlderThan(retention);
        } catch (RuntimeException e) {
            logger.error("Alert cleanup failed: {}", e.getMessage(), e);
        }
    }

    private void check(AlertSource source, AlertDimension dimension, Double value) {
        if (value == null) {
            return;
        }
        AlertThresholds dimensionThresholds = thresholds.get(dimension);
        AlertLevel level = dimensionThresholds.levelFor(value);
        if (level == null) {
            clear(source, dimension);
            return;
        }
        Double threshold = dimensionThresholds.thresholdFor(level);
        breach(source, dimension, level, value, threshold,
                title(level, dimension, source),
                String.format(Locale.ROOT, "%s is %s, above the %s threshold of %s", dimension.getLabel(),
                        format(value, dimension), level.name().toLowerCase(Locale.ROOT), format(threshold, dimension)));
    }

    private void breach(AlertSource source, AlertDimension dimension, AlertLevel level, Double value, Double threshold,
                        String title, String description) {
        String key = key(source, dimension);
        String openId = openByKey.get(key);
        if (openId != null) {
            AlertRecord open = alerts.get(openId);
            if (open.getLevel() == level) {
                return;
            }
            logger.info("Alert {} on {} changes level {} -> {}", dimension, source, open.getLevel(), level);
            resolveRecord(open);
        }
        AlertRecord record = AlertRecord.raise(level, dimension, source, title, description, value, threshold, clock.instant());
        alerts.put(record.getId(), record);
        openByKey.put(key, record.getId());
        logger.info("Alert raised: {} {} on {} ({})", level, dimension, source, record.getId());
        broadcaster.publish(PveEvent.of(EventType.ALERT_RAISED, source.getEndpointId(), record));
    }

    private void clear(AlertSource source, AlertDimension dimension) {
        String openId = openByKey.get(key(source, dimension));
        if (openId != null) {
            resolveRecord(alerts.get(openId));
        }
    }

    private AlertRecord resolveRecord(AlertRecord record) {
        AlertRecord resolved = record.resolved(clock.instant());
        alerts.put(record.getId(), resolved);
        openByKey.remove(key(record.getSource(), record.getDimension()), record.getId());
        logger.info("Alert resolved: {} {} on {} ({})", record.getLevel(), record.getDimension(), record.getSource(), record.getId());
        broadcaster.publish(PveEvent.of(EventType.ALERT_RESOLVED, record.getSource().getEndpointId(), resolved));
        return resolved;
    }

    private boolean isConnected(String endpointId) {
        return connectionRegistry.find(endpointId)
                .map(connection -> connection.getState().getStatus() == ConnectionStatus.CONNECTED)
                .orElse(true);
    }

    private AlertRecord require(String id) {
        AlertRecord record = id == null ? null : alerts.get(id);
        if (record == null) {
            throw new PveNotFoundException("Alert '" + id + "' not found");
        }
        return record;
    }

    private List<AlertRecord> openRecords() {
        List<AlertRecord> open = new ArrayList<>();
        for (String id : openByKey.values()) {
            open.add(alerts.get(id));
        }
        return open;
    }

    /**
     * Bytes per second over both directions between two samples, or null when there is no
     * usable previous sample or a counter went backwards (guest restart).
     */
    static Double throughput(VmSnapshot before, VmSnapshot after) {
        if (before == null || before.getCapturedAt() == null || after.getCapturedAt() == null) {
            return null;
        }
        double seconds = Duration.between(before.getCapturedAt(), after.getCapturedAt()).toMillis() / 1000.0;
        long in = after.getNetIn() - before.getNetIn();
        long out = after.getNetOut() - before.getNetOut();
        if (seconds <= 0 || in < 0 || out < 0) {
            return null;
        }
        return (in + out) / seconds;
    }

    private static String key(AlertSource source, AlertDimension dimension) {
        return source + "|" + dimension;
    }

    private static String title(AlertLevel level, AlertDimension dimension, AlertSource source) {
        String prefix;
        switch (level) {
            case CRITICAL:
                prefix = "Critical ";
                break;
            case WARNING:
                prefix = "High ";
                break;
            default:
                prefix = "Elevated ";
                break;
        }
        return prefix + dimension.getLabel().toLowerCase(Locale.ROOT) + " on " + source.getLabel();
    }

    private static String format(Double value, AlertDimension dimension) {
        if ("%".equals(dimension.getUnit())) {
            return String.format(Locale.ROOT, "%.1f%%", value);
        }
        return String.format(Locale.ROOT, "%.0f %s", value, dimension.getUnit());
    }
}
