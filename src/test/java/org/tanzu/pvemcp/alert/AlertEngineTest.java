package org.tanzu.pvemcp.alert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.exception.InvalidRequestException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.inventory.EndpointInventory;
import org.tanzu.pvemcp.inventory.NodeSnapshot;
import org.tanzu.pvemcp.inventory.VmKey;
import org.tanzu.pvemcp.inventory.VmKind;
import org.tanzu.pvemcp.inventory.VmSnapshot;
import org.tanzu.pvemcp.support.FakePveCluster;
import org.tanzu.pvemcp.support.PveTestEngine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final long MIB = 1024L * 1024;

    private PveTestEngine engine;
    private FakePveCluster cluster;
    private AlertEngine alerts;

    @BeforeEach
    void setUp() {
        engine = new PveTestEngine();
        cluster = engine.add("lab", PveTestEngine.standardCluster());
        alerts = engine.alerts;
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void breachRaisesOneAlertPerLevel() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.92)), List.of()));
        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.93)), List.of()));

        List<AlertRecord> open = open();
        assertThat(open).hasSize(1);
        assertThat(open.get(0).getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(open.get(0).getDimension()).isEqualTo(AlertDimension.CPU);
        assertThat(open.get(0).getKind()).isEqualTo(AlertKind.PERFORMANCE);
        assertThat(open.get(0).getThreshold()).isEqualTo(90.0);
        assertThat(open.get(0).getTitle()).isEqualTo("High cpu usage on pve1");

        alerts.evaluate(null, inventory(3, List.of(node("pve1", "online", 0.97)), List.of()));

        assertThat(open()).singleElement().extracting(AlertRecord::getLevel).isEqualTo(AlertLevel.CRITICAL);
        assertThat(alerts.list(new AlertFilter(AlertStatus.RESOLVED, null, null, null)))
                .extracting(AlertRecord::getLevel).containsExactly(AlertLevel.WARNING);

        alerts.evaluate(null, inventory(4, List.of(node("pve1", "online", 0.40)), List.of()));

        assertThat(open()).isEmpty();
        assertThat(alerts.stats().getResolved()).isEqualTo(2);
    }

    @Test
    void acknowledgedAlertStillSuppressesDuplicates() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99)), List.of()));
        AlertRecord raised = open().get(0);

        AlertRecord acknowledged = alerts.acknowledge(raised.getId(), null);
        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.99)), List.of()));

        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(acknowledged.getAcknowledgedBy()).isEqualTo("operator");
        assertThat(alerts.list(AlertFilter.ALL)).hasSize(1);
        assertThat(alerts.stats().getAcknowledged()).isEqualTo(1);
        assertThat(alerts.stats().getCritical()).isEqualTo(1);
        assertThat(alerts.acknowledge(raised.getId(), "someone else").getAcknowledgedBy()).isEqualTo("operator");
    }

    @Test
    void resolvedAlertCannotBeAcknowledged() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99)), List.of()));
        String id = open().get(0).getId();
        alerts.resolve(id);

        assertThatThrownBy(() -> alerts.acknowledge(id, "ops")).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> alerts.acknowledge("alert-missing", "ops")).isInstanceOf(PveNotFoundException.class);
    }

    @Test
    void operatorResolveOfAnOngoingBreachRaisesAgainOnNextPoll() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99)), List.of()));
        String first = open().get(0).getId();

        alerts.resolve(first);
        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.99)), List.of()));

        assertThat(open()).singleElement().extracting(AlertRecord::getId).isNotEqualTo(first);
    }

    @Test
    void offlineNodeIsCriticalAndItsGuestsAreNotEvaluated() {
        VmSnapshot busy = vm(100, "pve1", "running", 0.99, 0, T0, false);

        alerts.evaluate(null, inventory(1, List.of(node("pve1", "offline", 0.0)), List.of(busy)));

        assertThat(open()).singleElement().satisfies(record -> {
            assertThat(record.getDimension()).isEqualTo(AlertDimension.NODE_STATUS);
            assertThat(record.getLevel()).isEqualTo(AlertLevel.CRITICAL);
            assertThat(record.getKind()).isEqualTo(AlertKind.SYSTEM);
        });

        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.1)), List.of(busy)));

        assertThat(open()).singleElement().extracting(AlertRecord::getDimension).isEqualTo(AlertDimension.CPU);
    }

    @Test
    void templatesAreIgnoredAndOddGuestStatusWarns() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.1)), List.of(
                vm(100, "pve1", "running", 0.99, 0, T0, true),
                vm(101, "pve1", "unknown", 0.0, 0, T0, false))));

        assertThat(open()).singleElement().satisfies(record -> {
            assertThat(record.getDimension()).isEqualTo(AlertDimension.VM_STATUS);
            assertThat(record.getLevel()).isEqualTo(AlertLevel.WARNING);
            assertThat(record.getSource().getVmid()).isEqualTo(101);
        });
    }

    @Test
    void vanishedGuestResolvesItsAlerts() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.1)),
                List.of(vm(100, "pve1", "running", 0.99, 0, T0, false))));
        assertThat(open()).hasSize(1);

        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.1)), List.of()));

        assertThat(open()).isEmpty();
    }

    @Test
    void networkThroughputComesFromCounterDeltas() {
        EndpointInventory first = inventory(1, List.of(node("pve1", "online", 0.1)),
                List.of(vm(100, "pve1", "running", 0.1, 0, T0, false)));
        EndpointInventory second = inventory(2, List.of(node("pve1", "online", 0.1)),
                List.of(vm(100, "pve1", "running", 0.1, 2000 * MIB, T0.plusSeconds(10), false)));
        EndpointInventory restarted = inventory(3, List.of(node("pve1", "online", 0.1)),
                List.of(vm(100, "pve1", "running", 0.1, 5 * MIB, T0.plusSeconds(20), false)));

        alerts.evaluate(null, first);
        assertThat(open()).isEmpty();

        alerts.evaluate(first, second);
        assertThat(open()).singleElement().satisfies(record -> {
            assertThat(record.getDimension()).isEqualTo(AlertDimension.NETWORK);
            assertThat(record.getLevel()).isEqualTo(AlertLevel.WARNING);
            assertThat(record.getValue()).isEqualTo(200.0 * MIB);
        });

        alerts.evaluate(second, restarted);
        assertThat(open()).hasSize(1);
        assertThat(AlertEngine.throughput(second.vm(key(100)), restarted.vm(key(100)))).isNull();
    }

    @Test
    void connectionAlertFollowsEndpointStatus() {
        cluster.mode(FakePveCluster.Mode.UNREACHABLE);
        engine.registry.test("lab");

        AlertRecord lost = open().get(0);
        assertThat(lost.getDimension()).isEqualTo(AlertDimension.CONNECTION);
        assertThat(lost.getTitle()).isEqualTo("Connection lost: LAB");
        assertThat(lost.getSource().isEndpoint()).isTrue();
        assertThatThrownBy(() -> alerts.resolve(lost.getId())).isInstanceOf(InvalidRequestException.class);

        cluster.mode(FakePveCluster.Mode.UP);
        engine.registry.test("lab");

        assertThat(open()).isEmpty();
        assertThat(alerts.get(lost.getId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    void removingAnEndpointResolvesItsAlerts() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99), node("pve2", "offline", 0.0)), List.of()));
        assertThat(open()).hasSize(2);

        engine.registry.remove("lab");

        assertThat(open()).isEmpty();
        alerts.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.99)), List.of()));
        assertThat(open()).isEmpty();
    }

    @Test
    void reportedAlertsStayOpenAcrossPollsUntilTheirEndpointGoes() {
        AlertSource source = AlertSource.node("lab", "pve1");
        AlertRecord first = alerts.report(AlertLevel.CRITICAL, AlertKind.NETWORK, source, "Uplink flapping", "seen on the switch");
        AlertRecord second = alerts.report(null, null, source, "Uplink flapping", null);

        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.10)), List.of()));

        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(first.getKind()).isEqualTo(AlertKind.NETWORK);
        assertThat(second.getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(second.getKind()).isEqualTo(AlertKind.SYSTEM);
        assertThat(open()).extracting(AlertRecord::getId).containsExactlyInAnyOrder(first.getId(), second.getId());
        assertThatThrownBy(() -> alerts.report(null, null, source, "", null))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> alerts.report(null, null, AlertSource.endpoint("ghost", "ghost"), "Gone", null))
                .isInstanceOf(PveNotFoundException.class);

        engine.registry.remove("lab");

        assertThat(open()).isEmpty();
        assertThat(alerts.get(first.getId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);
    }

    @Test
    void listFiltersAndBulkActionsReportPerId() {
        alerts.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99), node("pve2", "online", 0.92)), List.of()));
        AlertRecord critical = alerts.list(new AlertFilter(null, AlertLevel.CRITICAL, null, "lab")).get(0);
        AlertRecord warning = alerts.list(new AlertFilter(null, AlertLevel.WARNING, null, null)).get(0);

        assertThat(alerts.list(AlertFilter.ALL)).extracting(AlertRecord::getId)
                .containsExactly(warning.getId(), critical.getId());
        assertThat(alerts.list(new AlertFilter(null, null, null, "elsewhere"))).isEmpty();

        AlertActionReport report = alerts.apply(List.of(critical.getId(), "alert-missing", warning.getId()),
                AlertAction.DELETE, null);

        assertThat(report.getProcessed()).containsExactly(critical.getId(), warning.getId());
        assertThat(report.getFailed()).containsOnlyKeys("alert-missing");
        assertThat(alerts.stats().getTotal()).isZero();
    }

    @Test
    void resolvedAlertsArePurgedAfterRetention() {
        MutableClock clock = new MutableClock(T0);
        AlertEngine timed = new AlertEngine(new PveProperties(), engine.registry, engine.broadcaster, engine.scheduler, clock);
        timed.evaluate(null, inventory(1, List.of(node("pve1", "online", 0.99)), List.of()));
        timed.evaluate(null, inventory(2, List.of(node("pve1", "online", 0.10)), List.of()));
        timed.evaluate(null, inventory(3, List.of(node("pve2", "online", 0.99)), List.of()));

        clock.advance(Duration.ofDays(31));

        assertThat(timed.purgeResolvedOlderThan(Duration.ofDays(30))).isEqualTo(1);
        assertThat(timed.list(AlertFilter.ALL)).singleElement().extracting(AlertRecord::isOpen).isEqualTo(true);
    }

    @Test
    void thresholdsMustBeOrdered() {
        assertThatThrownBy(() -> new AlertThresholds(80.0, 90.0, null)).isInstanceOf(IllegalArgumentException.class);

        AlertThresholds thresholds = new AlertThresholds(95.0, 85.0, 70.0);
        assertThat(thresholds.levelFor(85.0)).isEqualTo(AlertLevel.INFO);
        assertThat(thresholds.levelFor(95.5)).isEqualTo(AlertLevel.CRITICAL);
        assertThat(thresholds.levelFor(10.0)).isNull();
    }

    private List<AlertRecord> open() {
        List<AlertRecord> active = alerts.list(new AlertFilter(AlertStatus.ACTIVE, null, null, null));
        List<AlertRecord> acknowledged = alerts.list(new AlertFilter(AlertStatus.ACKNOWLEDGED, null, null, null));
        active.addAll(acknowledged);
        return active;
    }

    private static EndpointInventory inventory(long generation, List<NodeSnapshot> nodes, List<VmSnapshot> vms) {
        return new EndpointInventory("lab", generation, nodes, vms, T0);
    }

    private static NodeSnapshot node(String name, String status, double cpu) {
        return new NodeSnapshot("lab", name, status, cpu, 16, 10, 100, 10, 100, 3600, T0);
    }

    private static VmSnapshot vm(int vmid, String node, String status, double cpu, long netCounter,
                                 Instant capturedAt, boolean template) {
        return new VmSnapshot(new VmKey("lab", node, vmid), "vm-" + vmid, VmKind.QEMU, status, cpu, 2,
                10, 100, 0, 100, netCounter, 0, 60, template, capturedAt);
    }

    private static VmKey key(int vmid) {
        return new VmKey("lab", "pve1", vmid);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
