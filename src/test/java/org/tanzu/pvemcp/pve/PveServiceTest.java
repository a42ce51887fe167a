package org.tanzu.pvemcp.pve;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.pvemcp.alert.AlertActionReport;
import org.tanzu.pvemcp.alert.AlertKind;
import org.tanzu.pvemcp.alert.AlertLevel;
import org.tanzu.pvemcp.alert.AlertRecord;
import org.tanzu.pvemcp.alert.AlertStatus;
import org.tanzu.pvemcp.batch.BatchAction;
import org.tanzu.pvemcp.batch.BatchResult;
import org.tanzu.pvemcp.batch.BatchTarget;
import org.tanzu.pvemcp.batch.GuestStatus;
import org.tanzu.pvemcp.client.TransportRequest;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionState;
import org.tanzu.pvemcp.connection.ConnectionStatus;
import org.tanzu.pvemcp.event.EventType;
import org.tanzu.pvemcp.event.PveEvent;
import org.tanzu.pvemcp.event.StateSnapshot;
import org.tanzu.pvemcp.exception.ErrorKind;
import org.tanzu.pvemcp.inventory.NodeSnapshot;
import org.tanzu.pvemcp.inventory.VmSnapshot;
import org.tanzu.pvemcp.support.FakePveCluster;
import org.tanzu.pvemcp.support.PveTestEngine;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PveServiceTest {

    private PveTestEngine engine;
    private PveService service;
    private FakePveCluster a;
    private FakePveCluster b;

    @BeforeEach
    void setUp() {
        engine = new PveTestEngine(new PveProperties());
        service = engine.service;
        a = engine.serve("a.pve.test", PveTestEngine.standardCluster());
        b = engine.serve("b.pve.test", PveTestEngine.standardCluster());
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void addEndpointValidatesAndNeverEchoesThePassword() {
        OperationResult added = add("a");
        OperationResult duplicate = add("a");
        OperationResult incomplete = service.addEndpoint("c", null, "c.pve.test", null, "root", " ", null, null);

        assertThat(added.isSuccess()).isTrue();
        assertThat(duplicate.isSuccess()).isFalse();
        assertThat(duplicate.getMessage()).contains("already registered");
        assertThat(incomplete.isSuccess()).isFalse();
        assertThat(List.of(added, duplicate, incomplete)).allSatisfy(
                result -> assertThat(result.getMessage()).doesNotContain(FakePveCluster.PASSWORD));
        assertThat(service.listConnections()).extracting(ConnectionState::getEndpointId).containsExactly("a");
    }

    @Test
    void testAndRemoveReportUnknownEndpoints() {
        assertThat(service.testEndpoint("nope").isSuccess()).isFalse();
        assertThat(service.removeEndpoint("nope").getMessage()).contains("not registered");
    }

    @Test
    void testEndpointReportsTheCause() {
        add("a");
        a.password("rotated");

        OperationResult result = service.testEndpoint("a");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("Authentication rejected");
        assertThat(service.getConnectionStats().getError()).isEqualTo(1);
    }

    @Test
    void oneUnreachableEndpointDoesNotHoldUpTheOther() {
        add("a");
        add("b");
        engine.poller.pollNow("a");
        engine.poller.pollNow("b");
        b.mode(FakePveCluster.Mode.UNREACHABLE);
        assertThat(service.testEndpoint("b").isSuccess()).isFalse();

        assertThat(service.listConnections()).extracting(ConnectionState::getStatus)
                .containsExactly(ConnectionStatus.CONNECTED, ConnectionStatus.ERROR);

        a.latency(Duration.ofMillis(700));
        b.latency(Duration.ofMillis(700));
        long start = System.nanoTime();
        BatchReport report = service.dispatchBatch(
                List.of(BatchTarget.vm("a", "pve1", 101), BatchTarget.vm("b", "pve1", 101)), "start", null, null,
                null, null, null);
        long elapsed = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(report.getAction()).isEqualTo(BatchAction.START);
        assertThat(report.getTotal()).isEqualTo(2);
        assertThat(report.getResults().get(0).isSuccess()).isTrue();
        assertThat(a.guestStatus(101)).isEqualTo("running");
        BatchResult failed = report.getResults().get(1);
        assertThat(failed.getErrorKind()).isEqualTo(ErrorKind.TRANSIENT);
        assertThat(failed.getError()).contains("after 1 attempt(s)");
        assertThat(report.getFailed()).isEqualTo(1);
        assertThat(elapsed).isLessThan(1900);
    }

    @Test
    void liveStatusesAreReadPerGuest() {
        add("a");
        engine.poller.pollNow("a");
        a.guestStatus(101, "running");

        List<GuestStatus> statuses = service.getVmStatuses(List.of(
                BatchTarget.vm("a", "pve1", 100), BatchTarget.vm("a", "pve1", 101), BatchTarget.vm("z", "pve1", 100)));

        assertThat(statuses).extracting(GuestStatus::getStatus).containsExactly("running", "running", "unknown");
        assertThat(statuses.get(2).getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(service.getVmStatuses(null)).isEmpty();
    }

    @Test
    void backupStoragesExcludeOtherContent() {
        add("a");
        a.nodeStatus("pve2", "offline");

        List<BackupStorage> all = service.listBackupStorages("a", null);
        List<BackupStorage> pve2 = service.listBackupStorages("a", "pve2");

        assertThat(all).extracting(BackupStorage::getNode).containsExactly("pve1");
        assertThat(all).extracting(BackupStorage::getStorage).containsExactly("local");
        assertThat(all.get(0).getType()).isEqualTo("dir");
        assertThat(all.get(0).getAvailable()).isEqualTo(380L << 30);
        assertThat(pve2).extracting(BackupStorage::getStorage).containsExactly("local");
        assertThatThrownBy(() -> service.listBackupStorages("nope", null))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("not registered");
    }

    @Test
    void backupOptionsReachTheNode() {
        add("a");
        engine.poller.pollNow("a");

        BatchResult backup = service.dispatchAction("a", "pve1", 100, "backup", null, "local", "stop", "gzip",
                "{{guestname}} before upgrade");
        BatchResult defaults = service.dispatchAction("a", "pve1", 101, "backup", null, "local", null, null, null);

        assertThat(backup.isSuccess()).isTrue();
        Map<String, String> params = vzdumpParams(0);
        assertThat(params).containsEntry("vmid", "100").containsEntry("storage", "local")
                .containsEntry("mode", "stop").containsEntry("compress", "gzip")
                .containsEntry("notes-template", "{{guestname}} before upgrade");
        assertThat(defaults.isSuccess()).isTrue();
        assertThat(vzdumpParams(1)).containsEntry("mode", "snapshot").containsEntry("compress", "zstd")
                .doesNotContainKey("notes-template");
    }

    @Test
    void createdAlertsStayOpenUntilResolved() {
        add("a");
        engine.poller.pollNow("a");

        AlertRecord guest = service.createAlert("Disk filling up", "seen by the backup job", "critical", "system",
                "a", "pve1", 100);
        AlertRecord endpoint = service.createAlert("Maintenance tonight", null, null, null, "a", null, null);
        engine.poller.pollNow("a");

        assertThat(guest.getSource().getLabel()).isEqualTo("web");
        assertThat(guest.getLevel()).isEqualTo(AlertLevel.CRITICAL);
        assertThat(endpoint.getLevel()).isEqualTo(AlertLevel.WARNING);
        assertThat(endpoint.getKind()).isEqualTo(AlertKind.SYSTEM);
        assertThat(endpoint.getSource().isEndpoint()).isTrue();
        assertThat(service.listAlerts("active", null, "system", "a")).extracting(AlertRecord::getId)
                .contains(guest.getId(), endpoint.getId());
        assertThat(service.resolveAlert(guest.getId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);
        assertThatThrownBy(() -> service.createAlert("Orphan", null, null, null, "nope", null, null))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("not registered");
        assertThatThrownBy(() -> service.createAlert(" ", null, null, null, "a", null, null))
                .hasMessageContaining("needs a title");
        assertThatThrownBy(() -> service.createAlert("No node", null, null, null, "a", null, 100))
                .hasMessageContaining("needs the guest's node");
    }

    @Test
    void removalDuringAPollLeavesNoTraceAndKeepsSubscribersAlive() throws Exception {
        add("a");
        add("b");
        engine.poller.pollNow("a");
        engine.poller.pollNow("b");
        List<PveEvent> events = new CopyOnWriteArrayList<>();
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        Disposable subscription = service.subscribe().subscribe(events::add, errors::add);
        try {
            a.latency(Duration.ofMillis(300));
            int before = a.getRequests().size();
            Thread cycle = new Thread(() -> engine.poller.pollNow("a"));
            cycle.start();
            await().atMost(Duration.ofSeconds(2)).until(() -> a.getRequests().size() > before);

            assertThat(service.removeEndpoint("a").isSuccess()).isTrue();
            cycle.join(5000);

            assertThat(service.listNodes(null)).extracting(NodeSnapshot::getEndpointId).containsOnly("b");
            assertThat(service.listVMs(null)).extracting(VmSnapshot::getEndpointId).containsOnly("b");
            assertThat(errors).isEmpty();
            assertThat(events).extracting(PveEvent::getType).contains(EventType.ENDPOINT_REMOVED);
            assertThat(engine.broadcaster.getSubscriberCount()).isEqualTo(1);
        } finally {
            subscription.dispose();
        }
    }

    @Test
    void dispatchActionRunsASingleTarget() {
        add("a");
        engine.poller.pollNow("a");

        BatchResult result = service.dispatchAction("a", "pve2", 200, "shutdown", null, null, null, null, null);
        BatchResult shell = service.dispatchAction("a", "pve1", null, "shell", "uptime", null, null, null, null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(a.guestStatus(200)).isEqualTo("stopped");
        assertThat(shell.getOutput()).contains("uptime");
        assertThatThrownBy(() -> service.dispatchAction("a", "pve1", 100, "explode", null, null, null, null, null))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("Invalid action 'explode'");
    }

    @Test
    void guestConfigIsReadAndUpdatedByKind() {
        add("a");
        engine.poller.pollNow("a");

        JsonNode config = service.getVmConfig("a", "pve2", 200);
        OperationResult updated = service.updateVmConfig("a", "pve2", 200, Map.of("memory", "4096"));
        OperationResult empty = service.updateVmConfig("a", "pve2", 200, Map.of());

        assertThat(config.path("name").asText()).isEqualTo("cache");
        assertThat(updated.isSuccess()).isTrue();
        assertThat(a.guestConfig(200, "memory")).isEqualTo("4096");
        assertThat(empty.isSuccess()).isFalse();
        assertThatThrownBy(() -> service.getVmConfig("a", "pve2", 999))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void taskStatusIsReadFromTheNode() {
        add("a");

        JsonNode status = service.getTaskStatus("a", "pve1", "UPID:pve1:00001:qmstart:100:root@pam:");

        assertThat(status.path("exitstatus").asText()).isEqualTo("OK");
    }

    @Test
    void alertToolsParseTheirFilters() {
        add("a");
        a.nodeCpu("pve1", 0.99);
        engine.poller.pollNow("a");

        List<AlertRecord> critical = service.listAlerts("active", "critical", "performance", "a");
        assertThat(critical).hasSize(1);
        assertThat(service.getAlertStats().getActive()).isEqualTo(1);

        AlertRecord acknowledged = service.acknowledgeAlert(critical.get(0).getId(), "ops");
        assertThat(acknowledged.getStatus()).isEqualTo(AlertStatus.ACKNOWLEDGED);
        assertThat(service.resolveAlert(critical.get(0).getId()).getStatus()).isEqualTo(AlertStatus.RESOLVED);

        AlertActionReport report = service.applyAlertAction(List.of(critical.get(0).getId(), "alert-x"), "delete", null);
        assertThat(report.getProcessedCount()).isEqualTo(1);
        assertThat(report.getFailedCount()).isEqualTo(1);
        assertThat(service.deleteAlert("alert-x").isSuccess()).isFalse();

        assertThatThrownBy(() -> service.listAlerts(null, "catastrophic", null, null))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("Failed to list alerts");
        assertThatThrownBy(() -> service.acknowledgeAlert("alert-x", null))
                .hasMessageContaining("not found");
    }

    @Test
    void snapshotRequestsReturnTheAskedPart() {
        add("a");
        engine.poller.pollNow("a");

        StateSnapshot vms = service.requestSnapshot("vms");
        StateSnapshot all = service.requestSnapshot(null);

        assertThat(vms.getVms()).hasSize(3);
        assertThat(vms.getNodes()).isEmpty();
        assertThat(all.getConnections()).hasSize(1);
        assertThat(all.getNodes()).hasSize(2);
    }

    @Test
    void configuredEndpointsAreRegisteredWhenReady() {
        PveProperties.Endpoint complete = endpoint("a", FakePveCluster.PASSWORD);
        PveProperties.Endpoint placeholder = endpoint("b", "${PVE_PASSWORD}");
        engine.properties.getEndpoints().add(complete);
        engine.properties.getEndpoints().add(placeholder);

        service.registerConfiguredEndpoints();

        assertThat(service.listConnections()).extracting(ConnectionState::getEndpointId).containsExactly("a");
    }

    private Map<String, String> vzdumpParams(int index) {
        return a.getRequests().stream()
                .filter(request -> "/nodes/pve1/vzdump".equals(request.getPath()))
                .map(TransportRequest::getParams)
                .collect(Collectors.toList())
                .get(index);
    }

    private OperationResult add(String id) {
        return service.addEndpoint(id, id.toUpperCase(), id + ".pve.test", 8006,
                FakePveCluster.USERNAME, FakePveCluster.PASSWORD, "pam", true);
    }

    private static PveProperties.Endpoint endpoint(String id, String password) {
        PveProperties.Endpoint endpoint = new PveProperties.Endpoint();
        endpoint.setId(id);
        endpoint.setHost(id + ".pve.test");
        endpoint.setUsername(FakePveCluster.USERNAME);
        endpoint.setPassword(password);
        return endpoint;
    }
}
