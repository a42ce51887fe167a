package org.tanzu.pvemcp;

import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.tanzu.pvemcp.config.PveProperties;
import org.tanzu.pvemcp.connection.ConnectionRegistry;
import org.tanzu.pvemcp.pve.PveService;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "pve.endpoints[0].id=lab",
    "pve.endpoints[0].host=127.0.0.1",
    "pve.endpoints[0].port=1",
    "pve.endpoints[0].username=test-user",
    "pve.endpoints[0].password=test-password",
    "pve.endpoints[1].id=unresolved",
    "pve.endpoints[1].host=pve.example.com",
    "pve.endpoints[1].username=test-user",
    "pve.endpoints[1].password=${PVE_TEST_PASSWORD_UNSET}",
    "pve.polling.interval=1h",
    "pve.batch.denied-commands=systemctl stop"
})
class PveMcpApplicationTests {

    @Autowired
    private PveService pveService;

    @Autowired
    private PveProperties pveProperties;

    @Autowired
    private ConnectionRegistry connectionRegistry;

    @Autowired
    private ApplicationContext context;

    @Test
    void contextLoads() {
        assertThat(pveService).isNotNull();
        assertThat(pveProperties.getPolling().getInterval()).isEqualTo(Duration.ofHours(1));
        assertThat(pveProperties.getBatch().getDeniedCommands()).containsExactly("systemctl stop");
    }

    @Test
    void completeConfiguredEndpointsAreRegistered() {
        assertThat(connectionRegistry.ids()).containsExactly("lab");
        assertThat(pveService.listConnections()).hasSize(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void toolsAreExposed() {
        List<ToolCallback> tools = (List<ToolCallback>) context.getBean("registerTools", List.class);

        List<String> names = tools.stream()
                .map(tool -> tool.getToolDefinition().name())
                .collect(Collectors.toList());
        assertThat(names).contains("addEndpoint", "removeEndpoint", "testEndpoint", "listConnections",
                "getConnectionStats", "listNodes", "listVMs", "dispatchAction", "dispatchBatch", "getVmStatuses",
                "listBackupStorages", "getVmConfig", "updateVmConfig", "getTaskStatus", "listAlerts", "createAlert", "getAlertStats", "acknowledgeAlert", "resolveAlert",
                "deleteAlert", "applyAlertAction");
        assertThat(names).doesNotContain("subscribe", "requestSnapshot", "registerConfiguredEndpoints");
    }
}
