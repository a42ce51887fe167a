package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.pvemcp.exception.ErrorKind;
import org.tanzu.pvemcp.exception.PveApiException;
import org.tanzu.pvemcp.exception.PveAuthException;
import org.tanzu.pvemcp.exception.PveNotFoundException;
import org.tanzu.pvemcp.exception.PveTransientException;
import org.tanzu.pvemcp.support.FakePveCluster;
import org.tanzu.pvemcp.support.PveTestEngine;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RequestExecutorTest {

    private FakePveCluster cluster;
    private StatusReporter reporter;
    private RequestExecutor executor;

    @BeforeEach
    void setUp() {
        cluster = PveTestEngine.standardCluster();
        reporter = mock(StatusReporter.class);
        EndpointConfig config = PveTestEngine.endpoint("lab");
        ObjectMapper objectMapper = new ObjectMapper();
        executor = new RequestExecutor("lab", new SessionManager(config, cluster, objectMapper), cluster,
                new RetryPolicy(2, Duration.ZERO), reporter, objectMapper);
    }

    @Test
    void logsInFirstAndReturnsTheDataMember() {
        JsonNode nodes = executor.execute(HttpMethod.GET, "/nodes", Map.of());

        assertThat(nodes.isArray()).isTrue();
        assertThat(nodes.get(0).path("node").asText()).isEqualTo("pve1");
        assertThat(cluster.getLogins()).isEqualTo(1);
        verify(reporter).connected();
    }

    @Test
    void attachesTheAntiForgeryTokenOnlyToMutatingCalls() {
        executor.execute(HttpMethod.GET, "/nodes/pve1/qemu/100/status/current", Map.of());
        executor.execute(HttpMethod.POST, "/nodes/pve1/qemu/101/status/start", Map.of());

        List<TransportRequest> requests = cluster.getRequests();
        TransportRequest read = requests.get(1);
        TransportRequest write = requests.get(2);
        assertThat(read.getHeaders()).containsKey("Cookie").doesNotContainKey("CSRFPreventionToken");
        assertThat(write.getHeaders()).containsKeys("Cookie", "CSRFPreventionToken");
        assertThat(cluster.guestStatus(101)).isEqualTo("running");
    }

    @Test
    void reauthenticatesOnceWhenTheTicketExpires() {
        executor.execute(HttpMethod.GET, "/version", Map.of());
        cluster.expireTickets();

        JsonNode version = executor.execute(HttpMethod.GET, "/version", Map.of());

        assertThat(version.path("release").asText()).isEqualTo("8.2");
        assertThat(cluster.getLogins()).isEqualTo(2);
        verify(reporter, never()).failed(anyString());
    }

    @Test
    void secondUnauthorizedAnswerIsAnAuthFailure() {
        cluster.rejectTickets(true);

        assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/nodes", Map.of()))
                .isInstanceOf(PveAuthException.class)
                .hasMessageContaining("still unauthorized");
        assertThat(cluster.getLogins()).isEqualTo(2);
        verify(reporter).failed(anyString());
    }

    @Test
    void serverErrorsAreRetriedUpToTheBudget() {
        executor.execute(HttpMethod.GET, "/version", Map.of());
        cluster.mode(FakePveCluster.Mode.SERVER_ERROR);

        assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/nodes", Map.of()))
                .isInstanceOf(PveTransientException.class)
                .hasMessageContaining("after 3 attempt(s)")
                .satisfies(e -> assertThat(((PveTransientException) e).getKind()).isEqualTo(ErrorKind.TRANSIENT));
        assertThat(cluster.countRequests(HttpMethod.GET, "/nodes")).isEqualTo(3);
        verify(reporter).failed(anyString());
    }

    @Test
    void explicitRetryBudgetOverridesTheDefault() {
        cluster.mode(FakePveCluster.Mode.UNREACHABLE);

        assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/nodes", Map.of(), 0))
                .isInstanceOf(PveTransientException.class)
                .hasMessageContaining("Connection refused");
        assertThat(cluster.getRequests()).hasSize(1);
    }

    @Test
    void clientErrorsAreNotRetriedAndKeepTheEndpointConnected() {
        assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/nodes/pve9/qemu", Map.of()))
                .isInstanceOf(PveApiException.class)
                .hasMessageContaining("HTTP 404")
                .hasMessageContaining("no such node");
        assertThat(cluster.countRequests(HttpMethod.GET, "/nodes/pve9/qemu")).isEqualTo(1);
        verify(reporter).connected();
        verify(reporter, never()).failed(anyString());
    }

    @Test
    void connectionCheckForcesAFreshLogin() {
        executor.execute(HttpMethod.GET, "/nodes", Map.of());

        JsonNode version = executor.checkConnection();

        assertThat(version.path("version").asText()).isEqualTo("8.2.4");
        assertThat(cluster.getLogins()).isEqualTo(2);
    }

    @Test
    void closedExecutorRefusesCalls() {
        executor.close();

        assertThat(executor.isClosed()).isTrue();
        assertThatThrownBy(() -> executor.execute(HttpMethod.GET, "/nodes", Map.of()))
                .isInstanceOf(PveNotFoundException.class);
        assertThat(cluster.getRequests()).isEmpty();
    }

    @Test
    void booleanParametersAreSentAsFlags() {
        executor.execute(HttpMethod.PUT, "/nodes/pve1/qemu/100/config", Map.of("onboot", true));

        assertThat(cluster.guestConfig(100, "onboot")).isEqualTo("1");
    }
}
