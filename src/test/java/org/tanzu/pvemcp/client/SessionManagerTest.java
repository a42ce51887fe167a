package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tanzu.pvemcp.exception.PveAuthException;
import org.tanzu.pvemcp.support.FakePveCluster;
import org.tanzu.pvemcp.support.PveTestEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionManagerTest {

    private FakePveCluster cluster;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        cluster = PveTestEngine.standardCluster();
        sessionManager = new SessionManager(PveTestEngine.endpoint("lab"), cluster, new ObjectMapper());
    }

    @Test
    void logsInOnceAndReusesTheSession() {
        Session first = sessionManager.currentOrAuthenticate();
        Session second = sessionManager.currentOrAuthenticate();

        assertThat(second).isSameAs(first);
        assertThat(first.getUsername()).isEqualTo("root@pam");
        assertThat(first.getTicket()).startsWith("PVE:");
        assertThat(cluster.getLogins()).isEqualTo(1);
    }

    @Test
    void rejectedCredentialsFailWithoutKeepingASession() {
        cluster.password("rotated");

        assertThatThrownBy(() -> sessionManager.currentOrAuthenticate())
                .isInstanceOf(PveAuthException.class)
                .hasMessageContaining("Authentication rejected")
                .hasMessageNotContaining(FakePveCluster.PASSWORD);
        assertThat(sessionManager.hasSession()).isFalse();
    }

    @Test
    void unreachableHostIsAnAuthFailureWithTransportCause() {
        cluster.mode(FakePveCluster.Mode.UNREACHABLE);

        assertThatThrownBy(() -> sessionManager.authenticate())
                .isInstanceOf(PveAuthException.class)
                .hasCauseInstanceOf(TransportException.class);
    }

    @Test
    void invalidatingAStaleSessionKeepsTheNewerOne() {
        Session stale = sessionManager.currentOrAuthenticate();
        Session fresh = sessionManager.authenticate();

        sessionManager.invalidate(stale);

        assertThat(sessionManager.isValid(fresh)).isTrue();
        assertThat(sessionManager.isValid(stale)).isFalse();
        assertThat(sessionManager.current()).containsSame(fresh);
    }

    @Test
    void concurrentCallersShareOneLogin() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Session>> callers = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                callers.add(sessionManager::currentOrAuthenticate);
            }
            List<Session> sessions = new ArrayList<>();
            for (Future<Session> future : pool.invokeAll(callers)) {
                sessions.add(future.get());
            }

            assertThat(sessions).allSatisfy(session -> assertThat(session).isSameAs(sessions.get(0)));
            assertThat(cluster.getLogins()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void discardForgetsTheSession() {
        sessionManager.currentOrAuthenticate();

        sessionManager.discard();

        assertThat(sessionManager.hasSession()).isFalse();
    }
}
