package org.tanzu.pvemcp.connection;

import org.tanzu.pvemcp.client.EndpointConfig;
import org.tanzu.pvemcp.client.RequestExecutor;
import org.tanzu.pvemcp.pve.PveApiClient;

/**
 * Everything the registry owns for one endpoint: its configuration, status tracker,
 * request executor and the typed API clients over that executor. The single-attempt
 * client serves batch dispatch, where a dead endpoint must cost one call timeout at most.
 */
public class EndpointConnection {

    private final EndpointConfig config;
    private final ConnectionStatusTracker tracker;
    private final RequestExecutor executor;
    private final PveApiClient api;
    private final PveApiClient singleAttemptApi;

    EndpointConnection(EndpointConfig config, ConnectionStatusTracker tracker, RequestExecutor executor) {
        this.config = config;
        this.tracker = tracker;
        this.executor = executor;
        this.api = new PveApiClient(executor);
        this.singleAttemptApi = api.singleAttempt();
    }

    public String getId() { return config.getId(); }
    public EndpointConfig getConfig() { return config; }
    public ConnectionState getState() { return tracker.current(); }
    public RequestExecutor getExecutor() { return executor; }
    public PveApiClient getApi() { return api; }
    public PveApiClient getSingleAttemptApi() { return singleAttemptApi; }

    public boolean isClosed() {
        return executor.isClosed();
    }

    void close() {
        executor.close();
        tracker.disconnected();
    }

    @Override
    public String toString() {
        return "EndpointConnection{config=" + config + ", state=" + tracker.current() + "}";
    }
}
