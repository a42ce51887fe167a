package org.tanzu.pvemcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.tanzu.pvemcp.client.Credentials;
import org.tanzu.pvemcp.client.EndpointConfig;
import org.tanzu.pvemcp.client.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the PVE fleet server.
 *
 * This class uses Spring Boot's @ConfigurationProperties to bind settings with the
 * "pve" prefix from application.properties, environment variables and Cloud Foundry
 * service bindings (via PveConfigProcessor). Settings are grouped by concern:
 * - pve.endpoints[n].*: endpoints registered when the application starts
 * - pve.http.*: per-call timeout and TLS relaxation
 * - pve.retry.*: transient failure retry budget
 * - pve.polling.*: poll cadence, failure backoff and diff threshold
 * - pve.batch.*: batch worker pool size, deadline and extra denied shell commands
 * - pve.alerts.*: alert thresholds per dimension and resolved-alert retention
 */
@Component
@ConfigurationProperties(prefix = "pve")
public class PveProperties {

    /** Endpoints registered at startup */
    private List<Endpoint> endpoints = new ArrayList<>();

    private Http http = new Http();
    private Retry retry = new Retry();
    private Polling polling = new Polling();
    private Batch batch = new Batch();
    private Alerts alerts = new Alerts();

    public List<Endpoint> getEndpoints() { return endpoints; }
    public void setEndpoints(List<Endpoint> endpoints) { this.endpoints = endpoints; }

    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }

    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }

    public Polling getPolling() { return polling; }
    public void setPolling(Polling polling) { this.polling = polling; }

    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }

    public Alerts getAlerts() { return alerts; }
    public void setAlerts(Alerts alerts) { this.alerts = alerts; }

    /**
     * A statically configured endpoint.
     */
    public static class Endpoint {

        /** Unique endpoint identifier */
        private String id;

        /** Display name (defaults to the id) */
        private String name;

        /** PVE host name or IP address */
        private String host;

        /** PVE API port (default: 8006) */
        private int port = EndpointConfig.DEFAULT_PORT;

        /** Login user, with or without realm suffix */
        private String username;

        /** Login password */
        private String password;

        /** Authentication realm (default: pam) */
        private String realm = Credentials.DEFAULT_REALM;

        /** Whether to use HTTPS (default: true) */
        private boolean ssl = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getRealm() { return realm; }
        public void setRealm(String realm) { this.realm = realm; }

        public boolean isSsl() { return ssl; }
        public void setSsl(boolean ssl) { this.ssl = ssl; }

        /**
         * Checks that the fields needed to reach and log in to the endpoint are present.
         * Unresolved placeholders (${...}) count as missing.
         *
         * @return true if id, host, username and password are usable
         */
        public boolean isComplete() {
            return usable(id) && usable(host) && usable(username) && usable(password);
        }

        /**
         * Converts this binding into the immutable registry configuration.
         * @return The endpoint configuration
         */
        public EndpointConfig toEndpointConfig() {
            return new EndpointConfig(id, name, host, port, new Credentials(username, realm, password), ssl);
        }

        private static boolean usable(String value) {
            return value != null && !value.trim().isEmpty() && !value.contains("${");
        }

        @Override
        public String toString() {
            return "Endpoint{" +
                    "id='" + id + '\'' +
                    ", host='" + host + '\'' +
                    ", port=" + port +
                    ", username='" + username + '\'' +
                    ", password='[HIDDEN]'" +
                    ", realm='" + realm + '\'' +
                    ", ssl=" + ssl +
                    '}';
        }
    }

    /**
     * HTTP transport settings shared by all endpoints.
     */
    public static class Http {

        /** Timeout of a single remote call (default: 10s) */
        private Duration timeout = Duration.ofSeconds(10);

        /** Whether to skip certificate validation (default: true, PVE ships self-signed certificates) */
        private boolean insecure = true;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public boolean isInsecure() { return insecure; }
        public void setInsecure(boolean insecure) { this.insecure = insecure; }
    }

    /**
     * Retry budget for transient failures.
     */
    public static class Retry {

        /** Retries after the first attempt (default: 3) */
        private int maxRetries = 3;

        /** Delay unit; retry n waits n times this value (default: 1s) */
        private Duration baseDelay = Duration.ofSeconds(1);

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }

        public RetryPolicy toPolicy() {
            return RetryPolicy.linear(maxRetries, baseDelay);
        }
    }

    /**
     * Inventory polling settings.
     */
    public static class Polling {

        /** Delay between the end of one poll and the start of the next (default: 30s) */
        private Duration interval = Duration.ofSeconds(30);

        /** Upper bound of the failure backoff (default: 5m) */
        private Duration maxBackoff = Duration.ofMinutes(5);

        /** Minimum usage change, in percentage points, reported as a change (default: 1.0) */
        private double changeThreshold = 1.0;

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }

        public double getChangeThreshold() { return changeThreshold; }
        public void setChangeThreshold(double changeThreshold) { this.changeThreshold = changeThreshold; }
    }

    /**
     * Batch dispatch settings.
     */
    public static class Batch {

        /** Worker threads shared by all dispatches (default: 4) */
        private int concurrency = 4;

        /** Deadline for a whole dispatch (default: 60s) */
        private Duration timeout = Duration.ofSeconds(60);

        /** Shell command fragments denied in addition to the built-in list */
        private List<String> deniedCommands = new ArrayList<>();

        public int getConcurrency() { return concurrency; }
        public void setConcurrency(int concurrency) { this.concurrency = concurrency; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public List<String> getDeniedCommands() { return deniedCommands; }
        public void setDeniedCommands(List<String> deniedCommands) { this.deniedCommands = deniedCommands; }
    }

    /**
     * Alert thresholds and retention.
     *
     * Usage thresholds are percentages; network thresholds are bytes per second.
     */
    public static class Alerts {

        private Threshold cpu = new Threshold(95.0, 90.0, null);
        private Threshold memory = new Threshold(95.0, 85.0, null);
        private Threshold disk = new Threshold(90.0, 80.0, null);
        private Threshold network = new Threshold(500.0 * 1024 * 1024, 100.0 * 1024 * 1024, null);

        /** How long resolved alerts are kept (default: 30 days) */
        private Duration retention = Duration.ofDays(30);

        public Threshold getCpu() { return cpu; }
        public void setCpu(Threshold cpu) { this.cpu = cpu; }

        public Threshold getMemory() { return memory; }
        public void setMemory(Threshold memory) { this.memory = memory; }

        public Threshold getDisk() { return disk; }
        public void setDisk(Threshold disk) { this.disk = disk; }

        public Threshold getNetwork() { return network; }
        public void setNetwork(Threshold network) { this.network = network; }

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
    }

    /**
     * Threshold levels for one dimension. A level left unset never fires.
     */
    public static class Threshold {

        private Double critical;
        private Double warning;
        private Double info;

        public Threshold() {
        }

        public Threshold(Double critical, Double warning, Double info) {
            this.critical = critical;
            this.warning = warning;
            this.info = info;
        }

        public Double getCritical() { return critical; }
        public void setCritical(Double critical) { this.critical = critical; }

        public Double getWarning() { return warning; }
        public void setWarning(Double warning) { this.warning = warning; }

        public Double getInfo() { return info; }
        public void setInfo(Double info) { this.info = info; }
    }

    @Override
    public String toString() {
        return "PveProperties{" +
                "endpoints=" + endpoints +
                ", timeout=" + http.getTimeout() +
                ", insecure=" + http.isInsecure() +
                ", maxRetries=" + retry.getMaxRetries() +
                ", pollInterval=" + polling.getInterval() +
                ", batchConcurrency=" + batch.getConcurrency() +
                '}';
    }
}
