package org.tanzu.pvemcp.client;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * A configured remote PVE cluster.
 *
 * Instances are immutable. The identifier is unique within the registry and the
 * credentials are never rendered by {@link #toString()}.
 */
public final class EndpointConfig {

    /** Default PVE API port */
    public static final int DEFAULT_PORT = 8006;

    private final String id;
    private final String name;
    private final String host;
    private final int port;
    private final Credentials credentials;
    private final boolean useTls;

    public EndpointConfig(String id, String name, String host, int port, Credentials credentials, boolean useTls) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null || name.isBlank() ? id : name;
        this.host = Objects.requireNonNull(host, "host");
        this.port = port > 0 ? port : DEFAULT_PORT;
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.useTls = useTls;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getHost() { return host; }
    public int getPort() { return port; }
    public boolean isUseTls() { return useTls; }

    @JsonIgnore
    public Credentials getCredentials() { return credentials; }

    /**
     * Gets the root URL of the endpoint's JSON API.
     * @return For example {@code https://pve1.lab:8006/api2/json}
     */
    public String baseUrl() {
        return (useTls ? "https" : "http") + "://" + host + ":" + port + "/api2/json";
    }

    @Override
    public String toString() {
        return "EndpointConfig{id='" + id + "', name='" + name + "', host='" + host + "', port=" + port +
               ", credentials=" + credentials + ", useTls=" + useTls + "}";
    }
}
