package org.tanzu.pvemcp.connection;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Observable health of an endpoint.
 */
public enum ConnectionStatus {
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    ERROR("error");

    private final String value;

    ConnectionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
