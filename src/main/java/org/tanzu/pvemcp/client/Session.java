package org.tanzu.pvemcp.client;

import java.time.Instant;

/**
 * Authentication state for one endpoint: the ticket sent as a cookie on every call
 * and the anti-forgery token required on mutating calls.
 *
 * Sessions never leave the client package.
 */
final class Session {

    private final String ticket;
    private final String csrfToken;
    private final String username;
    private final Instant issuedAt;

    Session(String ticket, String csrfToken, String username, Instant issuedAt) {
        this.ticket = ticket;
        this.csrfToken = csrfToken;
        this.username = username;
        this.issuedAt = issuedAt;
    }

    String getTicket() { return ticket; }
    String getCsrfToken() { return csrfToken; }
    String getUsername() { return username; }
    Instant getIssuedAt() { return issuedAt; }

    @Override
    public String toString() {
        return "Session{username='" + username + "', issuedAt=" + issuedAt + "}";
    }
}
