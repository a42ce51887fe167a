package org.tanzu.pvemcp.client;

/**
 * Raw HTTP answer from an endpoint: status code, reason phrase and body text.
 */
public final class TransportResponse {

    private final int statusCode;
    private final String reason;
    private final String body;

    public TransportResponse(int statusCode, String reason, String body) {
        this.statusCode = statusCode;
        this.reason = reason == null ? "" : reason;
        this.body = body == null ? "" : body;
    }

    public int getStatusCode() { return statusCode; }
    public String getReason() { return reason; }
    public String getBody() { return body; }

    public boolean isSuccessful() { return statusCode >= 200 && statusCode < 300; }
    public boolean isUnauthorized() { return statusCode == 401; }
    public boolean isServerError() { return statusCode >= 500; }

    @Override
    public String toString() {
        return "TransportResponse{status=" + statusCode + ", reason='" + reason + "'}";
    }
}
