package org.tanzu.pvemcp.client;

/**
 * The request never produced an HTTP answer: connection refused, TLS failure,
 * DNS failure or the per-call timeout elapsed.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
