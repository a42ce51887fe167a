package org.tanzu.pvemcp.exception;

/**
 * Authentication against an endpoint failed: the credentials were rejected, the
 * ticket request could not be sent, or a request stayed unauthorized after one
 * fresh login.
 */
public class PveAuthException extends PveException {

    public PveAuthException(String message) {
        super(ErrorKind.AUTH, message);
    }

    public PveAuthException(String message, Throwable cause) {
        super(ErrorKind.AUTH, message, cause);
    }
}
