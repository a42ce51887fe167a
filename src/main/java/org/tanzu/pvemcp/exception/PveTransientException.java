package org.tanzu.pvemcp.exception;

/**
 * A request kept failing with timeouts, connection errors or 5xx answers until
 * its retry budget ran out.
 */
public class PveTransientException extends PveException {

    public PveTransientException(String message) {
        super(ErrorKind.TRANSIENT, message);
    }

    public PveTransientException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT, message, cause);
    }
}
