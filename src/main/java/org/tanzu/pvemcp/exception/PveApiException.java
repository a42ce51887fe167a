package org.tanzu.pvemcp.exception;

/**
 * The endpoint answered, but refused the request with a client error (4xx other
 * than 401). Such answers are never retried.
 */
public class PveApiException extends PveException {

    private final int statusCode;

    public PveApiException(int statusCode, String message) {
        super(ErrorKind.REMOTE, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
