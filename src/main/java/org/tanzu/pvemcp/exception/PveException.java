package org.tanzu.pvemcp.exception;

/**
 * Base class for every failure raised while talking to a PVE endpoint or
 * governing the commands sent to it.
 */
public class PveException extends RuntimeException {

    private final ErrorKind kind;

    public PveException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PveException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the failure category.
     * @return The error kind, never null
     */
    public ErrorKind getKind() {
        return kind;
    }
}
