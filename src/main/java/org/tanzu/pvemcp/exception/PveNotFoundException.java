package org.tanzu.pvemcp.exception;

/**
 * An endpoint, node or virtual machine referenced by a caller is not known.
 */
public class PveNotFoundException extends PveException {

    public PveNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
