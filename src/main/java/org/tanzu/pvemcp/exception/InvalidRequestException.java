package org.tanzu.pvemcp.exception;

/**
 * The request cannot apply to its target: wrong guest kind, missing parameter or a
 * state transition that is not allowed.
 */
public class InvalidRequestException extends PveException {

    public InvalidRequestException(String message) {
        super(ErrorKind.INVALID_REQUEST, message);
    }
}
