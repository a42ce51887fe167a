package org.tanzu.pvemcp.exception;

/**
 * A shell command matched the denylist and was refused before dispatch.
 */
public class PolicyViolationException extends PveException {

    public PolicyViolationException(String message) {
        super(ErrorKind.POLICY_VIOLATION, message);
    }
}
