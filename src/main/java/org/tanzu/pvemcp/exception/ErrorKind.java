package org.tanzu.pvemcp.exception;

/**
 * Classification of failures surfaced by the engine.
 *
 * Every {@link PveException} carries one of these kinds, and so does every failed
 * batch result, so callers can react to the category without parsing messages.
 */
public enum ErrorKind {
    /** Bad credentials or an authorization failure that survived one re-authentication. */
    AUTH,
    /** Timeout, refused connection or 5xx answer that exhausted the retry budget. */
    TRANSIENT,
    /** The endpoint answered with a non-retryable client error. */
    REMOTE,
    /** A command rejected by the shell denylist before it was dispatched. */
    POLICY_VIOLATION,
    /** A batch target still pending when the pool-wide deadline elapsed. */
    TIMEOUT,
    /** The endpoint, node or virtual machine is not known. */
    NOT_FOUND,
    /** The action does not apply to the target (wrong kind, missing parameter). */
    INVALID_REQUEST,
    /** Unexpected failure inside the engine itself. */
    INTERNAL
}
