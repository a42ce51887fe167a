package org.tanzu.pvemcp.client;

/**
 * Receives the connection outcome of every request an executor completes.
 */
public interface StatusReporter {

    /** The endpoint answered an authenticated request. */
    void connected();

    /**
     * The endpoint could not be used.
     * @param cause Human-readable reason recorded as the last error
     */
    void failed(String cause);
}
