package org.netpreserve.fedicrawl.api;

/**
 * A failed upstream call. Subclasses determine whether the call is retried and whether the egress proxy is blamed.
 */
public abstract class ApiException extends Exception {
    protected ApiException(String message) {
        super(message);
    }

    protected ApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
