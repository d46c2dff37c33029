package org.netpreserve.fedicrawl.api;

/**
 * Timeout, connection reset or 5xx response. Retried with backoff and counted against the proxy.
 */
public class TransientNetworkException extends ApiException {
    public TransientNetworkException(String message) {
        super(message);
    }

    public TransientNetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
