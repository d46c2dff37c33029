package org.netpreserve.fedicrawl;

/**
 * The shared coordination store could not be reached.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
