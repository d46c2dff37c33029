package org.netpreserve.fedicrawl.api;

/**
 * A response or entity that doesn't have the expected shape.
 */
public class ValidationException extends ApiException {
    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
