package org.netpreserve.fedicrawl.api;

/**
 * A 4xx response other than 429. The requested resource is at fault, so the call is abandoned and the proxy is not
 * blamed.
 */
public class ClientErrorException extends ApiException {
    private final int status;

    public ClientErrorException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
