package org.netpreserve.fedicrawl.api;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.proxy.ProxyUri;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Sends a GET request, optionally through an egress proxy.
 */
public interface Transport {
    /**
     * @throws IOException on connection failure or timeout
     */
    Response get(URI uri, @Nullable ProxyUri proxy) throws IOException, InterruptedException;

    /**
     * @param retryAfter value of the Retry-After header, if any
     */
    record Response(int status, String body, @Nullable Duration retryAfter) {
    }
}
