package org.netpreserve.fedicrawl.proxy;

import java.io.IOException;
import java.time.Duration;

/**
 * Issues a lightweight request through a proxy.
 */
public interface ProxyProbe {
    /**
     * @return the observed response time
     * @throws IOException if the probe failed or timed out
     */
    Duration probe(ProxyUri proxy) throws IOException, InterruptedException;
}
