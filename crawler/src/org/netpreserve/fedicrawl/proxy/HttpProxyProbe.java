package org.netpreserve.fedicrawl.proxy;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes a proxy by fetching a fixed URL through it. Any 2xx-4xx response proves the egress path works.
 */
public class HttpProxyProbe implements ProxyProbe {
    private final ProxyHttpClients clients;
    private final URI probeUrl;
    private final Duration timeout;
    private final String userAgent;

    public HttpProxyProbe(ProxyHttpClients clients, URI probeUrl, Duration timeout, String userAgent) {
        this.clients = clients;
        this.probeUrl = probeUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public Duration probe(ProxyUri proxy) throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder(probeUrl)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();
        long start = System.nanoTime();
        var response = clients.forProxy(proxy).send(request, HttpResponse.BodyHandlers.discarding());
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        if (response.statusCode() >= 500 || response.statusCode() == 407) {
            throw new IOException("Probe through " + proxy.masked() + " returned HTTP " + response.statusCode());
        }
        return elapsed;
    }
}
