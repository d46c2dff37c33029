package org.netpreserve.fedicrawl.proxy;

import org.jetbrains.annotations.Nullable;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One {@link HttpClient} per egress path, since the JDK client fixes its proxy at build time.
 */
public class ProxyHttpClients {
    private final Duration connectTimeout;
    private final HttpClient direct;
    private final ConcurrentMap<ProxyUri, HttpClient> clients = new ConcurrentHashMap<>();

    public ProxyHttpClients(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        this.direct = builder().build();
    }

    public HttpClient forProxy(@Nullable ProxyUri proxy) {
        if (proxy == null) return direct;
        return clients.computeIfAbsent(proxy, this::build);
    }

    private HttpClient.Builder builder() {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
    }

    private HttpClient build(ProxyUri proxy) {
        var builder = builder().proxy(ProxySelector.of(InetSocketAddress.createUnresolved(proxy.host(), proxy.port())));
        if (proxy.hasCredentials()) {
            var credentials = new PasswordAuthentication(proxy.username(), proxy.password().toCharArray());
            builder.authenticator(new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return getRequestorType() == RequestorType.PROXY ? credentials : null;
                }
            });
        }
        return builder.build();
    }
}
