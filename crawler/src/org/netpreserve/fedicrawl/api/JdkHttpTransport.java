package org.netpreserve.fedicrawl.api;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.proxy.ProxyHttpClients;
import org.netpreserve.fedicrawl.proxy.ProxyUri;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public class JdkHttpTransport implements Transport {
    private final ProxyHttpClients clients;
    private final String userAgent;
    private final Duration timeout;

    public JdkHttpTransport(ProxyHttpClients clients, String userAgent, Duration timeout) {
        this.clients = clients;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    @Override
    public Response get(URI uri, @Nullable ProxyUri proxy) throws IOException, InterruptedException {
        var request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        var response = clients.forProxy(proxy).send(request, HttpResponse.BodyHandlers.ofString());
        Duration retryAfter = response.headers().firstValue("Retry-After")
                .map(JdkHttpTransport::parseRetryAfter)
                .orElse(null);
        return new Response(response.statusCode(), response.body(), retryAfter);
    }

    /**
     * Retry-After is either delta-seconds or an HTTP date.
     */
    @Nullable
    static Duration parseRetryAfter(String value) {
        String trimmed = value.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(trimmed)));
        } catch (NumberFormatException e) {
            try {
                var date = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delay = Duration.between(ZonedDateTime.now(date.getZone()), date);
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException e2) {
                return null;
            }
        }
    }
}
