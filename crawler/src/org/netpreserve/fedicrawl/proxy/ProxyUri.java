package org.netpreserve.fedicrawl.proxy;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.fedicrawl.config.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A parsed egress proxy address. The canonical string form, {@code scheme://[user:pass@]host:port}, identifies the
 * proxy in the store.
 */
public record ProxyUri(String scheme, String host, int port, @Nullable String username, @Nullable String password) {
    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");
    private static final Set<String> SOCKS_SCHEMES = Set.of("socks", "socks4", "socks5");
    private static final Pattern CREDENTIALS = Pattern.compile("://([^:/@]+):[^@]*@");

    public ProxyUri {
        if (!SUPPORTED_SCHEMES.contains(scheme)) throw new ConfigurationException("Unsupported proxy scheme: " + scheme);
        if (StringUtils.isBlank(host) || StringUtils.containsWhitespace(host)) {
            throw new ConfigurationException("Invalid proxy host: " + host);
        }
        if (port < 1 || port > 65535) throw new ConfigurationException("Proxy port out of range: " + port);
        if ((username == null) != (password == null)) {
            throw new ConfigurationException("Proxy credentials need both a username and a password");
        }
    }

    /**
     * Parses {@code scheme://[user:pass@]host:port}, {@code host:port} (plain HTTP) or {@code host:port:user:pass}.
     *
     * @throws ConfigurationException if the entry is malformed or uses a scheme we can't tunnel through
     */
    public static ProxyUri parse(String text) {
        String entry = StringUtils.trimToEmpty(text);
        if (entry.isEmpty()) throw new ConfigurationException("Empty proxy entry");
        if (entry.contains("://")) return parseUri(entry);

        String[] parts = entry.split(":", -1);
        if (parts.length == 2) {
            return new ProxyUri("http", parts[0], parsePort(parts[1], entry), null, null);
        } else if (parts.length == 4) {
            return new ProxyUri("http", parts[0], parsePort(parts[1], entry), parts[2], parts[3]);
        }
        throw new ConfigurationException("Unrecognised proxy format: " + mask(entry));
    }

    private static ProxyUri parseUri(String entry) {
        URI uri;
        try {
            uri = new URI(entry);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid proxy URI: " + mask(entry), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (SOCKS_SCHEMES.contains(scheme)) {
            throw new ConfigurationException("SOCKS proxies are not supported by the HTTP transport: " + mask(entry));
        }
        if (uri.getHost() == null) throw new ConfigurationException("Proxy URI has no host: " + mask(entry));
        if (uri.getPort() == -1) throw new ConfigurationException("Proxy URI has no port: " + mask(entry));
        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) throw new ConfigurationException("Proxy credentials need a password: " + mask(entry));
            username = userInfo.substring(0, colon);
            password = userInfo.substring(colon + 1);
        }
        return new ProxyUri(scheme, uri.getHost(), uri.getPort(), username, password);
    }

    private static int parsePort(String port, String entry) {
        try {
            return Integer.parseInt(port);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid proxy port in " + mask(entry));
        }
    }

    /**
     * Hides the password of a proxy entry in either textual form so it can be logged.
     */
    public static String mask(String entry) {
        if (entry.contains("://")) return CREDENTIALS.matcher(entry).replaceFirst("://$1:***@");
        String[] parts = entry.split(":", -1);
        if (parts.length == 4) return parts[0] + ":" + parts[1] + ":" + parts[2] + ":***";
        return entry;
    }

    public boolean hasCredentials() {
        return username != null;
    }

    public String masked() {
        return hasCredentials() ? scheme + "://" + username + ":***@" + host + ":" + port : toString();
    }

    @Override
    public String toString() {
        return hasCredentials() ? scheme + "://" + username + ":" + password + "@" + host + ":" + port
                : scheme + "://" + host + ":" + port;
    }
}
