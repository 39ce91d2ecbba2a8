package com.example.webcrawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Canonicalizes URLs into the keys used for deduplication.
 *
 * <p>Two URLs are the same key when they differ only in scheme or host case, a default port,
 * a fragment, a trailing slash on a non-root path, or {@code .}/{@code ..} path segments.
 * The query string is kept verbatim. A key is itself an absolute URL and normalizing it again
 * returns it unchanged.
 */
public final class UrlNormalizer {
    private static final String DEFAULT_SCHEME = "https://";

    private UrlNormalizer() {
    }

    /**
     * Returns the key for {@code raw}.
     *
     * @throws InvalidUrlException if {@code raw} is not an absolute http(s) URL with a host
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidUrlException(String.valueOf(raw), "empty");
        }
        URI uri;
        try {
            uri = new URI(raw.trim()).normalize();
        } catch (URISyntaxException ex) {
            throw new InvalidUrlException(raw, ex.getReason());
        }
        if (uri.getScheme() == null) {
            throw new InvalidUrlException(raw, "missing scheme");
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidUrlException(raw, "unsupported scheme " + scheme);
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new InvalidUrlException(raw, "missing host");
        }

        StringBuilder key = new StringBuilder(raw.length());
        key.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            key.append(uri.getRawUserInfo()).append('@');
        }
        key.append(host.toLowerCase(Locale.ROOT));
        int port = uri.getPort();
        if (port != -1 && !isDefaultPort(scheme, port)) {
            key.append(':').append(port);
        }
        key.append(normalizePath(uri.getRawPath()));
        String query = uri.getRawQuery();
        if (query != null && !query.isEmpty()) {
            key.append('?').append(query);
        }
        return key.toString();
    }

    /**
     * Prefixes {@code https://} when a user-supplied seed has no scheme at all.
     */
    public static String withDefaultScheme(String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty() || trimmed.contains("://")) {
            return trimmed;
        }
        return DEFAULT_SCHEME + trimmed;
    }

    /**
     * Host part of an already normalized key.
     */
    public static String host(String key) {
        return URI.create(key).getHost();
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        String path = rawPath;
        // URI.normalize() keeps leading ".." segments on absolute paths
        while (path.startsWith("/../")) {
            path = path.substring(3);
        }
        if (path.equals("/..")) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
    }
}
