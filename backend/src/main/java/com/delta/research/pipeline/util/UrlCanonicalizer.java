package com.delta.research.pipeline.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Deterministic URL form used for fetching and deduping URL sources.
 */
public final class UrlCanonicalizer {
    private static final String DEFAULT_SCHEME = "http";

    private UrlCanonicalizer() {
    }

    /**
     * @throws IllegalArgumentException with {@code empty_url}, {@code invalid_url} or {@code invalid_host}
     */
    public static String canonicalize(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new IllegalArgumentException("empty_url");
        }
        String value = rawUrl.trim();
        if (!value.contains("://")) {
            value = DEFAULT_SCHEME + "://" + value;
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid_url", e);
        }
        String scheme = uri.getScheme() == null ? DEFAULT_SCHEME : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("invalid_url");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("invalid_host");
        }
        host = host.toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String authority = host;
        if (port > 0 && !(port == 80 && "http".equals(scheme)) && !(port == 443 && "https".equals(scheme))) {
            authority = host + ":" + port;
        }

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        path = path.replaceAll("/+", "/");
        if (!path.startsWith("/")) {
            path = "/" + path;
        }
        if (!"/".equals(path)) {
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
        }
        return scheme + "://" + authority + path;
    }

    public static boolean isValid(String rawUrl) {
        try {
            canonicalize(rawUrl);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
