package com.delta.research.pipeline.resolution;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Keys used to match raw entities against canonical ones. Every method returns null when the
 * input carries no usable key.
 */
public final class EntityNormalizer {
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private EntityNormalizer() {
    }

    public static String email(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.strip().toLowerCase(Locale.ROOT);
    }

    public static String personName(String name) {
        if (name == null) {
            return null;
        }
        String cleaned = NON_ALNUM.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * Lowercased LinkedIn URL without query, fragment or trailing slash; https assumed when the
     * scheme is missing.
     */
    public static String linkedin(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.strip();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        try {
            URI uri = new URI(value);
            if (uri.getRawAuthority() == null) {
                return null;
            }
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            return (uri.getScheme() + "://" + uri.getRawAuthority() + path).toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Host of a website URL, lowercased, without a trailing dot or leading {@code www.}.
     */
    public static String domain(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.strip();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        String host;
        try {
            host = new URI(value).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT).strip();
        while (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        return host.isEmpty() ? null : host;
    }

    public static String companyName(String name) {
        if (name == null) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(name.strip()).replaceAll(" ");
        return collapsed.isEmpty() ? null : collapsed.toLowerCase(Locale.ROOT);
    }

    public static String countryCode(String country) {
        if (country == null || country.isBlank()) {
            return null;
        }
        return country.strip().toUpperCase(Locale.ROOT);
    }
}
