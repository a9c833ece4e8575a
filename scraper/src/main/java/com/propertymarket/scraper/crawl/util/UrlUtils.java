package com.propertymarket.scraper.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    /**
     * Canonical form used as the cache key: lowercase scheme and host, default port dropped,
     * fragment dropped, query parameters sorted.
     */
    public static String normalizeForKey(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return trimmed;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (!defaultPort) {
            out.append(':').append(port);
        }
        out.append(path);
        String query = uri.getRawQuery();
        if (query != null && !query.isBlank()) {
            List<String> params = new ArrayList<>(Arrays.asList(query.split("&")));
            params.removeIf(String::isBlank);
            params.sort(null);
            if (!params.isEmpty()) {
                out.append('?').append(String.join("&", params));
            }
        }
        return out.toString();
    }

    public static String withQueryParam(String url, String name, String value) {
        String base = url;
        String fragment = "";
        int hash = base.indexOf('#');
        if (hash >= 0) {
            fragment = base.substring(hash);
            base = base.substring(0, hash);
        }
        String separator = base.contains("?") ? "&" : "?";
        return base + separator + name + "=" + value + fragment;
    }

    public static String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String candidate = href.trim();
        if (candidate.startsWith("#") || candidate.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
            return null;
        }
        URI base = safeUri(baseUrl);
        URI target = safeUri(candidate);
        if (target == null) {
            return null;
        }
        if (target.isAbsolute() || base == null) {
            return target.isAbsolute() ? target.toString() : null;
        }
        return base.resolve(target).toString();
    }

    public static String citySlug(String city) {
        if (city == null) {
            return "";
        }
        return city.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
