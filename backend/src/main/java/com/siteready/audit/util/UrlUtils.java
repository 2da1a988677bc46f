package com.siteready.audit.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    public static boolean isHttpUrl(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return false;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    /**
     * Prefixes {@code https://} when the input carries no scheme.
     */
    public static String ensureScheme(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return trimmed;
        }
        return "https://" + trimmed;
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * scheme://host[:port] with default ports dropped, or null when the URL has no host.
     */
    public static String origin(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || isDefaultPort(scheme, port)) {
            return scheme + "://" + host;
        }
        return scheme + "://" + host + ":" + port;
    }

    /**
     * Same host once a leading {@code www.} is dropped. Scheme is ignored; an explicit
     * non-default port still has to match.
     */
    public static boolean isSameSite(String rootUrl, String candidateUrl) {
        String rootKey = siteKey(rootUrl);
        return rootKey != null && rootKey.equals(siteKey(candidateUrl));
    }

    private static String siteKey(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int port = uri.getPort();
        return port == -1 || port == 80 || port == 443 ? host : host + ":" + port;
    }

    /**
     * Dedup key: lowercase scheme and host, trailing slash stripped, query and fragment dropped.
     * Returns the input unchanged when it cannot be parsed.
     */
    public static String normalize(String url) {
        String base = origin(url);
        if (base == null) {
            return url;
        }
        String path = safeUri(url).getRawPath();
        if (path == null) {
            path = "";
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return base + (path.isEmpty() ? "/" : path);
    }

    /**
     * Path plus query as robots rules see it; "/" for an empty path.
     */
    public static String pathAndQuery(String url) {
        URI uri = safeUri(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = uri.getRawQuery();
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    public static int pathDepth(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        String trimmed = stripSlashes(path);
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("/", -1).length;
    }

    /**
     * First segment of the URL path, or the empty string for the root.
     */
    public static String firstPathSegment(String url) {
        URI uri = safeUri(url);
        String path = uri == null || uri.getPath() == null ? "" : uri.getPath();
        String trimmed = stripSlashes(path);
        if (trimmed.isEmpty()) {
            return "";
        }
        int slash = trimmed.indexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(0, slash);
    }

    public static String stripFragment(String url) {
        if (url == null) {
            return null;
        }
        int hash = url.indexOf('#');
        return hash >= 0 ? url.substring(0, hash) : url;
    }

    private static String stripSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') {
            start++;
        }
        while (end > start && path.charAt(end - 1) == '/') {
            end--;
        }
        return path.substring(start, end);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
    }
}
