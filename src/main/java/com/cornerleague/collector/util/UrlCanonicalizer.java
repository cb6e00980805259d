package com.cornerleague.collector.util;

import lombok.experimental.UtilityClass;

import java.net.URI;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@UtilityClass
public class UrlCanonicalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "fbclid", "gclid", "dclid", "msclkid", "twclid",
            "_ga", "_gl", "mc_cid", "mc_eid", "ref", "referrer"
    );

    private static final Set<String> SESSION_PARAMS = Set.of(
            "sessionid", "session_id", "sid", "jsessionid", "phpsessid",
            "aspsessionid", "cfid", "cftoken", "_t", "timestamp", "cache_bust"
    );

    /**
     * Normalizes an absolute http(s) URL into the identifier used for canonical_url.
     * Returns null when the URL cannot be parsed or is not http(s).
     */
    public String canonicalize(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) return null;

            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) return null;

            host = host.toLowerCase(Locale.ROOT);
            if (host.startsWith("www.")) host = host.substring(4);

            int port = uri.getPort();
            boolean defaultPort = port == -1
                    || (scheme.equals("http") && port == 80)
                    || (scheme.equals("https") && port == 443);

            String path = uri.getRawPath();
            if (path == null || path.isEmpty()) path = "/";
            while (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }

            StringBuilder sb = new StringBuilder(url.length());
            sb.append(scheme).append("://").append(host);
            if (!defaultPort) sb.append(':').append(port);
            sb.append(path);

            String query = cleanQuery(uri.getRawQuery());
            if (!query.isEmpty()) sb.append('?').append(query);
            return sb.toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String hostOf(String url) {
        if (url == null || url.isBlank()) return null;
        try {
            String host = URI.create(url.trim()).getHost();
            if (host == null) return null;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isTrackingParam(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        return n.startsWith("utm_") || TRACKING_PARAMS.contains(n) || SESSION_PARAMS.contains(n);
    }

    private String cleanQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) return "";

        // first value wins for repeated params
        Map<String, String> kept = new LinkedHashMap<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            if (name.isEmpty() || isTrackingParam(name)) continue;
            kept.putIfAbsent(name, value);
        }

        List<Map.Entry<String, String>> entries = new ArrayList<>(kept.entrySet());
        entries.sort(Map.Entry.comparingByKey(Comparator.naturalOrder()));

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : entries) {
            if (!sb.isEmpty()) sb.append('&');
            sb.append(e.getKey());
            if (!e.getValue().isEmpty()) sb.append('=').append(e.getValue());
        }
        return sb.toString();
    }
}
