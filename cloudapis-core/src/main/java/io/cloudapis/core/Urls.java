package io.cloudapis.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build request URLs: endpoint plus path, with lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends {@code path} to the endpoint, keeping any base path the endpoint already has.
     */
    public static URI resolve(URI endpoint, String path) {
        Objects.requireNonNull(endpoint, "endpoint");
        String base = endpoint.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String suffix = path == null || path.isEmpty() ? "/" : path;
        if (!suffix.startsWith("/")) {
            suffix = "/" + suffix;
        }
        return URI.create(base + suffix);
    }

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getRawQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /**
     * Encodes a value so it can be substituted for a single path label: {@code /} is escaped and
     * spaces become {@code %20}, not {@code +}.
     */
    public static String encodePathSegment(String value) {
        return encode(value);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}
