package io.esub.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Builds esub endpoint URLs with lexicographically sorted query parameter keys.
 *
 * <p>Absent parameters are omitted, and so is the {@code ?} when nothing remains.
 */
public final class EsubUrls {
    private EsubUrls() {}

    public static URI base(String scheme, String host, int port) {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        return URI.create(scheme + "://" + host + ":" + port);
    }

    public static URI info(URI base) {
        return path(base, Protocol.P_INFO);
    }

    public static URI sub(URI base, String key, String token) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_TOKEN, token);
        return withQuery(path(base, Protocol.P_SUB, key), q);
    }

    public static URI rep(URI base, String key, String token, boolean psub) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_TOKEN, token);
        q.put(Protocol.Q_PSUB, psub ? Protocol.FLAG_ON : null);
        return withQuery(path(base, Protocol.P_REP, key), q);
    }

    public static URI psub(URI base, Subscription subscription) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_TOKEN, subscription.token());
        q.put(Protocol.Q_SHARED, subscription.shared() ? Protocol.FLAG_ON : null);
        q.put(Protocol.Q_TIMEOUT, timeoutSeconds(subscription.timeout()));
        return withQuery(path(base, Protocol.P_PSUB, subscription.key()), q);
    }

    public static URI prep(URI base, String token, boolean psub) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(Protocol.Q_TOKEN, token);
        q.put(Protocol.Q_PSUB, psub ? Protocol.FLAG_ON : null);
        return withQuery(path(base, Protocol.P_PREP), q);
    }

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (e.getKey() != null && e.getValue() != null && !e.getValue().isEmpty()) {
                sorted.put(e.getKey(), e.getValue());
            }
        }
        if (sorted.isEmpty()) return base;

        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    private static URI path(URI base, String... segments) {
        Objects.requireNonNull(base, "base");
        StringBuilder sb = new StringBuilder(base.toString());
        if (sb.length() > 0 && sb.charAt(sb.length() - 1) == '/') {
            sb.setLength(sb.length() - 1);
        }
        for (String segment : segments) {
            Objects.requireNonNull(segment, "segment");
            sb.append('/').append(encode(segment).replace("+", "%20"));
        }
        return URI.create(sb.toString());
    }

    private static String timeoutSeconds(Duration timeout) {
        if (timeout == null) return null;
        long seconds = timeout.toSeconds();
        return seconds > 0 ? Long.toString(seconds) : null;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
