package io.esub.core;

import java.util.Objects;

/**
 * The structured object sent as one frame per published item.
 *
 * @param key the rendezvous key
 * @param token the token, may be {@code null}
 * @param psub whether the server should prefer a persistent subscriber
 * @param data the payload
 */
public record Envelope(String key, String token, boolean psub, String data) {
    public Envelope {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(data, "data");
    }

    /**
     * Resolves an item against the session defaults. Item values win, then session values, then the
     * configured default token.
     *
     * @throws IllegalArgumentException if neither the item nor the session names a key
     */
    public static Envelope resolve(PublishItem item, String sessionKey, String sessionToken, boolean sessionPsub,
                                   String defaultToken) {
        Objects.requireNonNull(item, "item");
        String key = firstNonEmpty(item.key(), sessionKey);
        if (key == null) {
            throw new IllegalArgumentException("publish item has no key and the session has no default key");
        }
        String token = firstNonEmpty(item.token(), firstNonEmpty(sessionToken, defaultToken));
        boolean psub = item.psub() != null ? item.psub() : sessionPsub;
        return new Envelope(key, token, psub, item.data());
    }

    private static String firstNonEmpty(String a, String b) {
        if (a != null && !a.isEmpty()) return a;
        if (b != null && !b.isEmpty()) return b;
        return null;
    }
}
