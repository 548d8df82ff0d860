package io.esub.client;

import java.time.Duration;
import java.util.Objects;

/**
 * One-shot wait for a value at a key.
 *
 * @param key the rendezvous key
 * @param token the token (optional, falls back to the configured token)
 * @param node a specific node to ask (optional, falls back to the configured host)
 * @param timeout how long to wait for the value (optional, may be null for no limit)
 */
public record SubRequest(String key, String token, String node, Duration timeout) {
    public SubRequest {
        Objects.requireNonNull(key, "key");
    }

    public static SubRequest of(String key) {
        return new SubRequest(key, null, null, null);
    }
}
