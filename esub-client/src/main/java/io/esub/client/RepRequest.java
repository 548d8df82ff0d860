package io.esub.client;

import java.time.Duration;
import java.util.Objects;

/**
 * One-shot reply to a waiting sub.
 *
 * @param key the rendezvous key
 * @param data the body to post
 * @param token the token (optional, falls back to the configured token)
 * @param node a specific node to post to (optional)
 * @param timeout request timeout (optional)
 * @param psub whether the server should prefer a persistent subscriber
 */
public record RepRequest(String key, byte[] data, String token, String node, Duration timeout, boolean psub) {
    public RepRequest {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(data, "data");
    }

    public static RepRequest of(String key, byte[] data) {
        return new RepRequest(key, data, null, null, null, false);
    }
}
