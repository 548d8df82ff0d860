package io.esub.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Persistent subscription to a key.
 *
 * @param key the rendezvous key
 * @param token the token (optional, falls back to the configured token)
 * @param node a specific node (optional)
 * @param timeout overall session deadline, also sent to the server (optional)
 * @param shared whether delivery may be load-shared with other subscribers of the key
 */
public record PsubRequest(String key, String token, String node, Duration timeout, boolean shared) {
    public PsubRequest {
        Objects.requireNonNull(key, "key");
    }

    public static PsubRequest of(String key) {
        return new PsubRequest(key, null, null, null, false);
    }
}
