package io.esub.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes a persistent subscription.
 *
 * @param key the rendezvous key
 * @param token the token, may be {@code null}
 * @param timeout how long the server should hold the subscription, {@code null} for no limit
 * @param shared whether delivery for the key may be load-shared with other subscribers
 */
public record Subscription(String key, String token, Duration timeout, boolean shared) {
    public Subscription {
        Objects.requireNonNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
