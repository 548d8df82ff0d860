package io.esub.core;

import java.util.Objects;

/**
 * One message produced for a publish session.
 *
 * <p>{@code key}, {@code token} and {@code psub} are optional; when present they take precedence over
 * the session-level values. See {@link Envelope#resolve}.
 *
 * @param key the rendezvous key, or {@code null} to use the session key
 * @param token the token, or {@code null} to fall back to the session or configured token
 * @param psub whether to deliver to a persistent subscriber, or {@code null} for the session flag
 * @param data the payload
 */
public record PublishItem(String key, String token, Boolean psub, String data) {
    public PublishItem {
        Objects.requireNonNull(data, "data");
    }

    public static PublishItem of(String data) {
        return new PublishItem(null, null, null, data);
    }
}
