package io.esub.client;

import java.time.Duration;

/**
 * Persistent publish session. Session values apply to items that do not carry their own.
 *
 * @param key the session key (optional when every item names one)
 * @param token the session token (optional)
 * @param node a specific node (optional)
 * @param timeout overall session deadline (optional)
 * @param psub whether items go to persistent subscribers
 */
public record PrepRequest(String key, String token, String node, Duration timeout, boolean psub) {

    public static PrepRequest of(String key) {
        return new PrepRequest(key, null, null, null, false);
    }
}
