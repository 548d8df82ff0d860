package io.esub.client;

import io.esub.core.Envelope;
import io.esub.core.EsubException;
import io.esub.core.PublishItem;
import io.esub.json.spi.JsonCodec;
import io.esub.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;

/**
 * Send loop of a persistent publish session.
 *
 * <p>Each item is resolved against the session defaults into an {@link Envelope} and written as one
 * frame. In confirmation mode the next frame received is the server's confirmation for that item and
 * is handed to the callback before the next item is sent; sends are never pipelined. No liveness
 * probes are sent on the publish side.
 */
public final class PublishSession {
    private static final Logger log = LoggerFactory.getLogger(PublishSession.class);

    private final String key;
    private final String token;
    private final boolean psub;
    private final String defaultToken;
    private final boolean confirm;
    private final JsonCodec codec;

    /**
     * @param key session key, used by items that carry none
     * @param token session token, used by items that carry none
     * @param psub session flag, used by items that carry none
     * @param defaultToken configured token, used when neither item nor session has one
     * @param confirm whether each item waits for a confirmation
     * @param codec envelope encoder
     */
    public PublishSession(String key, String token, boolean psub, String defaultToken, boolean confirm, JsonCodec codec) {
        this.key = key;
        this.token = token;
        this.psub = psub;
        this.defaultToken = defaultToken;
        this.confirm = confirm;
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Publishes every item of {@code source}, then closes the connection. The connection is closed on
     * failure as well; nothing is retried.
     *
     * @throws EsubException.CallerError if the source or the callback threw, or an item has no key
     * @throws EsubException.ConnectionClosed if the peer closed while a confirmation was awaited
     * @throws EsubException.ConnectionError if the connection broke
     */
    public void run(DuplexConnection connection, PublishSource source, PublishCallback callback) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(callback, "callback");

        long sent = 0;
        try {
            Iterator<PublishItem> items = open(source);
            while (hasNext(items)) {
                PublishItem item = next(items);
                connection.send(encode(item));
                sent++;
                if (confirm) {
                    String reply = connection.receive();
                    confirmed(callback, item.data(), reply);
                }
            }
            log.debug("publish source exhausted after {} items", sent);
        } finally {
            connection.close();
        }
    }

    private String encode(PublishItem item) {
        Envelope envelope;
        try {
            envelope = Envelope.resolve(item, key, token, psub, defaultToken);
        } catch (IllegalArgumentException e) {
            throw new EsubException.CallerError(e.getMessage(), e);
        }
        try {
            return codec.writeString(envelope);
        } catch (JsonException e) {
            throw new EsubException.CallerError("publish item could not be encoded", e);
        }
    }

    private static Iterator<PublishItem> open(PublishSource source) {
        try {
            return Objects.requireNonNull(source.items(), "items");
        } catch (EsubException e) {
            throw e;
        } catch (Exception e) {
            throw new EsubException.CallerError("publish source failed to start", e);
        }
    }

    private static boolean hasNext(Iterator<PublishItem> items) {
        try {
            return items.hasNext();
        } catch (EsubException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EsubException.CallerError("publish source failed", e);
        }
    }

    private static PublishItem next(Iterator<PublishItem> items) {
        try {
            return Objects.requireNonNull(items.next(), "publish item");
        } catch (EsubException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EsubException.CallerError("publish source failed", e);
        }
    }

    private static void confirmed(PublishCallback callback, String data, String reply) {
        try {
            callback.onConfirmed(data, reply);
        } catch (RuntimeException e) {
            throw new EsubException.CallerError("publish callback failed", e);
        }
    }
}
