package io.esub.client;

import io.esub.core.EsubException;
import io.esub.core.EsubUrls;
import io.esub.core.Protocol;
import io.esub.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Looks up the address of a reachable esub node through {@code GET /info} and remembers it for a
 * while.
 *
 * <p>Safe for concurrent callers; at most one lookup is in flight.
 */
public final class NodeResolver {
    private static final Logger log = LoggerFactory.getLogger(NodeResolver.class);
    private static final Duration INFO_TIMEOUT = Duration.ofSeconds(2);

    private final HttpTransport transport;
    private final JsonCodec codec;
    private final URI infoUrl;
    private final Duration ttl;
    private final Clock clock;

    private String address;
    private Instant resolvedAt;

    /**
     * @param base one-shot base URL of the configured service
     * @param ttl how long a resolved address is reused; zero or negative resolves on every call
     */
    public NodeResolver(HttpTransport transport, JsonCodec codec, URI base, Duration ttl, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.infoUrl = EsubUrls.info(Objects.requireNonNull(base, "base"));
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public synchronized String resolve() throws Exception {
        Instant now = clock.instant();
        if (resolvedAt != null && !ttl.isNegative() && !ttl.isZero()
                && Duration.between(resolvedAt, now).compareTo(ttl) < 0) {
            return address;
        }

        TransportRequest req = new TransportRequest("GET", infoUrl,
                Map.of(Protocol.H_USER_AGENT, Protocol.USER_AGENT), null, INFO_TIMEOUT);
        TransportResponse resp = transport.send(req);
        if (resp.status() >= 400) {
            throw new EsubException.RequestFailed(resp.status(), infoUrl);
        }
        NodeInfo info = codec.readValue(resp.body(), NodeInfo.class);

        address = info.ip();
        resolvedAt = now;
        log.debug("resolved esub node {} via {}", address, infoUrl);
        return address;
    }

    public synchronized void invalidate() {
        address = null;
        resolvedAt = null;
    }

    record NodeInfo(String ip) {}
}
