package io.esub.client;

import io.esub.core.EsubException;
import io.esub.core.Protocol;
import io.esub.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeResolverTest {

    private static final URI BASE = URI.create("http://esub.local:8090");

    @Test
    void reusesResolvedAddressWithinTtl() throws Exception {
        RecordingHttpTransport transport = new RecordingHttpTransport(200, "{\"ip\":\"10.0.0.7\"}");
        MutableClock clock = new MutableClock();
        NodeResolver resolver = new NodeResolver(transport, new JacksonJsonCodec(), BASE, Duration.ofSeconds(10), clock);

        assertThat(resolver.resolve()).isEqualTo("10.0.0.7");
        clock.advance(Duration.ofSeconds(9));
        assertThat(resolver.resolve()).isEqualTo("10.0.0.7");
        assertThat(transport.requests).hasSize(1);

        clock.advance(Duration.ofSeconds(2));
        resolver.resolve();
        assertThat(transport.requests).hasSize(2);
    }

    @Test
    void requestsInfoEndpointWithUserAgent() throws Exception {
        RecordingHttpTransport transport = new RecordingHttpTransport(200, "{\"ip\":\"10.0.0.7\",\"version\":\"2\"}");
        NodeResolver resolver = new NodeResolver(transport, new JacksonJsonCodec(), BASE, Duration.ofSeconds(10), new MutableClock());

        resolver.resolve();

        TransportRequest request = transport.requests.get(0);
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.url()).isEqualTo(URI.create("http://esub.local:8090/info"));
        assertThat(request.headers()).containsEntry(Protocol.H_USER_AGENT, Protocol.USER_AGENT);
    }

    @Test
    void invalidateForcesLookup() throws Exception {
        RecordingHttpTransport transport = new RecordingHttpTransport(200, "{\"ip\":\"10.0.0.7\"}");
        NodeResolver resolver = new NodeResolver(transport, new JacksonJsonCodec(), BASE, Duration.ofSeconds(10), new MutableClock());

        resolver.resolve();
        resolver.invalidate();
        resolver.resolve();

        assertThat(transport.requests).hasSize(2);
    }

    @Test
    void errorStatusRaisesRequestFailed() {
        RecordingHttpTransport transport = new RecordingHttpTransport(502, "");
        NodeResolver resolver = new NodeResolver(transport, new JacksonJsonCodec(), BASE, Duration.ofSeconds(10), new MutableClock());

        assertThatThrownBy(resolver::resolve)
                .isInstanceOfSatisfying(EsubException.RequestFailed.class,
                        e -> assertThat(e.status()).isEqualTo(502));
    }

    private static final class RecordingHttpTransport implements HttpTransport {
        final List<TransportRequest> requests = new ArrayList<>();
        private final int status;
        private final String body;

        RecordingHttpTransport(int status, String body) {
            this.status = status;
            this.body = body;
        }

        @Override
        public TransportResponse send(TransportRequest request) {
            requests.add(request);
            return new TransportResponse(status, body.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
