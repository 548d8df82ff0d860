package io.esub.client;

import io.esub.core.EsubException;
import io.esub.core.Protocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubscribeSessionTest {

    private final ScheduledThreadPoolExecutor scheduler = newScheduler();

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @Test
    void acknowledgesEachMessageBeforeAwaitingTheNext() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.deliver("m1");
        connection.deliver("m2");
        connection.deliver("m3");
        connection.closeFromPeer();
        List<String> received = new ArrayList<>();

        new SubscribeSession(true, Duration.ofMillis(20), scheduler).run(connection, received::add);

        assertThat(received).containsExactly("m1", "m2", "m3");
        List<InMemoryConnection.Frame> frames = connection.frames();
        assertThat(frames).extracting(InMemoryConnection.Frame::kind).containsExactly(
                InMemoryConnection.Kind.RECEIVED, InMemoryConnection.Kind.SENT,
                InMemoryConnection.Kind.RECEIVED, InMemoryConnection.Kind.SENT,
                InMemoryConnection.Kind.RECEIVED, InMemoryConnection.Kind.SENT);
        assertThat(connection.sent()).containsOnly(Protocol.ACK);
        assertThat(connection.probes()).isZero();
    }

    @Test
    void withoutConfirmationNothingIsSentBack() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.deliver("m1");
        connection.deliver("m2");
        connection.closeFromPeer();
        List<String> received = new ArrayList<>();

        new SubscribeSession(false, Duration.ofSeconds(30), scheduler).run(connection, received::add);

        assertThat(received).containsExactly("m1", "m2");
        assertThat(connection.sent()).isEmpty();
    }

    @Test
    void peerCloseEndsTheSessionNormallyAndStopsProbing() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.closeFromPeer();

        new SubscribeSession(false, Duration.ofMillis(10), scheduler).run(connection, message -> { });

        assertThat(connection.isOpen()).isFalse();
        assertThat(scheduler.getQueue()).isEmpty();
    }

    @Test
    void brokenConnectionPropagates() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.failFromPeer("reset");

        assertThatThrownBy(() -> new SubscribeSession(true, Duration.ofSeconds(1), scheduler)
                .run(connection, message -> { }))
                .isInstanceOf(EsubException.ConnectionError.class)
                .hasMessageContaining("reset");
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void throwingHandlerEndsTheSessionAsCallerError() {
        InMemoryConnection connection = new InMemoryConnection();
        connection.deliver("boom");

        assertThatThrownBy(() -> new SubscribeSession(false, Duration.ofMillis(10), scheduler)
                .run(connection, message -> {
                    throw new IllegalStateException(message);
                }))
                .isInstanceOf(EsubException.CallerError.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(connection.isOpen()).isFalse();
        assertThat(scheduler.getQueue()).isEmpty();
    }

    static ScheduledThreadPoolExecutor newScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
