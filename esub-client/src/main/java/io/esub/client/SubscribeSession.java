package io.esub.client;

import io.esub.core.EsubException;
import io.esub.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Receive loop of a persistent subscription.
 *
 * <p>In confirmation mode every delivered message is answered with {@link Protocol#ACK} before the next
 * one is awaited. Otherwise a {@link LivenessMonitor} probes the connection for as long as the loop
 * runs. Exactly one of the two is active for a session.
 */
public final class SubscribeSession {
    private static final Logger log = LoggerFactory.getLogger(SubscribeSession.class);

    private final boolean confirm;
    private final Duration probePeriod;
    private final ScheduledExecutorService scheduler;

    public SubscribeSession(boolean confirm, Duration probePeriod, ScheduledExecutorService scheduler) {
        this.confirm = confirm;
        this.probePeriod = Objects.requireNonNull(probePeriod, "probePeriod");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Delivers messages to {@code handler} until the peer closes the connection. Always closes the
     * connection and stops the liveness monitor before returning or throwing.
     *
     * @throws EsubException.CallerError if the handler threw
     * @throws EsubException.ConnectionError if the connection broke
     */
    public void run(DuplexConnection connection, MessageHandler handler) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(handler, "handler");

        LivenessMonitor monitor = confirm ? null : LivenessMonitor.start(connection, probePeriod, scheduler);
        long delivered = 0;
        try {
            while (true) {
                String message;
                try {
                    message = connection.receive();
                } catch (EsubException.ConnectionClosed e) {
                    log.debug("subscription ended by peer after {} messages: {}", delivered, e.getMessage());
                    return;
                }
                deliver(handler, message);
                delivered++;
                if (confirm) {
                    connection.send(Protocol.ACK);
                }
            }
        } finally {
            if (monitor != null) {
                monitor.stop();
            }
            connection.close();
        }
    }

    private static void deliver(MessageHandler handler, String message) {
        try {
            handler.onMessage(message);
        } catch (RuntimeException e) {
            throw new EsubException.CallerError("message handler failed", e);
        }
    }
}
