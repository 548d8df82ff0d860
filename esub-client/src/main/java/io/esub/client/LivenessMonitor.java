package io.esub.client;

import io.esub.core.EsubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends a liveness probe on a connection once per period so that idle-connection reapers between
 * client and server leave it alone.
 *
 * <p>Never reads from the connection. A probe that cannot be written is only logged and ends the
 * monitor: the session's own receive observes the broken connection and reports it.
 */
public final class LivenessMonitor {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final DuplexConnection connection;
    private final AtomicLong probesSent = new AtomicLong();
    private volatile ScheduledFuture<?> task;

    private LivenessMonitor(DuplexConnection connection) {
        this.connection = connection;
    }

    /**
     * Starts probing {@code connection} every {@code period}, the first probe one period from now.
     */
    public static LivenessMonitor start(DuplexConnection connection, Duration period, ScheduledExecutorService scheduler) {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(scheduler, "scheduler");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be positive");
        }
        LivenessMonitor monitor = new LivenessMonitor(connection);
        long nanos = period.toNanos();
        monitor.task = scheduler.scheduleAtFixedRate(monitor::probe, nanos, nanos, TimeUnit.NANOSECONDS);
        return monitor;
    }

    /**
     * Cancels further probes without waiting for one in flight.
     */
    public void stop() {
        ScheduledFuture<?> t = task;
        if (t != null) {
            t.cancel(false);
        }
    }

    public boolean isRunning() {
        ScheduledFuture<?> t = task;
        return t != null && !t.isDone();
    }

    public long probesSent() {
        return probesSent.get();
    }

    private void probe() {
        try {
            connection.sendProbe();
            probesSent.incrementAndGet();
        } catch (EsubException e) {
            log.debug("liveness probe not sent, stopping monitor: {}", e.getMessage());
            stop();
        }
    }
}
