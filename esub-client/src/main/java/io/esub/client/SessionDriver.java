package io.esub.client;

import io.esub.core.EsubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one persistent session under an overall deadline.
 *
 * <p>The connection is opened and the session body run on a worker thread while the calling thread
 * waits. When the deadline passes, or the calling thread is interrupted, the worker is cancelled, the
 * connection closed and {@link EsubException.Timeout} or {@link EsubException.Cancelled} raised. The
 * connection is closed before any failure reaches the caller.
 */
public final class SessionDriver {
    private static final Logger log = LoggerFactory.getLogger(SessionDriver.class);
    static final Duration DEFAULT_GRACE = Duration.ofSeconds(5);

    private final DuplexTransport transport;
    private final ExecutorService executor;
    private final Duration grace;

    /**
     * @param transport opens the session's connection
     * @param executor runs the session body
     * @param grace how long an abandoned session may take to wind down before the driver stops waiting
     */
    public SessionDriver(DuplexTransport transport, ExecutorService executor, Duration grace) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.grace = Objects.requireNonNull(grace, "grace");
    }

    public SessionDriver(DuplexTransport transport, ExecutorService executor) {
        this(transport, executor, DEFAULT_GRACE);
    }

    /**
     * Opens {@code url} and runs {@code body} on the connection.
     *
     * @param timeout overall deadline, {@code null} to wait indefinitely
     */
    public void run(URI url, Duration timeout, Body body) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(body, "body");

        ConnectionSlot slot = new ConnectionSlot();
        CountDownLatch finished = new CountDownLatch(1);
        Future<?> task = executor.submit(() -> {
            try {
                DuplexConnection connection = transport.open(url);
                if (slot.attach(connection)) {
                    body.run(connection);
                }
                return null;
            } finally {
                finished.countDown();
            }
        });

        try {
            if (timeout == null) {
                task.get();
            } else {
                task.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            abandon(task, slot, finished, url);
            throw new EsubException.Timeout("session with " + url + " timed out after " + timeout);
        } catch (InterruptedException e) {
            abandon(task, slot, finished, url);
            Thread.currentThread().interrupt();
            throw new EsubException.Cancelled("session with " + url + " cancelled", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause(), url);
        } finally {
            slot.close();
        }
    }

    private void abandon(Future<?> task, ConnectionSlot slot, CountDownLatch finished, URI url) {
        task.cancel(true);
        slot.close();
        try {
            if (!finished.await(grace.toNanos(), TimeUnit.NANOSECONDS)) {
                log.warn("session with {} still running {} after cancellation", url, grace);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static RuntimeException unwrap(Throwable cause, URI url) {
        if (cause instanceof EsubException) {
            return (EsubException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new EsubException.ConnectionError("session with " + url + " failed: " + cause, cause);
    }

    /**
     * The protocol a session runs on its connection.
     */
    @FunctionalInterface
    public interface Body {
        void run(DuplexConnection connection);
    }

    /**
     * Hands the connection from the worker to the driver. A connection attached after the driver gave
     * up is closed at once.
     */
    private static final class ConnectionSlot {
        private DuplexConnection connection;
        private boolean closed;

        synchronized boolean attach(DuplexConnection c) {
            if (closed) {
                c.close();
                return false;
            }
            connection = c;
            return true;
        }

        synchronized void close() {
            closed = true;
            if (connection != null) {
                connection.close();
            }
        }
    }
}
