package io.esub.client;

import io.esub.core.EsubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A {@link DuplexConnection} over a JDK WebSocket.
 *
 * <p>Inbound fragments are reassembled into whole messages; binary messages are decoded as UTF-8.
 * Demand is driven by {@link #receive()}: the next message is requested only after the previous one
 * has been taken, so at most one whole message waits client-side and a fast server is held back by
 * the WebSocket flow control.
 *
 * <p>Writes are serialized by one lock, which {@link #close()} also takes, so no frame can be written
 * after close returns. Probes never wait on the socket.
 */
final class JdkWebSocketConnection implements DuplexConnection, WebSocket.Listener {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketConnection.class);
    private static final Duration CLOSE_WAIT = Duration.ofSeconds(1);

    private final URI url;
    private final BlockingQueue<Inbound> inbound = new LinkedBlockingQueue<>();
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final StringBuilder text = new StringBuilder();
    private final ByteArrayOutputStream binary = new ByteArrayOutputStream();
    private volatile WebSocket webSocket;
    private volatile EsubException.ConnectionClosed closedByPeer;
    private volatile CompletableFuture<WebSocket> pendingProbe;

    JdkWebSocketConnection(URI url) {
        this.url = url;
    }

    void attach(WebSocket ws) {
        this.webSocket = ws;
    }

    /** Whole messages (and a terminal marker, if any) waiting for {@link #receive()}. */
    int buffered() {
        return inbound.size();
    }

    @Override
    public void send(String message) {
        writeLock.lock();
        try {
            WebSocket ws = ensureWritable();
            await(ws.sendText(message, true), "send");
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String receive() {
        if (closed.get()) {
            throw new EsubException.ConnectionError("connection is closed: " + url);
        }
        Inbound next;
        try {
            next = inbound.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EsubException.Cancelled("interrupted while receiving from " + url, e);
        }
        if (next.failure() != null) {
            // terminal: every later receive observes the same end
            inbound.offer(next);
            throw next.failure();
        }
        WebSocket ws = webSocket;
        if (ws != null) {
            ws.request(1);
        }
        return next.message();
    }

    /**
     * Queues an unsolicited empty Pong without waiting for it to be written. Skipped while a message
     * write holds the lock or the previous probe is still queued: the connection is not idle then.
     */
    @Override
    public void sendProbe() {
        if (!writeLock.tryLock()) {
            ensureWritable();
            return;
        }
        try {
            WebSocket ws = ensureWritable();
            CompletableFuture<WebSocket> previous = pendingProbe;
            if (previous != null && !previous.isDone()) {
                return;
            }
            pendingProbe = ws.sendPong(ByteBuffer.allocate(0)).whenComplete((w, error) -> {
                if (error != null) {
                    log.debug("probe to {} failed", url, error);
                }
            });
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean isOpen() {
        WebSocket ws = webSocket;
        return !closed.get() && ws != null && !ws.isOutputClosed();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        inbound.offer(Inbound.failed(new EsubException.ConnectionError("connection is closed: " + url)));

        boolean locked = false;
        try {
            locked = writeLock.tryLock(CLOSE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        try {
            WebSocket ws = webSocket;
            if (ws == null) {
                return;
            }
            if (!locked || ws.isOutputClosed()) {
                ws.abort();
                return;
            }
            try {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "").get(CLOSE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.debug("close handshake with {} failed, aborting", url, e);
                ws.abort();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ws.abort();
            }
        } finally {
            if (locked) {
                writeLock.unlock();
            }
            log.debug("closed {}", url);
        }
    }

    private WebSocket ensureWritable() {
        if (closed.get()) {
            throw new EsubException.ConnectionError("connection is closed: " + url);
        }
        EsubException.ConnectionClosed byPeer = closedByPeer;
        if (byPeer != null) {
            throw byPeer;
        }
        WebSocket ws = webSocket;
        if (ws == null || ws.isOutputClosed()) {
            throw new EsubException.ConnectionError("connection is closed: " + url);
        }
        return ws;
    }

    private void await(CompletableFuture<WebSocket> write, String what) {
        try {
            write.get();
        } catch (ExecutionException e) {
            EsubException.ConnectionClosed byPeer = closedByPeer;
            if (byPeer != null && !closed.get()) {
                throw byPeer;
            }
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new EsubException.ConnectionError(what + " to " + url + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EsubException.Cancelled("interrupted during " + what + " to " + url, e);
        }
    }

    // ===== WebSocket.Listener =====

    @Override
    public void onOpen(WebSocket ws) {
        this.webSocket = ws;
        ws.request(1);
    }

    // A partial message asks for its next fragment; a whole one waits for receive().

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
        text.append(data);
        if (last) {
            inbound.offer(Inbound.message(text.toString()));
            text.setLength(0);
        } else {
            ws.request(1);
        }
        return null;
    }

    @Override
    public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
        byte[] chunk = new byte[data.remaining()];
        data.get(chunk);
        binary.writeBytes(chunk);
        if (last) {
            inbound.offer(Inbound.message(binary.toString(StandardCharsets.UTF_8)));
            binary.reset();
        } else {
            ws.request(1);
        }
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
        log.debug("{} closed by peer: code={} reason={}", url, statusCode, reason);
        EsubException.ConnectionClosed failure = new EsubException.ConnectionClosed(statusCode, reason);
        closedByPeer = failure;
        inbound.offer(Inbound.failed(failure));
        return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
        log.debug("{} failed", url, error);
        inbound.offer(Inbound.failed(new EsubException.ConnectionError("connection to " + url + " failed: " + error.getMessage(), error)));
    }

    private record Inbound(String message, EsubException failure) {
        static Inbound message(String message) {
            return new Inbound(message, null);
        }

        static Inbound failed(EsubException failure) {
            return new Inbound(null, failure);
        }
    }
}
