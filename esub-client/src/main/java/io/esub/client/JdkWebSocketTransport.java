package io.esub.client;

import io.esub.core.EsubException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link DuplexTransport} implementation using {@link java.net.http.WebSocket}.
 */
public final class JdkWebSocketTransport implements DuplexTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient http;
    private final Duration connectTimeout;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to build WebSockets from
     * @param connectTimeout handshake timeout, or {@code null} to wait as long as the client does
     */
    public JdkWebSocketTransport(HttpClient http, Duration connectTimeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.connectTimeout = connectTimeout;
    }

    public JdkWebSocketTransport(HttpClient http) {
        this(http, null);
    }

    @Override
    public DuplexConnection open(URI url) {
        Objects.requireNonNull(url, "url");
        JdkWebSocketConnection connection = new JdkWebSocketConnection(url);
        WebSocket.Builder builder = http.newWebSocketBuilder();
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        CompletableFuture<WebSocket> pending = builder.buildAsync(url, connection);
        try {
            WebSocket ws = pending.get();
            connection.attach(ws);
            log.debug("opened {}", url);
            return connection;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new EsubException.ConnectionError("failed to open " + url + ": " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            pending.thenAccept(WebSocket::abort);
            Thread.currentThread().interrupt();
            throw new EsubException.Cancelled("interrupted while opening " + url, e);
        }
    }
}
