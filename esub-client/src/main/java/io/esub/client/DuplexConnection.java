package io.esub.client;

/**
 * A live duplex connection carrying discrete messages.
 *
 * <p>{@link #receive()} is only ever called by the task that owns the session. {@link #send(String)} and
 * {@link #sendProbe()} may be called from two tasks (the session and its liveness monitor);
 * implementations serialize them so writes never interleave. Once {@link #close()} has returned no
 * further frame is written.
 *
 * <p>There is no limit on the size of a single message.
 */
public interface DuplexConnection extends AutoCloseable {

    /**
     * Writes one application message.
     *
     * @throws io.esub.core.EsubException.ConnectionError if the connection is closed or broken
     */
    void send(String message);

    /**
     * Blocks until the next application message arrives.
     *
     * @throws io.esub.core.EsubException.ConnectionClosed when the peer closed cleanly
     * @throws io.esub.core.EsubException.ConnectionError on abnormal termination or after {@link #close()}
     * @throws io.esub.core.EsubException.Cancelled if the calling thread is interrupted
     */
    String receive();

    /**
     * Writes a zero-payload control frame that keeps an idle connection alive. Never carries
     * application data. Must not wait on the network: one scheduler thread probes every session of a
     * client.
     *
     * @throws io.esub.core.EsubException.ConnectionError if the connection is closed or broken
     */
    void sendProbe();

    boolean isOpen();

    /**
     * Releases the connection. Idempotent and safe to call after a failure.
     */
    @Override
    void close();
}
