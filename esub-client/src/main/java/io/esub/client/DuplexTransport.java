package io.esub.client;

import java.net.URI;

/**
 * Opens message-oriented duplex connections.
 */
public interface DuplexTransport {

    /**
     * Establishes a connection to {@code url}.
     *
     * @throws io.esub.core.EsubException.ConnectionError on refusal, DNS failure or a failed handshake
     * @throws io.esub.core.EsubException.Cancelled if the calling thread is interrupted while connecting
     */
    DuplexConnection open(URI url);
}
