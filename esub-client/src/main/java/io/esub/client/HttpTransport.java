package io.esub.client;

/**
 * Carries the one-shot request/reply calls ({@code /info}, {@code /sub}, {@code /rep}).
 */
public interface HttpTransport {
    TransportResponse send(TransportRequest request) throws Exception;
}
