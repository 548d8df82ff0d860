package io.esub.client;

public record TransportResponse(int status, byte[] body) {
    public TransportResponse {
        if (body == null) {
            body = new byte[0];
        }
    }
}
