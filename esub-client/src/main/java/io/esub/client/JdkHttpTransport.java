package io.esub.client;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 *
 * <p>The client pools connections per origin, so one instance serves every node.
 */
public final class JdkHttpTransport implements HttpTransport {
    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse send(TransportRequest request) throws Exception {
        HttpResponse<byte[]> resp = http.send(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse(resp.statusCode(), resp.body());
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), body);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        for (Map.Entry<String, String> entry : request.headers().entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                builder.header(entry.getKey(), entry.getValue());
            }
        }

        return builder.build();
    }
}
