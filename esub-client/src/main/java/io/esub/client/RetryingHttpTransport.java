package io.esub.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * Retries a request whose connection failed, up to a fixed number of times.
 *
 * <p>Timeouts and error statuses are not retried.
 */
public final class RetryingHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(RetryingHttpTransport.class);

    private final HttpTransport delegate;
    private final int retries;

    public RetryingHttpTransport(HttpTransport delegate, int retries) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
        this.retries = retries;
    }

    @Override
    public TransportResponse send(TransportRequest request) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                return delegate.send(request);
            } catch (HttpTimeoutException e) {
                throw e;
            } catch (IOException e) {
                if (attempt >= retries) {
                    throw e;
                }
                attempt++;
                log.warn("{} {} failed ({}), retry {}/{}", request.method(), request.url(), e.toString(), attempt, retries);
            }
        }
    }
}
