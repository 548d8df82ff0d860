package io.esub.client;

import io.esub.core.EsubConfig;
import io.esub.core.EsubException;
import io.esub.core.EsubUrls;
import io.esub.core.Protocol;
import io.esub.core.Subscription;
import io.esub.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

public final class JdkEsubClient implements EsubClient {
    private static final Logger log = LoggerFactory.getLogger(JdkEsubClient.class);
    private static final Map<String, String> HEADERS = Map.of(Protocol.H_USER_AGENT, Protocol.USER_AGENT);

    private final EsubConfig config;
    private final HttpTransport http;
    private final JsonCodec codec;
    private final PrintStream out;
    private final NodeResolver resolver;
    private final SessionDriver driver;
    private final SubscribeSession subscribeSession;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    JdkEsubClient(EsubConfig config, HttpTransport http, DuplexTransport duplex, JsonCodec codec, Clock clock,
                  PrintStream out, ExecutorService executor, boolean ownsExecutor,
                  ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.http = Objects.requireNonNull(http, "http");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.out = Objects.requireNonNull(out, "out");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
        this.resolver = new NodeResolver(http, codec, config.baseUrl(null), config.nodeCacheTtl(), clock);
        this.driver = new SessionDriver(duplex, executor);
        this.subscribeSession = new SubscribeSession(config.confirm(), config.probePeriod(), scheduler);
    }

    public EsubConfig config() {
        return config;
    }

    @Override
    public String nodeIp() throws Exception {
        return resolver.resolve();
    }

    @Override
    public byte[] sub(SubRequest request) throws Exception {
        URI url = EsubUrls.sub(config.baseUrl(request.node()), request.key(), tokenOrDefault(request.token()));
        TransportResponse resp = exchange(new TransportRequest("GET", url, HEADERS, null, request.timeout()));
        return resp.body();
    }

    @Override
    public void rep(RepRequest request) throws Exception {
        URI url = EsubUrls.rep(config.baseUrl(request.node()), request.key(), tokenOrDefault(request.token()), request.psub());
        exchange(new TransportRequest("POST", url, HEADERS, request.data(), request.timeout()));
    }

    @Override
    public void psub(PsubRequest request, MessageHandler handler) {
        Objects.requireNonNull(request, "request");
        Subscription subscription = new Subscription(request.key(), tokenOrDefault(request.token()),
                request.timeout(), request.shared());
        URI url = EsubUrls.psub(config.duplexBaseUrl(request.node()), subscription);
        MessageHandler resolved = handler;
        if (resolved == null) {
            out.println("persistent sub to " + url);
            resolved = MessageHandler.printing(out);
        }
        MessageHandler delivery = resolved;
        log.debug("psub {} shared={} confirm={}", url, request.shared(), config.confirm());
        driver.run(url, request.timeout(), connection -> subscribeSession.run(connection, delivery));
    }

    @Override
    public void prep(PrepRequest request, PublishSource source, PublishCallback callback) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(source, "source");
        URI url = EsubUrls.prep(config.duplexBaseUrl(request.node()), tokenOrDefault(request.token()), request.psub());
        PublishCallback resolved = callback != null ? callback : PublishCallback.printing(out);
        PublishSession session = new PublishSession(request.key(), request.token(), request.psub(),
                config.token(), config.confirm(), codec);
        log.debug("prep {} confirm={}", url, config.confirm());
        driver.run(url, request.timeout(), connection -> session.run(connection, source, resolved));
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private TransportResponse exchange(TransportRequest request) throws Exception {
        TransportResponse resp;
        try {
            resp = http.send(request);
        } catch (HttpTimeoutException e) {
            throw new EsubException.Timeout(request.method() + " " + request.url() + " timed out", e);
        } catch (IOException e) {
            throw new EsubException.ConnectionError(request.method() + " " + request.url() + " failed: " + e.getMessage(), e);
        }
        if (resp.status() >= 400) {
            throw new EsubException.RequestFailed(resp.status(), request.url());
        }
        return resp;
    }

    private String tokenOrDefault(String token) {
        return token != null && !token.isEmpty() ? token : config.token();
    }
}
