package io.esub.client;

import io.esub.core.EsubConfig;
import io.esub.json.spi.JsonCodec;
import io.esub.json.spi.JsonCodecs;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

public final class EsubClientBuilder {
    private EsubConfig config;
    private HttpClient httpClient;
    private HttpTransport httpTransport;
    private DuplexTransport duplexTransport;
    private JsonCodec jsonCodec;
    private ExecutorService sessionExecutor;
    private ScheduledExecutorService probeScheduler;
    private Clock clock = Clock.systemUTC();
    private PrintStream out = System.out;

    /**
     * Configuration to use; read from the environment when not set.
     */
    public EsubClientBuilder config(EsubConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    public EsubClientBuilder httpClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        return this;
    }

    /**
     * Replaces the one-shot transport. Retries are still applied on top of it.
     */
    public EsubClientBuilder httpTransport(HttpTransport httpTransport) {
        this.httpTransport = Objects.requireNonNull(httpTransport, "httpTransport");
        return this;
    }

    public EsubClientBuilder duplexTransport(DuplexTransport duplexTransport) {
        this.duplexTransport = Objects.requireNonNull(duplexTransport, "duplexTransport");
        return this;
    }

    public EsubClientBuilder jsonCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        return this;
    }

    /**
     * Executor for session threads. A supplied executor is not shut down by {@link EsubClient#close()}.
     */
    public EsubClientBuilder sessionExecutor(ExecutorService sessionExecutor) {
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        return this;
    }

    /**
     * Scheduler for liveness probes. A supplied scheduler is not shut down by {@link EsubClient#close()}.
     */
    public EsubClientBuilder probeScheduler(ScheduledExecutorService probeScheduler) {
        this.probeScheduler = Objects.requireNonNull(probeScheduler, "probeScheduler");
        return this;
    }

    public EsubClientBuilder clock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Where the default handler and callback print.
     */
    public EsubClientBuilder out(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        return this;
    }

    public EsubClient build() {
        EsubConfig resolvedConfig = config != null ? config : EsubConfig.fromEnvironment();
        HttpClient resolvedHttp = httpClient != null ? httpClient : HttpClient.newHttpClient();
        HttpTransport oneShot = httpTransport != null ? httpTransport : new JdkHttpTransport(resolvedHttp);
        if (resolvedConfig.retries() > 0) {
            oneShot = new RetryingHttpTransport(oneShot, resolvedConfig.retries());
        }
        DuplexTransport duplex = duplexTransport != null ? duplexTransport : new JdkWebSocketTransport(resolvedHttp);
        JsonCodec codec = jsonCodec != null ? jsonCodec : JsonCodecs.load();

        boolean ownsExecutor = sessionExecutor == null;
        boolean ownsScheduler = probeScheduler == null;
        ExecutorService executor = ownsExecutor ? SessionThreads.newExecutor("esub-session") : sessionExecutor;
        ScheduledExecutorService scheduler = ownsScheduler ? SessionThreads.newScheduler("esub-probe") : probeScheduler;

        return new JdkEsubClient(resolvedConfig, oneShot, duplex, codec, clock, out,
                executor, ownsExecutor, scheduler, ownsScheduler);
    }
}
