package io.esub.core;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable client configuration.
 *
 * <p>Built programmatically through {@link #builder()} or read once from the process environment with
 * {@link #fromEnvironment()}. Confirmation mode never changes for the lifetime of a configuration.
 *
 * @param host default server host
 * @param port server port
 * @param scheme scheme of the one-shot endpoints ({@code http} or {@code https})
 * @param duplexScheme scheme of the persistent endpoints ({@code ws} or {@code wss})
 * @param token default token, may be {@code null}
 * @param retries how many times a one-shot request is retried after a connection failure
 * @param confirm whether every persistent message is acknowledged by the receiving side
 * @param idleTimeoutHint idle timeout of the infrastructure between client and server
 * @param nodeCacheTtl how long a resolved node address is reused
 */
public record EsubConfig(
        String host,
        int port,
        String scheme,
        String duplexScheme,
        String token,
        int retries,
        boolean confirm,
        Duration idleTimeoutHint,
        Duration nodeCacheTtl
) {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8090;
    public static final String DEFAULT_SCHEME = "http";
    public static final String DEFAULT_DUPLEX_SCHEME = "ws";
    public static final Duration DEFAULT_IDLE_TIMEOUT_HINT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_NODE_CACHE_TTL = Duration.ofSeconds(10);

    public EsubConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(duplexScheme, "duplexScheme");
        Objects.requireNonNull(idleTimeoutHint, "idleTimeoutHint");
        Objects.requireNonNull(nodeCacheTtl, "nodeCacheTtl");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("retries must not be negative");
        }
        if (idleTimeoutHint.isNegative() || idleTimeoutHint.isZero()) {
            throw new IllegalArgumentException("idleTimeoutHint must be positive");
        }
    }

    /**
     * Period between two liveness probes: 90% of the idle timeout hint.
     */
    public Duration probePeriod() {
        return Duration.ofMillis(idleTimeoutHint.toMillis() * 9 / 10);
    }

    public URI baseUrl(String node) {
        return EsubUrls.base(scheme, node == null ? host : node, port);
    }

    public URI duplexBaseUrl(String node) {
        return EsubUrls.base(duplexScheme, node == null ? host : node, port);
    }

    public static EsubConfig defaults() {
        return builder().build();
    }

    public static EsubConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads the {@code ESUB_*} variables from the given map. Unset or empty variables keep their
     * defaults.
     *
     * @throws IllegalArgumentException if a numeric variable does not parse
     */
    public static EsubConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder b = builder();
        String host = blankToNull(env.get(Protocol.ENV_HOST));
        if (host != null) b.host(host);
        String port = blankToNull(env.get(Protocol.ENV_PORT));
        if (port != null) b.port(parseInt(Protocol.ENV_PORT, port));
        String scheme = blankToNull(env.get(Protocol.ENV_PROTOCOL));
        if (scheme != null) b.scheme(scheme);
        String duplexScheme = blankToNull(env.get(Protocol.ENV_WEBSOCKET_PROTOCOL));
        if (duplexScheme != null) b.duplexScheme(duplexScheme);
        b.token(blankToNull(env.get(Protocol.ENV_TOKEN)));
        String retries = blankToNull(env.get(Protocol.ENV_RETRIES));
        if (retries != null) b.retries(parseInt(Protocol.ENV_RETRIES, retries));
        String confirm = env.get(Protocol.ENV_CONFIRM);
        b.confirm(confirm != null && !confirm.isEmpty() && !"0".equals(confirm));
        String ping = blankToNull(env.get(Protocol.ENV_PING_FREQUENCY));
        if (ping != null) b.idleTimeoutHint(Duration.ofSeconds(parseInt(Protocol.ENV_PING_FREQUENCY, ping)));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .scheme(scheme)
                .duplexScheme(duplexScheme)
                .token(token)
                .retries(retries)
                .confirm(confirm)
                .idleTimeoutHint(idleTimeoutHint)
                .nodeCacheTtl(nodeCacheTtl);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static String blankToNull(String v) {
        return v == null || v.isBlank() ? null : v.trim();
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String scheme = DEFAULT_SCHEME;
        private String duplexScheme = DEFAULT_DUPLEX_SCHEME;
        private String token;
        private int retries;
        private boolean confirm;
        private Duration idleTimeoutHint = DEFAULT_IDLE_TIMEOUT_HINT;
        private Duration nodeCacheTtl = DEFAULT_NODE_CACHE_TTL;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = Objects.requireNonNull(scheme, "scheme");
            return this;
        }

        public Builder duplexScheme(String duplexScheme) {
            this.duplexScheme = Objects.requireNonNull(duplexScheme, "duplexScheme");
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder confirm(boolean confirm) {
            this.confirm = confirm;
            return this;
        }

        public Builder idleTimeoutHint(Duration idleTimeoutHint) {
            this.idleTimeoutHint = Objects.requireNonNull(idleTimeoutHint, "idleTimeoutHint");
            return this;
        }

        public Builder nodeCacheTtl(Duration nodeCacheTtl) {
            this.nodeCacheTtl = Objects.requireNonNull(nodeCacheTtl, "nodeCacheTtl");
            return this;
        }

        public EsubConfig build() {
            return new EsubConfig(host, port, scheme, duplexScheme, token, retries, confirm, idleTimeoutHint, nodeCacheTtl);
        }
    }
}
