package io.esub.core;

/**
 * esub protocol constants (paths, query keys, and well-known values).
 *
 * <p>Shared by the one-shot HTTP path and the persistent duplex sessions.
 */
public final class Protocol {
    private Protocol() {}

    // Paths
    public static final String P_INFO = "info";
    public static final String P_SUB = "sub";
    public static final String P_REP = "rep";
    public static final String P_PSUB = "psub";
    public static final String P_PREP = "prep";

    // Query parameter keys
    public static final String Q_TOKEN = "token";
    public static final String Q_PSUB = "psub";
    public static final String Q_SHARED = "shared";
    public static final String Q_TIMEOUT = "timeout";

    /** Value used for boolean query flags. */
    public static final String FLAG_ON = "1";

    /** Acknowledgement frame a subscriber answers each delivery with in confirmation mode. */
    public static final String ACK = "ok";

    // HTTP headers
    public static final String H_USER_AGENT = "User-Agent";
    public static final String USER_AGENT = "esub-java";

    // Environment variables
    public static final String ENV_HOST = "ESUB_SERVICE_HOST";
    public static final String ENV_PORT = "ESUB_SERVICE_PORT";
    public static final String ENV_PROTOCOL = "ESUB_PROTOCOL";
    public static final String ENV_WEBSOCKET_PROTOCOL = "ESUB_WEBSOCKET_PROTOCOL";
    public static final String ENV_TOKEN = "ESUB_TOKEN";
    public static final String ENV_RETRIES = "ESUB_REQUEST_RETRIES";
    public static final String ENV_CONFIRM = "ESUB_CONFIRM_RECEIPT";
    public static final String ENV_PING_FREQUENCY = "ESUB_PING_FREQUENCY";
}
