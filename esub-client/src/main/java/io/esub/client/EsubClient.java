package io.esub.client;

/**
 * Client for an esub service.
 *
 * <p>{@link #sub}, {@link #rep} and {@link #nodeIp} are single request/reply calls. {@link #psub} and
 * {@link #prep} hold one duplex connection open for a whole stream of messages and return when the
 * stream ends.
 */
public interface EsubClient extends AutoCloseable {

    /**
     * Address of a reachable node, cached for the configured interval.
     */
    String nodeIp() throws Exception;

    /**
     * Waits for a value to be posted to the key and returns it.
     */
    byte[] sub(SubRequest request) throws Exception;

    /**
     * Posts a value to the key, satisfying one waiting sub.
     */
    void rep(RepRequest request) throws Exception;

    /**
     * Subscribes to the key and hands every delivered message to {@code handler} until the server
     * ends the subscription or the timeout passes. A {@code null} handler prints each message.
     */
    void psub(PsubRequest request, MessageHandler handler);

    /**
     * Publishes every item of {@code source} over one connection. In confirmation mode each
     * confirmation goes to {@code callback}; a {@code null} callback prints them.
     */
    void prep(PrepRequest request, PublishSource source, PublishCallback callback);

    /**
     * Releases worker threads owned by this client.
     */
    @Override
    void close();

    static EsubClient create() {
        return builder().build();
    }

    static EsubClientBuilder builder() {
        return new EsubClientBuilder();
    }
}
