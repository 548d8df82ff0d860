package io.esub.client;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Receives the server's confirmation of each published item in confirmation mode.
 */
@FunctionalInterface
public interface PublishCallback {

    /**
     * @param data the payload that was sent
     * @param reply the confirmation frame the server answered with
     */
    void onConfirmed(String data, String reply);

    static PublishCallback printing(PrintStream out) {
        Objects.requireNonNull(out, "out");
        return (data, reply) -> out.println("'" + data + "': " + reply);
    }
}
