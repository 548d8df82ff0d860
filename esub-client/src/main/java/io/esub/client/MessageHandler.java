package io.esub.client;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Receives each message delivered to a persistent subscription.
 *
 * <p>Runs on the session thread and should return quickly. Anything it throws ends the session.
 */
@FunctionalInterface
public interface MessageHandler {
    void onMessage(String message);

    static MessageHandler printing(PrintStream out) {
        Objects.requireNonNull(out, "out");
        return out::println;
    }
}
