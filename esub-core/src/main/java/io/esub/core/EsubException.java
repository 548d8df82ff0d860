package io.esub.core;

import java.net.URI;

/**
 * Base class for esub client exceptions.
 *
 * <p>Every failure surfaced by a session or a one-shot call is one of the nested subclasses. The
 * original cause is preserved when there is one.
 */
public abstract class EsubException extends RuntimeException {

    protected EsubException(String message) {
        super(message);
    }

    protected EsubException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when opening, writing to, or reading from a connection fails because of the network or
     * the peer.
     */
    public static class ConnectionError extends EsubException {
        public ConnectionError(String message) {
            super(message);
        }

        public ConnectionError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the peer closed the connection cleanly.
     *
     * <p>Ends a subscription normally; aborts a publish session that still had items to send.
     */
    public static class ConnectionClosed extends EsubException {
        private final int statusCode;

        public ConnectionClosed(int statusCode, String reason) {
            super("connection closed by peer: code=" + statusCode + (reason == null || reason.isEmpty() ? "" : ", reason=" + reason));
            this.statusCode = statusCode;
        }

        public int statusCode() {
            return statusCode;
        }
    }

    /**
     * Raised when a session or request exceeded its deadline. The connection is already closed.
     */
    public static class Timeout extends EsubException {
        public Timeout(String message) {
            super(message);
        }

        public Timeout(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a caller-supplied callback or item source threw.
     */
    public static class CallerError extends EsubException {
        public CallerError(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when the thread running a session was interrupted. The connection is already closed.
     */
    public static class Cancelled extends EsubException {
        public Cancelled(String message) {
            super(message);
        }

        public Cancelled(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a one-shot request was answered with an error status.
     */
    public static class RequestFailed extends EsubException {
        private final int status;
        private final URI url;

        public RequestFailed(int status, URI url) {
            super("request failed: status=" + status + " url=" + url);
            this.status = status;
            this.url = url;
        }

        public int status() {
            return status;
        }

        public URI url() {
            return url;
        }
    }
}
