/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import io.arasaka.truenas.service.ServiceEndpoint;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sealed hierarchy representing the state of the single duplex connection.
 * Owned by the {@link Transport}; everything else only reads it.
 *
 * <pre>
 *   Closed (initial)
 *      │
 *      ▼ open()
 *   Connecting ──────────────► Closed (connect or upgrade failure)
 *      │
 *      ▼ websocket upgrade complete
 *   Open ────────────────────► Closed (peer closed or socket error)
 *      │
 *      ▼ close()
 *   Closing
 *      │
 *      ▼ channel inactive
 *   Closed
 * </pre>
 */
public sealed interface ConnectionState permits
        ConnectionState.Connecting,
        ConnectionState.Open,
        ConnectionState.Closing,
        ConnectionState.Closed {

    /**
     * TCP connect, TLS handshake (for {@code wss}) and websocket upgrade in progress.
     */
    record Connecting(ServiceEndpoint target) implements ConnectionState {

        public Open toOpen() {
            return new Open(target);
        }

        public Closed toClosed(Throwable cause) {
            return new Closed(cause);
        }
    }

    /**
     * Upgrade complete; frames may be sent.
     */
    record Open(ServiceEndpoint target) implements ConnectionState {

        public Closing toClosing() {
            return new Closing(target);
        }

        public Closed toClosed(Throwable cause) {
            return new Closed(cause);
        }
    }

    /**
     * Close requested locally, waiting for the channel to go inactive.
     */
    record Closing(ServiceEndpoint target) implements ConnectionState {

        public Closed toClosed(@Nullable Throwable cause) {
            return new Closed(cause);
        }
    }

    /**
     * No connection. Either never opened ({@link #INITIAL}) or closed, with the cause when the close was not requested.
     */
    record Closed(@Nullable Throwable cause) implements ConnectionState {
        public static final Closed INITIAL = new Closed(null);

        public Connecting toConnecting(ServiceEndpoint target) {
            return new Connecting(target);
        }
    }

    // Convenience methods
    default boolean isOpen() {
        return this instanceof Open;
    }

    default boolean isClosed() {
        return this instanceof Closed;
    }

    default boolean canSend() {
        return this instanceof Open;
    }
}
