/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import java.util.concurrent.CompletableFuture;

import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.service.ServiceEndpoint;

/**
 * The single duplex connection to the server.
 *
 * <p>Inbound messages, and any transition to {@link ConnectionState.Closed} that {@link #close()}
 * did not request, are reported to the {@link TransportListener} the transport was created with.
 * Implementations deliver them from a single thread, one whole decoded message at a time.</p>
 */
public interface Transport {

    /**
     * Opens the connection. Completes once the websocket upgrade has been accepted and the state is
     * {@link ConnectionState.Open}; completes immediately if already open and returns the in-flight
     * attempt if already connecting. While a previous connection is still closing, connects once it
     * has gone.
     *
     * @param endpoint the server to connect to
     * @return future completing when the connection is usable, or failing with a
     *         {@link io.arasaka.truenas.TransportException}
     */
    CompletableFuture<Void> open(ServiceEndpoint endpoint);

    /**
     * Writes one message.
     *
     * @param message message to send
     * @return future completing when the message is written, or failing with a
     *         {@link io.arasaka.truenas.TransportException} (including when the transport is not open)
     */
    CompletableFuture<Void> send(DdpMessage message);

    /**
     * Closes the connection. Safe to call repeatedly and from any state. The listener is not told
     * about a closure it asked for.
     */
    void close();

    ConnectionState state();

    default boolean isOpen() {
        return state().isOpen();
    }
}
