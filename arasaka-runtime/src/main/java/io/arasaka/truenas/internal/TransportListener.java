/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;

/**
 * Receives what a {@link Transport} reads, and its closure.
 */
public interface TransportListener {

    void onMessage(DdpMessage message);

    /**
     * Called once each time the transport enters {@link ConnectionState.Closed} from another state.
     *
     * @param cause why the connection ended
     */
    void onClosed(TransportException cause);
}
