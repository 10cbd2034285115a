/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

/**
 * The server rejected (or never answered) the DDP {@code connect} handshake.
 * Not retried; the connection is closed.
 */
public class HandshakeException extends RpcException {

    public static final String CODE = "HANDSHAKE";

    public HandshakeException(String message) {
        super(CODE, message);
    }
}
