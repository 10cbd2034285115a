/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The connection failed, could not be opened, or was closed. Fatal to every call pending on that connection.
 */
public class TransportException extends RpcException {

    public static final String CODE = "TRANSPORT";

    public TransportException(String message) {
        super(CODE, message);
    }

    public TransportException(String message, @Nullable Throwable cause) {
        super(CODE, message, cause);
    }
}
