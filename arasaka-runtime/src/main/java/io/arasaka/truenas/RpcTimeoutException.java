/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

/**
 * No response arrived before the deadline.
 */
public class RpcTimeoutException extends RpcException {

    public static final String CODE = "TIMEOUT";

    public RpcTimeoutException(String message) {
        super(CODE, message);
    }
}
