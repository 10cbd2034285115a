/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The API key exchange failed. Not retried automatically.
 */
public class AuthenticationException extends RpcException {

    public static final String CODE = "AUTHENTICATION";

    public AuthenticationException(String message) {
        super(CODE, message);
    }

    public AuthenticationException(String message, @Nullable Throwable cause) {
        super(CODE, message, cause);
    }
}
