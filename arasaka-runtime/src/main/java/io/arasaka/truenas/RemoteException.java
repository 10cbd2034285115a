/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The server answered one specific call with an {@code error} frame.
 * Other calls on the same connection are unaffected.
 */
public class RemoteException extends RpcException {

    public static final String CODE = "REMOTE";

    private final String method;
    private final JsonNode error;

    public RemoteException(String method, JsonNode error) {
        super(CODE, "Method " + method + " failed: " + describe(error));
        this.method = method;
        this.error = error;
    }

    public String method() {
        return method;
    }

    /**
     * @return the {@code error} payload exactly as the server sent it
     */
    public JsonNode error() {
        return error;
    }

    static String describe(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        if (error.hasNonNull("reason")) {
            return error.get("reason").asText();
        }
        if (error.hasNonNull("message")) {
            return error.get("message").asText();
        }
        return error.isMissingNode() || error.isNull() ? "Unknown error" : error.toString();
    }
}
