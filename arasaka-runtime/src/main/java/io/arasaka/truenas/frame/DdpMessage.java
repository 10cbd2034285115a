/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.frame;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Sealed hierarchy of the DDP messages exchanged with the server, one per websocket text frame.
 * The {@code msg} field of the JSON object selects the record.
 *
 * <pre>
 *   client                         server
 *     │ ── Connect ────────────────► │
 *     │ ◄──────── Connected | Failed │
 *     │ ── MethodCall(id) ─────────► │
 *     │ ◄── MethodResult(id)         │
 *     │     | MethodError(id) ────── │
 *     │ ◄──────────────── Ping       │
 *     │ ── Pong ───────────────────► │
 * </pre>
 */
public sealed interface DdpMessage permits
        DdpMessage.Connect,
        DdpMessage.Connected,
        DdpMessage.Failed,
        DdpMessage.MethodCall,
        DdpMessage.MethodResult,
        DdpMessage.MethodError,
        DdpMessage.Ping,
        DdpMessage.Pong,
        DdpMessage.Unrecognised {

    String CONNECT = "connect";
    String CONNECTED = "connected";
    String FAILED = "failed";
    String METHOD = "method";
    String RESULT = "result";
    String ERROR = "error";
    String PING = "ping";
    String PONG = "pong";

    /**
     * @return the value of the {@code msg} field
     */
    String kind();

    /**
     * Handshake request.
     */
    record Connect(String version, List<String> support) implements DdpMessage {
        public static final Connect V1 = new Connect("1", List.of("1"));

        public Connect {
            support = List.copyOf(support);
        }

        @Override
        public String kind() {
            return CONNECT;
        }
    }

    /**
     * Handshake accepted.
     */
    record Connected(@Nullable String session) implements DdpMessage {
        @Override
        public String kind() {
            return CONNECTED;
        }
    }

    /**
     * Handshake rejected; {@code version} is the protocol version the server proposes instead, if any.
     */
    record Failed(@Nullable String version) implements DdpMessage {
        @Override
        public String kind() {
            return FAILED;
        }
    }

    /**
     * Remote procedure call.
     */
    record MethodCall(String id, String method, ArrayNode params) implements DdpMessage {
        public MethodCall {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(method, "method");
            Objects.requireNonNull(params, "params");
        }

        @Override
        public String kind() {
            return METHOD;
        }
    }

    /**
     * Successful answer to the call with the same id. An absent result decodes as JSON null.
     */
    record MethodResult(String id, JsonNode result) implements DdpMessage {
        public MethodResult {
            Objects.requireNonNull(id, "id");
            result = result == null ? NullNode.getInstance() : result;
        }

        @Override
        public String kind() {
            return RESULT;
        }
    }

    /**
     * Failed answer to the call with the same id.
     */
    record MethodError(String id, JsonNode error) implements DdpMessage {
        public MethodError {
            Objects.requireNonNull(id, "id");
            error = error == null ? NullNode.getInstance() : error;
        }

        @Override
        public String kind() {
            return ERROR;
        }
    }

    /**
     * Server keep-alive.
     */
    record Ping(@Nullable String id) implements DdpMessage {
        @Override
        public String kind() {
            return PING;
        }
    }

    /**
     * Answer to a {@link Ping}, echoing its id.
     */
    record Pong(@Nullable String id) implements DdpMessage {
        @Override
        public String kind() {
            return PONG;
        }
    }

    /**
     * Any well formed frame this client does not act on (collection updates, ready notifications, ...).
     */
    record Unrecognised(String kind, JsonNode frame) implements DdpMessage {}
}
