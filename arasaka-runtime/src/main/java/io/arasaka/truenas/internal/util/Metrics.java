/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.arasaka.truenas.internal.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters published by the client. All meters live in Micrometer's global registry; they are
 * no-ops until the embedding application adds a concrete registry to it.
 */
public class Metrics {

    public static final String CONNECTIONS = "arasaka_client_connections";
    public static final String CONNECTION_ERRORS = "arasaka_client_connection_errors";
    public static final String RPC_CALLS = "arasaka_client_rpc_calls";
    public static final String RPC_TIMEOUTS = "arasaka_client_rpc_timeouts";
    public static final String JOB_POLLS = "arasaka_client_job_polls";

    private static final String HOST_TAG = "host";
    private static final String METHOD_TAG = "method";
    private static final String OUTCOME_TAG = "outcome";

    private Metrics() {
    }

    public static Counter connectionCounter(String host) {
        return Counter.builder(CONNECTIONS)
                .description("Connections that completed the websocket upgrade")
                .tag(HOST_TAG, host)
                .register(globalRegistry);
    }

    public static Counter connectionErrorCounter(String host) {
        return Counter.builder(CONNECTION_ERRORS)
                .description("Connection attempts that failed or connections lost to an error")
                .tag(HOST_TAG, host)
                .register(globalRegistry);
    }

    public static Timer rpcCallTimer(String method, String outcome) {
        return Timer.builder(RPC_CALLS)
                .description("Round trip of method calls, by outcome")
                .tag(METHOD_TAG, method)
                .tag(OUTCOME_TAG, outcome)
                .register(globalRegistry);
    }

    public static Counter rpcTimeoutCounter(String method) {
        return Counter.builder(RPC_TIMEOUTS)
                .description("Method calls that received no response before their deadline")
                .tag(METHOD_TAG, method)
                .register(globalRegistry);
    }

    public static Counter jobPollCounter() {
        return Counter.builder(JOB_POLLS)
                .description("Job status queries issued while awaiting background jobs")
                .register(globalRegistry);
    }
}
