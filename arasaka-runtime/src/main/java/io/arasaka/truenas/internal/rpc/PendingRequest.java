/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.rpc;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A method call that has been sent and is awaiting its response.
 *
 * @param id request id, unique for the lifetime of the correlator
 * @param method remote method name
 * @param createdAt when the request was registered
 * @param future completed by exactly one of response, timeout or forced failure
 * @param timeoutHandle the scheduled timeout, cancelled when the request is released
 */
public record PendingRequest(
                             String id,
                             String method,
                             Instant createdAt,
                             CompletableFuture<JsonNode> future,
                             ScheduledFuture<?> timeoutHandle) {}
