/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.rpc;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import io.arasaka.truenas.RemoteException;
import io.arasaka.truenas.RpcException;
import io.arasaka.truenas.RpcTimeoutException;
import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.Transport;
import io.arasaka.truenas.internal.util.Json;
import io.arasaka.truenas.internal.util.Metrics;
import io.arasaka.truenas.tag.VisibleForTesting;

/**
 * Matches responses to the requests that caused them.
 *
 * <p>Each {@link #call(String, List) call} gets a fresh id and a {@link PendingRequest} entry
 * which is removed exactly once: by the response carrying that id, by its timeout, by
 * cancellation of the returned future or by {@link #failAll(RpcException)}. Whichever completes
 * the future first wins, and the completion callback removes the entry and cancels the timer. Responses whose id is not
 * pending (late, duplicated or never sent by us) are dropped.</p>
 *
 * <p>No ordering is implied between concurrent calls.</p>
 */
public class MessageCorrelator implements RemoteCall {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageCorrelator.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_ERROR = "error";
    private static final String OUTCOME_TIMEOUT = "timeout";
    private static final String OUTCOME_FAILED = "failed";
    private static final String OUTCOME_CANCELLED = "cancelled";

    private final Transport transport;
    private final ScheduledExecutorService scheduler;
    private final Duration defaultTimeout;
    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();
    private final Map<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public MessageCorrelator(Transport transport, ScheduledExecutorService scheduler, Duration defaultTimeout) {
        this(transport, scheduler, defaultTimeout, Clock.systemUTC());
    }

    @VisibleForTesting
    MessageCorrelator(Transport transport, ScheduledExecutorService scheduler, Duration defaultTimeout, Clock clock) {
        this.transport = Objects.requireNonNull(transport);
        this.scheduler = Objects.requireNonNull(scheduler);
        this.defaultTimeout = requirePositive(defaultTimeout);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, List<?> params) {
        return call(method, params, defaultTimeout);
    }

    /**
     * Sends a method call and returns a future for its result.
     *
     * @param method remote method name
     * @param params positional parameters, converted to JSON
     * @param timeout how long to wait for the response
     * @return future completing with the {@code result} payload (JSON null when the server sent
     *         none), or failing with {@link RemoteException}, {@link RpcTimeoutException} or
     *         {@link TransportException}
     */
    public CompletableFuture<JsonNode> call(String method, List<?> params, Duration timeout) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
        requirePositive(timeout);

        ArrayNode paramsNode;
        try {
            paramsNode = Json.MAPPER.valueToTree(params);
        }
        catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        String id = nextId();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        // completes the future directly: the timer may fire before the entry is registered
        ScheduledFuture<?> timeoutHandle = scheduler.schedule(
                () -> onTimeout(id, method, future, timeout), timeout.toNanos(), TimeUnit.NANOSECONDS);
        PendingRequest request = new PendingRequest(id, method, clock.instant(), future, timeoutHandle);
        pending.put(id, request);
        future.whenComplete((result, failure) -> release(request, failure));

        LOGGER.debug("Calling {} ({})", method, id);
        transport.send(new DdpMessage.MethodCall(id, method, paramsNode))
                .whenComplete((ignored, sendFailure) -> {
                    if (sendFailure != null) {
                        Throwable cause = RpcException.unwrap(sendFailure);
                        future.completeExceptionally(cause instanceof TransportException
                                ? cause
                                : new TransportException("Failed to send " + method + ": " + cause.getMessage(), cause));
                    }
                });
        return future;
    }

    /**
     * Routes a response to its pending request.
     *
     * @param message an inbound message
     * @return true if the message completed a pending request
     */
    public boolean onMessage(DdpMessage message) {
        if (message instanceof DdpMessage.MethodResult result) {
            PendingRequest request = pending.get(result.id());
            if (request == null) {
                LOGGER.debug("Ignoring result for unknown request {}", result.id());
                return false;
            }
            return request.future().complete(result.result());
        }
        else if (message instanceof DdpMessage.MethodError error) {
            PendingRequest request = pending.get(error.id());
            if (request == null) {
                LOGGER.debug("Ignoring error for unknown request {}", error.id());
                return false;
            }
            return request.future().completeExceptionally(new RemoteException(request.method(), error.error()));
        }
        return false;
    }

    /**
     * Fails every outstanding request with the given cause.
     *
     * @param cause failure to deliver
     * @return number of requests failed
     */
    public int failAll(RpcException cause) {
        int failed = 0;
        for (PendingRequest request : List.copyOf(pending.values())) {
            if (request.future().completeExceptionally(cause)) {
                failed++;
            }
        }
        if (failed > 0) {
            LOGGER.info("Failed {} pending request(s): {}", failed, cause.getMessage());
        }
        return failed;
    }

    public int pendingCount() {
        return pending.size();
    }

    private void onTimeout(String id, String method, CompletableFuture<JsonNode> future, Duration timeout) {
        if (future.completeExceptionally(
                new RpcTimeoutException("Request " + id + " (" + method + ") timed out after " + timeout.toMillis() + "ms"))) {
            Metrics.rpcTimeoutCounter(method).increment();
            LOGGER.warn("Request {} ({}) timed out after {}ms", id, method, timeout.toMillis());
        }
    }

    private void release(PendingRequest request, Throwable failure) {
        if (!pending.remove(request.id(), request)) {
            return;
        }
        request.timeoutHandle().cancel(false);
        Duration elapsed = Duration.between(request.createdAt(), clock.instant());
        Metrics.rpcCallTimer(request.method(), outcomeOf(failure)).record(elapsed);
        LOGGER.debug("Request {} ({}) completed in {}ms", request.id(), request.method(), elapsed.toMillis());
    }

    private static String outcomeOf(Throwable failure) {
        if (failure == null) {
            return OUTCOME_SUCCESS;
        }
        if (failure instanceof CancellationException) {
            return OUTCOME_CANCELLED;
        }
        if (failure instanceof RemoteException) {
            return OUTCOME_ERROR;
        }
        if (failure instanceof RpcTimeoutException) {
            return OUTCOME_TIMEOUT;
        }
        return OUTCOME_FAILED;
    }

    private String nextId() {
        return "req_" + counter.incrementAndGet() + "_" + clock.millis();
    }

    private static Duration requirePositive(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        return timeout;
    }

    @Override
    public String toString() {
        return "MessageCorrelator{" +
                "pending=" + pending.size() +
                ", defaultTimeout=" + defaultTimeout +
                '}';
    }
}
