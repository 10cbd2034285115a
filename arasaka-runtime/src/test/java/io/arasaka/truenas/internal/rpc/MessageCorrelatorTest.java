/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.rpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import io.arasaka.truenas.RemoteException;
import io.arasaka.truenas.RpcTimeoutException;
import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.FakeTransport;
import io.arasaka.truenas.internal.TransportListener;
import io.arasaka.truenas.internal.util.Json;
import io.arasaka.truenas.service.ServiceEndpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageCorrelatorTest {

    private static final long TIMEOUT_SECONDS = 5;

    private ScheduledExecutorService scheduler;
    private FakeTransport transport;
    private MessageCorrelator correlator;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        transport = new FakeTransport(new TransportListener() {
            @Override
            public void onMessage(DdpMessage message) {
                correlator.onMessage(message);
            }

            @Override
            public void onClosed(TransportException cause) {
                correlator.failAll(cause);
            }
        });
        correlator = new MessageCorrelator(transport, scheduler, Duration.ofSeconds(TIMEOUT_SECONDS));
        transport.open(ServiceEndpoint.of("nas.local", true)).get();
    }

    @AfterEach
    void tearDown() {
        transport.shutdown();
        scheduler.shutdownNow();
    }

    @ParameterizedTest
    @ValueSource(longs = { 1, 7, 42 })
    @DisplayName("every response completes exactly the call that carried its id, whatever the arrival order")
    void responsesMatchCallsInAnyOrder(long seed) throws Exception {
        int calls = 25;
        List<CompletableFuture<JsonNode>> futures = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            futures.add(correlator.call("test.echo", List.of("value-" + i)));
        }

        List<DdpMessage.MethodCall> sent = new ArrayList<>(transport.sent(DdpMessage.MethodCall.class));
        Collections.shuffle(sent, new Random(seed));
        for (DdpMessage.MethodCall call : sent) {
            transport.deliver(new DdpMessage.MethodResult(call.id(), TextNode.valueOf("echo-" + call.params().get(0).asText())));
        }

        for (int i = 0; i < calls; i++) {
            assertEquals("echo-value-" + i, futures.get(i).get(TIMEOUT_SECONDS, TimeUnit.SECONDS).asText());
        }
        awaitNoPendingRequests();
    }

    @Test
    void idsAreUniqueAndNeverReused() {
        for (int i = 0; i < 100; i++) {
            correlator.call("test.echo", List.of());
        }

        Set<String> ids = new HashSet<>();
        for (DdpMessage.MethodCall call : transport.sent(DdpMessage.MethodCall.class)) {
            assertTrue(call.id().matches("req_\\d+_\\d+"), call.id());
            ids.add(call.id());
        }
        assertEquals(100, ids.size());
    }

    @Test
    @DisplayName("an error response fails only its own call, with the server's payload")
    void errorResponseFailsOnlyItsCall() throws Exception {
        CompletableFuture<JsonNode> failing = correlator.call("app.get_instance", List.of("missing"));
        CompletableFuture<JsonNode> succeeding = correlator.call("system.info", List.of());
        List<DdpMessage.MethodCall> sent = transport.sent(DdpMessage.MethodCall.class);
        ObjectNode error = Json.MAPPER.createObjectNode();
        error.put("error", 2);
        error.put("reason", "[ENOENT] missing not found");

        transport.deliver(new DdpMessage.MethodError(sent.get(0).id(), error));
        transport.deliver(new DdpMessage.MethodResult(sent.get(1).id(), TextNode.valueOf("ok")));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> failing.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        RemoteException remote = assertInstanceOf(RemoteException.class, failure.getCause());
        assertEquals("app.get_instance", remote.method());
        assertEquals(error, remote.error());
        assertEquals("ok", succeeding.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).asText());
    }

    @Test
    void missingResultIsJsonNull() throws Exception {
        CompletableFuture<JsonNode> call = correlator.call("app.start", List.of("web"));
        String id = transport.sent(DdpMessage.MethodCall.class).get(0).id();

        transport.deliver(new DdpMessage.MethodResult(id, null));

        assertTrue(call.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).isNull());
    }

    @Test
    @DisplayName("a call that times out does not disturb the others, and its late response is ignored")
    void timeoutIsIsolated() throws Exception {
        CompletableFuture<JsonNode> slow = correlator.call("test.slow", List.of(), Duration.ofMillis(100));
        CompletableFuture<JsonNode> fast = correlator.call("test.fast", List.of());
        List<DdpMessage.MethodCall> sent = transport.sent(DdpMessage.MethodCall.class);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> slow.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertInstanceOf(RpcTimeoutException.class, failure.getCause());

        transport.deliver(new DdpMessage.MethodResult(sent.get(1).id(), TextNode.valueOf("fast")));
        assertEquals("fast", fast.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).asText());

        assertFalse(correlator.onMessage(new DdpMessage.MethodResult(sent.get(0).id(), TextNode.valueOf("late"))));
        awaitNoPendingRequests();
    }

    @Test
    @DisplayName("timeouts shorter than a millisecond still fail every call exactly once")
    void subMillisecondTimeoutsAlwaysFire() throws Exception {
        List<CompletableFuture<JsonNode>> calls = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            calls.add(correlator.call("test.ignored", List.of(i), Duration.ofNanos(1)));
        }

        for (CompletableFuture<JsonNode> call : calls) {
            ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
            assertInstanceOf(RpcTimeoutException.class, failure.getCause());
        }
        awaitNoPendingRequests();
    }

    @Test
    void unknownIdsAreIgnored() {
        CompletableFuture<JsonNode> call = correlator.call("test.echo", List.of());

        assertFalse(correlator.onMessage(new DdpMessage.MethodResult("req_999_1", TextNode.valueOf("stray"))));
        assertFalse(correlator.onMessage(new DdpMessage.MethodError("req_999_1", TextNode.valueOf("stray"))));
        assertFalse(call.isDone());
        assertEquals(1, correlator.pendingCount());
    }

    @Test
    void failAllFailsEveryPendingCall() {
        CompletableFuture<JsonNode> first = correlator.call("test.one", List.of());
        CompletableFuture<JsonNode> second = correlator.call("test.two", List.of());
        TransportException cause = new TransportException("connection lost");

        assertEquals(2, correlator.failAll(cause));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> first.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertSame(cause, failure.getCause());
        assertTrue(second.isCompletedExceptionally());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    @DisplayName("connection loss fails pending calls promptly")
    void connectionLossFailsPendingCalls() {
        CompletableFuture<JsonNode> call = correlator.call("test.echo", List.of());

        transport.dropConnection();

        ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(1, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, failure.getCause());
    }

    @Test
    void sendFailureFailsTheCall() {
        transport.close();

        CompletableFuture<JsonNode> call = correlator.call("test.echo", List.of());

        ExecutionException failure = assertThrows(ExecutionException.class, () -> call.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, failure.getCause());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void cancellingReleasesTheRequest() {
        CompletableFuture<JsonNode> call = correlator.call("test.echo", List.of());
        String id = transport.sent(DdpMessage.MethodCall.class).get(0).id();

        call.cancel(false);

        assertEquals(0, correlator.pendingCount());
        assertFalse(correlator.onMessage(new DdpMessage.MethodResult(id, TextNode.valueOf("too late"))));
    }

    // completion callbacks may still be running when get() returns
    private void awaitNoPendingRequests() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (correlator.pendingCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> correlator.call("test.echo", List.of(), Duration.ZERO));
    }
}
