/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.session;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;

import io.arasaka.truenas.AuthenticationException;
import io.arasaka.truenas.HandshakeException;
import io.arasaka.truenas.RemoteException;
import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.FakeTransport;
import io.arasaka.truenas.internal.ScriptedResponder;
import io.arasaka.truenas.internal.TransportListener;
import io.arasaka.truenas.internal.rpc.MessageCorrelator;
import io.arasaka.truenas.internal.rpc.RemoteCall;
import io.arasaka.truenas.service.ServiceEndpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionGateTest {

    private static final long TIMEOUT_SECONDS = 5;
    private static final ServiceEndpoint ENDPOINT = ServiceEndpoint.of("nas.local", true);

    private ScheduledExecutorService scheduler;
    private ScriptedResponder responder;
    private FakeTransport transport;
    private MessageCorrelator correlator;
    private SessionGate gate;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        responder = new ScriptedResponder();
        transport = new FakeTransport(new TransportListener() {
            @Override
            public void onMessage(DdpMessage message) {
                if (message instanceof DdpMessage.Connected || message instanceof DdpMessage.Failed) {
                    gate.onHandshakeReply(message);
                }
                else {
                    correlator.onMessage(message);
                }
            }

            @Override
            public void onClosed(TransportException cause) {
                correlator.failAll(cause);
                gate.onTransportClosed(cause);
            }
        }).respondWith(responder);
        correlator = new MessageCorrelator(transport, scheduler, Duration.ofSeconds(TIMEOUT_SECONDS));
        gate = newGate(correlator, ScriptedResponder.API_KEY, Duration.ofSeconds(TIMEOUT_SECONDS));
    }

    @AfterEach
    void tearDown() {
        transport.shutdown();
        scheduler.shutdownNow();
    }

    private SessionGate newGate(RemoteCall caller, String apiKey, Duration handshakeTimeout) {
        return new SessionGate(transport, caller, ENDPOINT, apiKey, handshakeTimeout, scheduler);
    }

    @Test
    @DisplayName("concurrent callers share a single connect, handshake and login")
    void concurrentCallersAuthenticateOnce() throws Exception {
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<CompletableFuture<Void>>> submitted = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                submitted.add(pool.submit(() -> {
                    start.await();
                    return gate.ensureAuthenticated();
                }));
            }
            start.countDown();
            for (Future<CompletableFuture<Void>> caller : submitted) {
                caller.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            }
        }
        finally {
            pool.shutdownNow();
        }

        assertEquals(1, transport.opens());
        assertEquals(1, responder.connects());
        assertEquals(1, responder.calls(SessionGate.LOGIN_METHOD));
        assertTrue(gate.isAuthenticated());
    }

    @Test
    void authenticatedSessionIsReused() throws Exception {
        gate.ensureAuthenticated().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        CompletableFuture<Void> again = gate.ensureAuthenticated();

        assertTrue(again.isDone());
        assertEquals(1, responder.calls(SessionGate.LOGIN_METHOD));
    }

    @Test
    @DisplayName("the handshake is sent before the login")
    void handshakePrecedesLogin() throws Exception {
        gate.ensureAuthenticated().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        List<DdpMessage> sent = transport.sent();
        assertEquals(DdpMessage.Connect.V1, sent.get(0));
        DdpMessage.MethodCall login = assertInstanceOf(DdpMessage.MethodCall.class, sent.get(1));
        assertEquals(SessionGate.LOGIN_METHOD, login.method());
        assertEquals(ScriptedResponder.API_KEY, login.params().get(0).asText());
    }

    @Test
    void rejectedHandshakeFailsAndClosesTransport() {
        responder.rejectHandshake();

        Throwable cause = failureOf(gate.ensureAuthenticated());

        assertInstanceOf(HandshakeException.class, cause);
        assertEquals(0, responder.calls(SessionGate.LOGIN_METHOD));
        assertTrue(transport.state().isClosed());
        assertInstanceOf(SessionState.Unauthenticated.class, gate.state());
    }

    @Test
    void unansweredHandshakeTimesOut() {
        responder.ignoreHandshake();
        gate = newGate(correlator, ScriptedResponder.API_KEY, Duration.ofMillis(200));

        Throwable cause = failureOf(gate.ensureAuthenticated());

        assertInstanceOf(HandshakeException.class, cause);
        assertFalse(gate.isAuthenticated());
    }

    @Test
    @DisplayName("a rejected API key fails with an authentication error and closes the connection")
    void rejectedKeyFailsAuthentication() {
        gate = newGate(correlator, "wrong-key", Duration.ofSeconds(TIMEOUT_SECONDS));

        Throwable cause = failureOf(gate.ensureAuthenticated());

        assertInstanceOf(AuthenticationException.class, cause);
        assertTrue(transport.state().isClosed());
        assertInstanceOf(SessionState.Unauthenticated.class, gate.state());
    }

    @Test
    void loginErrorBecomesAuthenticationError() {
        RemoteCall caller = mock(RemoteCall.class);
        RemoteException rejected = new RemoteException(SessionGate.LOGIN_METHOD, BooleanNode.FALSE);
        when(caller.call(eq(SessionGate.LOGIN_METHOD), anyList()))
                .thenReturn(CompletableFuture.<JsonNode> failedFuture(rejected));
        gate = newGate(caller, ScriptedResponder.API_KEY, Duration.ofSeconds(TIMEOUT_SECONDS));

        Throwable cause = failureOf(gate.ensureAuthenticated());

        AuthenticationException authentication = assertInstanceOf(AuthenticationException.class, cause);
        assertEquals(rejected, authentication.getCause());
        verify(caller).call(SessionGate.LOGIN_METHOD, List.of(ScriptedResponder.API_KEY));
    }

    @Test
    void refusedConnectionFailsWithTransportError() {
        transport.refuseConnections(true);

        Throwable cause = failureOf(gate.ensureAuthenticated());

        assertInstanceOf(TransportException.class, cause);
        assertInstanceOf(SessionState.Unauthenticated.class, gate.state());
    }

    @Test
    @DisplayName("losing the connection resets the session and the next caller reconnects")
    void connectionLossResetsSession() throws Exception {
        gate.ensureAuthenticated().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        transport.dropConnection();
        transport.drain();

        assertFalse(gate.isAuthenticated());
        gate.ensureAuthenticated().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(2, transport.opens());
        assertEquals(2, responder.calls(SessionGate.LOGIN_METHOD));
        assertTrue(gate.isAuthenticated());
    }

    @Test
    void connectionLossDuringHandshakeFailsTheAttempt() throws Exception {
        responder.ignoreHandshake();
        CompletableFuture<Void> attempt = gate.ensureAuthenticated();

        transport.dropConnection();

        assertInstanceOf(TransportException.class, failureOf(attempt));
        assertInstanceOf(SessionState.Unauthenticated.class, gate.state());
    }

    @Test
    void cancellingOneCallerDoesNotCancelTheAttempt() throws Exception {
        responder.ignoreHandshake();
        CompletableFuture<Void> first = gate.ensureAuthenticated();
        CompletableFuture<Void> second = gate.ensureAuthenticated();

        first.cancel(false);
        transport.deliver(new DdpMessage.Connected("late"));

        second.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertTrue(gate.isAuthenticated());
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException failure = assertThrows(ExecutionException.class, () -> future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        return failure.getCause();
    }
}
