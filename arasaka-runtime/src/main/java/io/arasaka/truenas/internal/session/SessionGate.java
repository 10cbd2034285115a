/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.session;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.arasaka.truenas.AuthenticationException;
import io.arasaka.truenas.HandshakeException;
import io.arasaka.truenas.RemoteException;
import io.arasaka.truenas.RpcException;
import io.arasaka.truenas.RpcTimeoutException;
import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.Transport;
import io.arasaka.truenas.internal.rpc.RemoteCall;
import io.arasaka.truenas.service.ServiceEndpoint;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Ensures the connection is open, has completed the protocol handshake and is authenticated
 * before any call is made on it.
 *
 * <p>Only one attempt is ever in flight: callers that arrive while it is running share it, and
 * callers that arrive after it succeeded get an already completed future. A failed handshake or
 * login closes the transport and returns the gate to
 * {@link SessionState.Unauthenticated Unauthenticated}; nothing is retried until the next call
 * asks again.</p>
 *
 * <p>Inbound {@code connected}/{@code failed} messages must be routed to
 * {@link #onHandshakeReply(DdpMessage)} and the transport's closure to
 * {@link #onTransportClosed(TransportException)}.</p>
 */
public class SessionGate {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionGate.class);

    static final String LOGIN_METHOD = "auth.login_with_api_key";

    private final Transport transport;
    private final RemoteCall caller;
    private final ServiceEndpoint endpoint;
    private final String apiKey;
    private final Duration handshakeTimeout;
    private final ScheduledExecutorService scheduler;

    // Mutable state, guarded by this
    private SessionState state = SessionState.Unauthenticated.INSTANCE;
    private @Nullable CompletableFuture<DdpMessage> handshakeReply;

    public SessionGate(
                       Transport transport,
                       RemoteCall caller,
                       ServiceEndpoint endpoint,
                       String apiKey,
                       Duration handshakeTimeout,
                       ScheduledExecutorService scheduler) {
        this.transport = Objects.requireNonNull(transport);
        this.caller = Objects.requireNonNull(caller);
        this.endpoint = Objects.requireNonNull(endpoint);
        this.apiKey = Objects.requireNonNull(apiKey);
        this.handshakeTimeout = Objects.requireNonNull(handshakeTimeout);
        this.scheduler = Objects.requireNonNull(scheduler);
    }

    // ==================== Accessors ====================

    public synchronized SessionState state() {
        return state;
    }

    public boolean isAuthenticated() {
        return state().isAuthenticated() && transport.isOpen();
    }

    // ==================== Authentication ====================

    /**
     * @return a future completing once the session is authenticated, or failing with
     *         {@link TransportException}, {@link HandshakeException} or {@link AuthenticationException}.
     *         Cancelling it does not cancel the shared attempt.
     */
    public CompletableFuture<Void> ensureAuthenticated() {
        CompletableFuture<Void> attempt;
        synchronized (this) {
            if (state instanceof SessionState.Authenticated) {
                if (transport.isOpen()) {
                    return CompletableFuture.completedFuture(null);
                }
                // closure not yet reported to us
                state = SessionState.Unauthenticated.INSTANCE;
            }
            if (state instanceof SessionState.Authenticating authenticating) {
                return authenticating.attempt().copy();
            }
            attempt = new CompletableFuture<>();
            setState(SessionState.Unauthenticated.INSTANCE.toAuthenticating(attempt));
        }

        LOGGER.debug("Authenticating with {}", endpoint.uri());
        transport.open(endpoint)
                .thenCompose(ignored -> handshake())
                .thenCompose(ignored -> login())
                .whenComplete((ignored, failure) -> onAttemptComplete(attempt, failure));
        return attempt.copy();
    }

    private CompletableFuture<Void> handshake() {
        CompletableFuture<DdpMessage> reply = new CompletableFuture<>();
        synchronized (this) {
            handshakeReply = reply;
        }
        ScheduledFuture<?> timeout = scheduler.schedule(
                () -> reply.completeExceptionally(new HandshakeException(
                        "No reply to connect from " + endpoint.uri() + " within " + handshakeTimeout.toMillis() + "ms")),
                handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        reply.whenComplete((message, failure) -> {
            timeout.cancel(false);
            clearHandshakeReply(reply);
        });

        transport.send(DdpMessage.Connect.V1).whenComplete((ignored, failure) -> {
            if (failure != null) {
                reply.completeExceptionally(RpcException.unwrap(failure));
            }
        });

        return reply.thenCompose(message -> {
            if (message instanceof DdpMessage.Connected connected) {
                LOGGER.debug("Handshake with {} complete, session {}", endpoint.uri(), connected.session());
                return CompletableFuture.<Void> completedFuture(null);
            }
            String version = message instanceof DdpMessage.Failed failed ? failed.version() : null;
            return CompletableFuture.<Void> failedFuture(new HandshakeException(
                    "Server " + endpoint.uri() + " rejected protocol version " + DdpMessage.Connect.V1.version()
                            + (version == null ? "" : ", it supports " + version)));
        });
    }

    private CompletableFuture<Void> login() {
        // params are never logged, they carry the key
        LOGGER.debug("Calling {} [***]", LOGIN_METHOD);
        return caller.call(LOGIN_METHOD, List.of(apiKey))
                .handle((result, failure) -> {
                    if (failure != null) {
                        Throwable cause = RpcException.unwrap(failure);
                        if (cause instanceof RemoteException || cause instanceof RpcTimeoutException) {
                            throw new CompletionException(new AuthenticationException(
                                    "Authentication with " + endpoint.hostPort() + " failed: " + cause.getMessage(), cause));
                        }
                        throw new CompletionException(cause);
                    }
                    if (!isAccepted(result)) {
                        throw new CompletionException(new AuthenticationException(
                                "Authentication with " + endpoint.hostPort() + " failed: API key rejected"));
                    }
                    return null;
                });
    }

    private static boolean isAccepted(@Nullable JsonNode result) {
        return result != null && result.isBoolean() && result.booleanValue();
    }

    private void onAttemptComplete(CompletableFuture<Void> attempt, @Nullable Throwable failure) {
        Throwable cause = failure == null ? null : RpcException.unwrap(failure);
        boolean current;
        synchronized (this) {
            current = state instanceof SessionState.Authenticating authenticating && authenticating.attempt() == attempt;
            if (current) {
                SessionState.Authenticating authenticating = (SessionState.Authenticating) state;
                setState(cause == null ? authenticating.toAuthenticated() : authenticating.toUnauthenticated());
            }
        }

        if (cause == null) {
            if (current) {
                LOGGER.info("Authenticated with {}", endpoint.hostPort());
                attempt.complete(null);
            }
            else {
                attempt.completeExceptionally(new TransportException("Connection to " + endpoint.uri() + " closed during authentication"));
            }
            return;
        }

        LOGGER.warn("Could not establish session with {}: {}", endpoint.uri(), cause.getMessage());
        if (current && (cause instanceof HandshakeException || cause instanceof AuthenticationException)) {
            // unusable connection: close it so the next call starts from scratch
            transport.close();
        }
        attempt.completeExceptionally(cause);
    }

    // ==================== Inbound events ====================

    /**
     * Delivers a {@code connected} or {@code failed} message to the handshake awaiting it.
     *
     * @param message the reply
     * @return true if a handshake was waiting for it
     */
    public boolean onHandshakeReply(DdpMessage message) {
        CompletableFuture<DdpMessage> reply;
        synchronized (this) {
            reply = handshakeReply;
        }
        if (reply == null) {
            LOGGER.debug("Ignoring {} message, no handshake in progress", message.kind());
            return false;
        }
        return reply.complete(message);
    }

    /**
     * Returns the gate to {@link SessionState.Unauthenticated}. An attempt in flight fails with {@code cause}.
     *
     * @param cause why the transport closed
     */
    public void onTransportClosed(TransportException cause) {
        SessionState previous;
        CompletableFuture<DdpMessage> reply;
        synchronized (this) {
            previous = state;
            reply = handshakeReply;
            handshakeReply = null;
            setState(SessionState.Unauthenticated.INSTANCE);
        }
        if (reply != null) {
            reply.completeExceptionally(cause);
        }
        if (previous instanceof SessionState.Authenticating authenticating) {
            authenticating.attempt().completeExceptionally(cause);
        }
        if (!(previous instanceof SessionState.Unauthenticated)) {
            LOGGER.info("Session with {} ended: {}", endpoint.hostPort(), cause.getMessage());
        }
    }

    // ==================== Internal State Management ====================

    private synchronized void clearHandshakeReply(CompletableFuture<DdpMessage> reply) {
        if (handshakeReply == reply) {
            handshakeReply = null;
        }
    }

    private void setState(SessionState newState) {
        LOGGER.trace("Session state {} -> {}", state, newState);
        this.state = newState;
    }

    @Override
    public String toString() {
        return "SessionGate{" +
                "endpoint=" + endpoint.uri() +
                ", state=" + state() +
                '}';
    }
}
