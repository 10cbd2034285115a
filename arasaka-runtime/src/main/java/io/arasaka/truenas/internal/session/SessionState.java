/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal.session;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Sealed hierarchy representing the authentication state of the session carried by the current
 * connection.
 *
 * <pre>
 *   Unauthenticated ◄──────────────────────┐
 *      │                                   │ (attempt failed, or
 *      ▼ ensureAuthenticated()             │  transport closed)
 *   Authenticating ────────────────────────┤
 *      │                                   │
 *      ▼ connected + login accepted        │
 *   Authenticated ─────────────────────────┘
 * </pre>
 */
public sealed interface SessionState permits
        SessionState.Unauthenticated,
        SessionState.Authenticating,
        SessionState.Authenticated {

    /**
     * Initial state, and the state after any connection loss.
     */
    record Unauthenticated() implements SessionState {
        public static final Unauthenticated INSTANCE = new Unauthenticated();

        public Authenticating toAuthenticating(CompletableFuture<Void> attempt) {
            return new Authenticating(attempt);
        }
    }

    /**
     * Connect, handshake and login in progress. Every caller arriving in this state shares {@code attempt}.
     */
    record Authenticating(CompletableFuture<Void> attempt) implements SessionState {

        public Authenticating {
            Objects.requireNonNull(attempt);
        }

        public Authenticated toAuthenticated() {
            return Authenticated.INSTANCE;
        }

        public Unauthenticated toUnauthenticated() {
            return Unauthenticated.INSTANCE;
        }
    }

    /**
     * The server accepted the API key on the current connection.
     */
    record Authenticated() implements SessionState {
        public static final Authenticated INSTANCE = new Authenticated();

        public Unauthenticated toUnauthenticated() {
            return Unauthenticated.INSTANCE;
        }
    }

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }
}
