/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Session management for the TrueNAS connection.
 *
 * <h2>Architecture</h2>
 *
 * <p>This package keeps authentication separate from the connection that carries it:</p>
 *
 * <pre>
 * Caller → TrueNasClient → SessionGate ───► MessageCorrelator → Transport → Server
 *                              │                                   │
 *                              └──── connected / failed / closed ◄─┘
 * </pre>
 *
 * <h2>Key Components</h2>
 *
 * <dl>
 *   <dt>{@link io.arasaka.truenas.internal.session.SessionState}</dt>
 *   <dd>Sealed hierarchy for session states (Unauthenticated → Authenticating → Authenticated)</dd>
 *
 *   <dt>{@link io.arasaka.truenas.internal.session.SessionGate}</dt>
 *   <dd>Runs connect, handshake and login once per connection and shares the outcome with every waiting caller</dd>
 *
 *   <dt>{@link io.arasaka.truenas.internal.ConnectionState}</dt>
 *   <dd>Sealed hierarchy for the connection itself (Closed → Connecting → Open → Closing → Closed)</dd>
 * </dl>
 *
 * <h2>Connection loss</h2>
 *
 * <p>The session never outlives its connection. When the transport reports closure, or the gate or
 * the client closes it, the gate returns to Unauthenticated and the next call starts over with a
 * fresh connection.</p>
 *
 * @see io.arasaka.truenas.internal.NettyTransport
 * @see io.arasaka.truenas.internal.rpc.MessageCorrelator
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.arasaka.truenas.internal.session;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
