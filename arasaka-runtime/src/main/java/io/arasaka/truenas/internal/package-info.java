/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * The connection to the server.
 *
 * <p>{@link io.arasaka.truenas.internal.Transport} is the seam the rest of the client depends on;
 * {@link io.arasaka.truenas.internal.NettyTransport} implements it with a Netty websocket client
 * pipeline:</p>
 *
 * <pre>
 * [ssl] → [network logger] → http codec → http aggregator → websocket protocol handler
 *       → frame aggregator → [frame logger] → DdpFrameCodec → DdpChannelHandler
 * </pre>
 *
 * <p>{@link io.arasaka.truenas.internal.DdpChannelHandler} turns channel events into transport
 * state changes, see {@link io.arasaka.truenas.internal.ConnectionState}.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.arasaka.truenas.internal;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
