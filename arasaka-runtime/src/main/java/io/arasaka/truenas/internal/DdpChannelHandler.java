/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.util.ReferenceCountUtil;

import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Netty channel handler at the tail of the client pipeline.
 *
 * <p>This handler turns Netty I/O callbacks into {@link NettyTransport} events:</p>
 * <ul>
 *   <li>Websocket upgrade completion or timeout</li>
 *   <li>TLS handshake failure</li>
 *   <li>Decoded {@link DdpMessage}s</li>
 *   <li>Connection loss and exceptions</li>
 * </ul>
 *
 * <p>One handler is created per connection attempt, so events from a channel that has since been
 * replaced can be recognised and ignored by the transport.</p>
 */
public class DdpChannelHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DdpChannelHandler.class);

    @VisibleForTesting
    final NettyTransport transport;

    @Nullable
    ChannelHandlerContext serverCtx;

    public DdpChannelHandler(NettyTransport transport) {
        this.transport = Objects.requireNonNull(transport);
    }

    /**
     * Netty callback that resources have been allocated for the channel.
     */
    @Override
    public void channelRegistered(ChannelHandlerContext ctx) throws Exception {
        this.serverCtx = ctx;
        super.channelRegistered(ctx);
    }

    /**
     * Netty callback for custom events. The websocket protocol handler reports the outcome of the
     * upgrade request here; the connection is only usable once it reports completion.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object event) throws Exception {
        if (event == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            transport.onConnectionActive(this);
        }
        else if (event == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            transport.onConnectionFailed(this, new TransportException("Websocket upgrade timed out"));
        }
        else if (event instanceof SslHandshakeCompletionEvent sslEvt && !sslEvt.isSuccess()) {
            transport.onConnectionFailed(this, sslEvt.cause());
        }
        super.userEventTriggered(ctx, event);
    }

    /**
     * Netty callback that the channel has disconnected.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        transport.onConnectionInactive(this);
    }

    /**
     * Netty callback indicating that an exception reached the end of the pipeline.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        transport.onConnectionError(this, cause);
    }

    /**
     * Netty callback that a message has been decoded. Only {@link DdpMessage}s reach the transport;
     * anything else that slipped through the codec (binary frames, for instance) is released.
     */
    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof DdpMessage message) {
            transport.onMessage(this, message);
        }
        else {
            LOGGER.debug("Ignoring unexpected inbound {}", msg.getClass().getSimpleName());
            ReferenceCountUtil.release(msg);
        }
    }

    // ==================== Methods called by NettyTransport ====================

    /**
     * Called by the {@link NettyTransport} to write a message to the server.
     *
     * @param message the message to write
     * @return the write future
     */
    public ChannelFuture sendToServer(DdpMessage message) {
        if (serverCtx == null) {
            throw new IllegalStateException("write without an active channel");
        }
        return serverCtx.channel().writeAndFlush(message);
    }

    /**
     * Called by the {@link NettyTransport} on entry to the Closing state.
     * The websocket protocol handler sends the close frame before the channel is closed.
     */
    public void inClosing() {
        if (serverCtx != null) {
            Channel channel = serverCtx.channel();
            if (channel.isOpen()) {
                channel.close();
            }
        }
    }

    @Override
    public String toString() {
        return "DdpChannelHandler{" +
                "serverCtx=" + serverCtx +
                ", state=" + transport.state() +
                '}';
    }
}
