/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import io.arasaka.truenas.frame.DdpFrameCodec;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.service.HostPort;
import io.arasaka.truenas.service.ServiceEndpoint;

/**
 * A websocket server on the loopback interface that answers with a {@link ScriptedResponder}.
 */
public class DdpTestServer implements AutoCloseable {

    public static final String PATH = "/websocket";

    private final EventLoopGroup group = new NioEventLoopGroup(1);
    private final List<Channel> clients = new CopyOnWriteArrayList<>();
    private final AtomicInteger connections = new AtomicInteger();
    private final Channel serverChannel;

    public DdpTestServer(ScriptedResponder responder) throws InterruptedException {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        clients.add(ch);
                        connections.incrementAndGet();
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(65536),
                                new WebSocketServerProtocolHandler(PATH),
                                new DdpFrameCodec(),
                                new SimpleChannelInboundHandler<DdpMessage>() {
                                    @Override
                                    protected void channelRead0(ChannelHandlerContext ctx, DdpMessage message) {
                                        for (DdpMessage reply : responder.apply(message)) {
                                            ctx.writeAndFlush(reply);
                                        }
                                    }
                                });
                    }
                });
        this.serverChannel = bootstrap.bind(InetAddress.getLoopbackAddress(), 0).sync().channel();
    }

    public int port() {
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public ServiceEndpoint endpoint() {
        return new ServiceEndpoint(new HostPort(InetAddress.getLoopbackAddress().getHostAddress(), port()), PATH, false, false);
    }

    /**
     * Pushes a message to every connected client.
     */
    public void broadcast(DdpMessage message) {
        clients.forEach(client -> client.writeAndFlush(message));
    }

    /**
     * Closes every client connection from the server side.
     */
    public void dropClients() {
        clients.forEach(Channel::close);
    }

    public int connections() {
        return connections.get();
    }

    @Override
    public void close() {
        serverChannel.close().syncUninterruptibly();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
