/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.internal;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;

import io.arasaka.truenas.TransportException;
import io.arasaka.truenas.frame.DdpFrameCodec;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.util.Metrics;
import io.arasaka.truenas.service.ServiceEndpoint;
import io.arasaka.truenas.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * {@link Transport} over a Netty websocket client channel.
 *
 * <p>This class encapsulates:</p>
 * <ul>
 *   <li>Connection state (Closed → Connecting → Open → Closing → Closed)</li>
 *   <li>The Netty channel and pipeline for the current connection</li>
 *   <li>Writing messages to the server</li>
 *   <li>Reporting inbound messages and closure to the {@link TransportListener}</li>
 * </ul>
 *
 * <p>Works with {@link DdpChannelHandler} for Netty I/O operations. State transitions are made
 * under this object's monitor; futures are completed and the listener is called after the monitor
 * has been released.</p>
 *
 * <p>Only closures this transport did not ask for are reported to the listener. After
 * {@link #close()} the old channel goes away silently, and an {@link #open(ServiceEndpoint)} issued
 * meanwhile connects again once it has.</p>
 */
public class NettyTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransport.class);

    static final int MAX_CONTENT_LENGTH = 16 * 1024 * 1024;
    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final EventLoopGroup group;
    private final Class<? extends Channel> channelClass;
    private final TransportListener listener;
    private final Duration connectTimeout;
    private final boolean logNetwork;
    private final boolean logFrames;

    // Mutable state
    private volatile ConnectionState state = ConnectionState.Closed.INITIAL;
    private @Nullable DdpChannelHandler handler;
    private @Nullable Channel channel;
    private @Nullable CompletableFuture<Void> openFuture;
    private @Nullable CompletableFuture<Void> closedFuture;

    // Metrics
    private @Nullable Counter connectionCounter;
    private @Nullable Counter errorCounter;

    public NettyTransport(EventLoopGroup group, TransportListener listener, boolean logNetwork, boolean logFrames) {
        this(group, NioSocketChannel.class, listener, DEFAULT_CONNECT_TIMEOUT, logNetwork, logFrames);
    }

    public NettyTransport(
                          EventLoopGroup group,
                          Class<? extends Channel> channelClass,
                          TransportListener listener,
                          Duration connectTimeout,
                          boolean logNetwork,
                          boolean logFrames) {
        this.group = Objects.requireNonNull(group);
        this.channelClass = Objects.requireNonNull(channelClass);
        this.listener = Objects.requireNonNull(listener);
        this.connectTimeout = Objects.requireNonNull(connectTimeout);
        this.logNetwork = logNetwork;
        this.logFrames = logFrames;
    }

    // ==================== Accessors ====================

    @Override
    public ConnectionState state() {
        return state;
    }

    // ==================== Connection Lifecycle ====================

    @Override
    public CompletableFuture<Void> open(ServiceEndpoint endpoint) {
        Objects.requireNonNull(endpoint);
        CompletableFuture<Void> previousClose;
        synchronized (this) {
            if (!(state instanceof ConnectionState.Closing) || closedFuture == null) {
                return connectIfClosed(endpoint);
            }
            previousClose = closedFuture;
        }
        LOGGER.debug("Waiting for the previous connection to close before connecting to {}", endpoint.uri());
        return previousClose.thenCompose(ignored -> open(endpoint));
    }

    private CompletableFuture<Void> connectIfClosed(ServiceEndpoint endpoint) {
        CompletableFuture<Void> result;
        Throwable sslFailure = null;
        DdpChannelHandler attemptHandler;
        synchronized (this) {
            if (state.isOpen()) {
                return CompletableFuture.completedFuture(null);
            }
            if (state instanceof ConnectionState.Connecting && openFuture != null) {
                return openFuture;
            }
            if (!(state instanceof ConnectionState.Closed closed)) {
                return CompletableFuture.failedFuture(
                        new TransportException("Cannot open connection in state: " + state));
            }

            LOGGER.debug("Connecting to {}", endpoint.uri());
            setState(closed.toConnecting(endpoint));
            openFuture = new CompletableFuture<>();
            result = openFuture;
            connectionCounter = Metrics.connectionCounter(endpoint.host());
            errorCounter = Metrics.connectionErrorCounter(endpoint.host());

            Optional<SslContext> sslContext = Optional.empty();
            try {
                sslContext = buildSslContext(endpoint);
            }
            catch (SSLException e) {
                sslFailure = e;
            }

            // one handler per attempt, see DdpChannelHandler
            attemptHandler = new DdpChannelHandler(this);
            this.handler = attemptHandler;
            if (sslFailure == null) {
                connect(endpoint, attemptHandler, sslContext);
            }
        }
        if (sslFailure != null) {
            onConnectionFailed(attemptHandler, sslFailure);
        }
        return result;
    }

    private void connect(ServiceEndpoint endpoint, DdpChannelHandler connectionHandler, Optional<SslContext> sslContext) {
        Bootstrap bootstrap = configureBootstrap()
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        configurePipeline(ch.pipeline(), endpoint, sslContext, connectionHandler);
                    }
                });
        ChannelFuture connectFuture = bootstrap.connect(endpoint.host(), endpoint.port());
        this.channel = connectFuture.channel();

        connectFuture.addListener((ChannelFuture f) -> {
            if (f.isSuccess()) {
                // the connection becomes usable when the websocket upgrade completes, see DdpChannelHandler
                LOGGER.trace("TCP connected to {}", endpoint.hostPort());
            }
            else {
                onConnectionFailed(connectionHandler, f.cause());
            }
        });
    }

    /**
     * Called when the websocket upgrade has been accepted.
     * Called from DdpChannelHandler.
     */
    void onConnectionActive(DdpChannelHandler source) {
        CompletableFuture<Void> toComplete = null;
        synchronized (this) {
            if (source != handler) {
                return;
            }
            if (state instanceof ConnectionState.Connecting connecting) {
                setState(connecting.toOpen());
                if (connectionCounter != null) {
                    connectionCounter.increment();
                }
                LOGGER.info("Connected to {}", connecting.target().uri());
                toComplete = openFuture;
            }
            else {
                LOGGER.warn("Unexpected websocket upgrade completion in state {}", state);
            }
        }
        if (toComplete != null) {
            toComplete.complete(null);
        }
    }

    /**
     * Called when a connection attempt fails before the connection became usable.
     * Called from DdpChannelHandler.
     */
    void onConnectionFailed(@Nullable DdpChannelHandler source, Throwable cause) {
        TransportException failure;
        CompletableFuture<Void> toFail;
        Channel toClose;
        synchronized (this) {
            if (source != handler || !(state instanceof ConnectionState.Connecting connecting)) {
                return;
            }
            failure = asTransportException("Failed to connect to " + connecting.target().uri(), cause);
            setState(connecting.toClosed(failure));
            if (errorCounter != null) {
                errorCounter.increment();
            }
            LOGGER.warn("Failed to connect to {}: {}", connecting.target().uri(), failure.getMessage());
            toFail = openFuture;
            toClose = channel;
        }
        closeChannel(toClose);
        if (toFail != null) {
            toFail.completeExceptionally(failure);
        }
        listener.onClosed(failure);
    }

    /**
     * Called when the channel becomes inactive.
     * Called from DdpChannelHandler.
     */
    void onConnectionInactive(DdpChannelHandler source) {
        TransportException failure;
        CompletableFuture<Void> toComplete = null;
        synchronized (this) {
            if (source != handler) {
                return;
            }
            if (state instanceof ConnectionState.Connecting) {
                failure = null;
            }
            else if (state instanceof ConnectionState.Open open) {
                failure = new TransportException("Connection to " + open.target().uri() + " closed by peer");
                setState(open.toClosed(failure));
                LOGGER.info("Connection to {} closed by peer", open.target().uri());
            }
            else if (state instanceof ConnectionState.Closing closing) {
                // requested by close(), so the listener is not told
                failure = null;
                setState(closing.toClosed(null));
                toComplete = closedFuture;
                closedFuture = null;
                LOGGER.debug("Connection to {} closed", closing.target().uri());
            }
            else {
                return;
            }
        }
        if (toComplete != null) {
            toComplete.complete(null);
        }
        else if (failure == null) {
            onConnectionFailed(source, new TransportException("Connection closed during websocket upgrade"));
        }
        else {
            listener.onClosed(failure);
        }
    }

    /**
     * Called when an error reaches the end of the pipeline.
     * Called from DdpChannelHandler.
     */
    void onConnectionError(DdpChannelHandler source, Throwable cause) {
        TransportException failure = null;
        Channel toClose;
        synchronized (this) {
            if (source != handler) {
                return;
            }
            LOGGER.warn("Error on connection in state {}: {}", state, cause.getMessage());
            if (state instanceof ConnectionState.Connecting) {
                toClose = null;
            }
            else {
                if (errorCounter != null) {
                    errorCounter.increment();
                }
                if (state instanceof ConnectionState.Open open) {
                    failure = asTransportException("Connection to " + open.target().uri() + " failed", cause);
                    setState(open.toClosed(failure));
                }
                toClose = channel;
            }
        }
        if (toClose == null) {
            onConnectionFailed(source, cause);
            return;
        }
        closeChannel(toClose);
        if (failure != null) {
            listener.onClosed(failure);
        }
    }

    /**
     * Close the connection. The listener is not notified; callers clean up their own state.
     */
    @Override
    public void close() {
        TransportException failure = null;
        CompletableFuture<Void> toFail = null;
        Channel toClose;
        DdpChannelHandler closingHandler = null;
        synchronized (this) {
            if (state instanceof ConnectionState.Open open) {
                LOGGER.debug("Closing connection to {}", open.target().uri());
                setState(open.toClosing());
                closedFuture = new CompletableFuture<>();
                closingHandler = handler;
                toClose = channel;
            }
            else if (state instanceof ConnectionState.Connecting connecting) {
                failure = new TransportException("Connection to " + connecting.target().uri() + " closed before it was established");
                setState(connecting.toClosed(failure));
                toFail = openFuture;
                toClose = channel;
            }
            else {
                // Closing or Closed
                return;
            }
        }
        if (closingHandler != null) {
            closingHandler.inClosing();
        }
        else {
            closeChannel(toClose);
        }
        if (toFail != null) {
            toFail.completeExceptionally(failure);
        }
    }

    // ==================== Message Handling ====================

    @Override
    public CompletableFuture<Void> send(DdpMessage message) {
        Objects.requireNonNull(message);
        ConnectionState current;
        DdpChannelHandler currentHandler;
        synchronized (this) {
            current = state;
            currentHandler = handler;
        }
        if (!current.canSend() || currentHandler == null) {
            return CompletableFuture.failedFuture(new TransportException("Cannot send " + message.kind() + " message, connection is " + current));
        }
        CompletableFuture<Void> written = new CompletableFuture<>();
        try {
            currentHandler.sendToServer(message).addListener((ChannelFuture f) -> {
                if (f.isSuccess()) {
                    written.complete(null);
                }
                else {
                    written.completeExceptionally(asTransportException("Failed to send " + message.kind() + " message", f.cause()));
                }
            });
        }
        catch (IllegalStateException e) {
            written.completeExceptionally(new TransportException("Cannot send " + message.kind() + " message: " + e.getMessage(), e));
        }
        return written;
    }

    /**
     * Called when a message has been decoded.
     * Called from DdpChannelHandler.channelRead().
     */
    void onMessage(DdpChannelHandler source, DdpMessage message) {
        if (source != handler) {
            LOGGER.debug("Dropping {} from a replaced connection", message.kind());
            return;
        }
        try {
            listener.onMessage(message);
        }
        catch (RuntimeException e) {
            LOGGER.error("Listener failed to process {} message", message.kind(), e);
        }
    }

    // ==================== Pipeline Configuration ====================

    @VisibleForTesting
    Bootstrap configureBootstrap() {
        return new Bootstrap()
                .group(group)
                .channel(channelClass)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis());
    }

    private void configurePipeline(
                                   ChannelPipeline pipeline,
                                   ServiceEndpoint endpoint,
                                   Optional<SslContext> sslContext,
                                   DdpChannelHandler connectionHandler) {

        sslContext.ifPresent(ssl -> pipeline.addLast("ssl",
                ssl.newHandler(pipeline.channel().alloc(), endpoint.host(), endpoint.port())));

        if (logNetwork) {
            pipeline.addLast("networkLogger",
                    new LoggingHandler("io.arasaka.truenas.internal.NetworkLogger", LogLevel.INFO));
        }

        pipeline.addLast("httpCodec", new HttpClientCodec());
        pipeline.addLast("httpAggregator", new HttpObjectAggregator(MAX_CONTENT_LENGTH));
        pipeline.addLast("websocket", new WebSocketClientProtocolHandler(websocketConfig(endpoint)));
        pipeline.addLast("frameAggregator", new WebSocketFrameAggregator(MAX_CONTENT_LENGTH));

        if (logFrames) {
            pipeline.addLast("frameLogger",
                    new LoggingHandler("io.arasaka.truenas.internal.FrameLogger", LogLevel.INFO));
        }

        pipeline.addLast("ddpCodec", new DdpFrameCodec());
        pipeline.addLast("ddpHandler", connectionHandler);

        LOGGER.debug("Configured pipeline for {}: {}", endpoint.uri(), pipeline.names());
    }

    private WebSocketClientProtocolConfig websocketConfig(ServiceEndpoint endpoint) {
        return WebSocketClientProtocolConfig.newBuilder()
                .webSocketUri(endpoint.uri())
                .version(WebSocketVersion.V13)
                .maxFramePayloadLength(MAX_CONTENT_LENGTH)
                .handshakeTimeoutMillis(connectTimeout.toMillis())
                .build();
    }

    @VisibleForTesting
    static Optional<SslContext> buildSslContext(ServiceEndpoint endpoint) throws SSLException {
        if (!endpoint.tls()) {
            return Optional.empty();
        }
        SslContextBuilder builder = SslContextBuilder.forClient();
        if (endpoint.insecure()) {
            // TrueNAS ships with a self-signed certificate
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        }
        return Optional.of(builder.build());
    }

    // ==================== Internal State Management ====================

    private void setState(ConnectionState newState) {
        LOGGER.trace("Connection state {} -> {}", state, newState);
        this.state = newState;
    }

    private static void closeChannel(@Nullable Channel toClose) {
        if (toClose != null && toClose.isOpen()) {
            toClose.close();
        }
    }

    private static TransportException asTransportException(String message, Throwable cause) {
        if (cause instanceof TransportException transportException) {
            return transportException;
        }
        return new TransportException(message + ": " + cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return "NettyTransport{" +
                "state=" + state +
                ", channel=" + channel +
                '}';
    }
}
