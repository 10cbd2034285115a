/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.arasaka.truenas.config.ClientConfig;
import io.arasaka.truenas.config.ServerConfig;
import io.arasaka.truenas.frame.DdpMessage;
import io.arasaka.truenas.internal.ConnectionState;
import io.arasaka.truenas.internal.NettyTransport;
import io.arasaka.truenas.internal.Transport;
import io.arasaka.truenas.internal.TransportListener;
import io.arasaka.truenas.internal.job.JobPoller;
import io.arasaka.truenas.internal.rpc.MessageCorrelator;
import io.arasaka.truenas.internal.session.SessionGate;
import io.arasaka.truenas.model.App;
import io.arasaka.truenas.model.AppCreateRequest;
import io.arasaka.truenas.service.ServiceEndpoint;
import io.arasaka.truenas.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Client for the TrueNAS websocket API.
 *
 * <p>One client holds at most one connection. It is opened, handshaken and authenticated on the
 * first call and shared by every call after that; if it is lost, every call waiting on it fails
 * and the next call opens a new one. Nothing is retried.</p>
 *
 * <p>All operations are asynchronous. Failures are reported by completing the returned future
 * exceptionally with an {@link RpcException} subtype; {@link RpcException#rethrow(Throwable)}
 * recovers the typed failure for blocking callers.</p>
 *
 * <pre>{@code
 * try (TrueNasClient client = TrueNasClient.create("nas.local", apiKey)) {
 *     Optional<App> app = client.getByName("web").get();
 * }
 * }</pre>
 */
public class TrueNasClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrueNasClient.class);

    static final String SYSTEM_INFO = "system.info";
    static final String APP_GET_INSTANCE = "app.get_instance";
    static final String APP_CREATE = "app.create";
    static final String APP_UPDATE = "app.update";
    static final String APP_START = "app.start";
    static final String APP_STOP = "app.stop";
    static final String APP_PULL_IMAGES = "app.pull_images";

    private final ClientConfig config;
    private final ServiceEndpoint endpoint;
    private final Transport transport;
    private final MessageCorrelator correlator;
    private final SessionGate gate;
    private final JobPoller poller;
    private final @Nullable EventLoopGroup ownedGroup;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a client for {@code host} (optionally {@code host:port}) using {@code wss} and the default settings.
     */
    public static TrueNasClient create(String host, String apiKey) {
        return create(ClientConfig.of(ServerConfig.of(host, apiKey)));
    }

    public static TrueNasClient create(ClientConfig config) {
        Objects.requireNonNull(config, "config");
        EventLoopGroup group = new NioEventLoopGroup(1, new DefaultThreadFactory("truenas-client", true));
        return new TrueNasClient(
                config,
                listener -> new NettyTransport(group, NioSocketChannel.class, listener, config.callTimeout(), config.logNetwork(), config.logFrames()),
                group,
                group);
    }

    @VisibleForTesting
    TrueNasClient(
                  ClientConfig config,
                  Function<TransportListener, Transport> transportFactory,
                  ScheduledExecutorService scheduler,
                  @Nullable EventLoopGroup ownedGroup) {
        this.config = Objects.requireNonNull(config);
        this.endpoint = config.server().serviceEndpoint();
        this.ownedGroup = ownedGroup;
        this.transport = Objects.requireNonNull(transportFactory.apply(new Dispatcher()));
        this.correlator = new MessageCorrelator(transport, scheduler, config.callTimeout());
        this.gate = new SessionGate(transport, correlator, endpoint, config.server().apiKey(), config.callTimeout(), scheduler);
        this.poller = new JobPoller(correlator, scheduler, config.jobPollInterval(), config.jobTimeout());
    }

    // ==================== Generic calls ====================

    /**
     * Calls a remote method once the session is authenticated.
     *
     * @param method remote method name
     * @param params positional parameters, converted to JSON
     * @return future completing with the method's result
     */
    public CompletableFuture<JsonNode> call(String method, List<?> params) {
        return call(method, params, config.callTimeout());
    }

    public CompletableFuture<JsonNode> call(String method, List<?> params, Duration timeout) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(timeout, "timeout");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new TransportException("Client is closed"));
        }
        return gate.ensureAuthenticated()
                .thenCompose(ignored -> correlator.call(method, params, timeout));
    }

    /**
     * Calls a remote method that starts a background job, then waits for the job to finish.
     * Cancelling the returned future stops waiting; the job itself keeps running on the server.
     *
     * @param method remote method name
     * @param params positional parameters, converted to JSON
     * @return future completing with the job's result
     */
    public CompletableFuture<JsonNode> callJob(String method, List<?> params) {
        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        call(method, params).whenComplete((jobId, failure) -> {
            if (failure != null) {
                result.completeExceptionally(RpcException.unwrap(failure));
                return;
            }
            CompletableFuture<JsonNode> wait;
            try {
                wait = poller.awaitJob(jobId);
            }
            catch (IllegalArgumentException e) {
                result.completeExceptionally(e);
                return;
            }
            LOGGER.debug("{} started job {}", method, jobId);
            result.whenComplete((value, resultFailure) -> {
                if (result.isCancelled()) {
                    wait.cancel(false);
                }
            });
            wait.whenComplete((value, waitFailure) -> {
                if (waitFailure != null) {
                    result.completeExceptionally(RpcException.unwrap(waitFailure));
                }
                else {
                    result.complete(value);
                }
            });
        });
        return result;
    }

    // ==================== Operations ====================

    /**
     * @return future completing with true if a session could be established and the server answered
     *         {@code system.info}; never fails
     */
    public CompletableFuture<Boolean> testConnection() {
        return call(SYSTEM_INFO, List.of()).handle((info, failure) -> {
            if (failure != null) {
                LOGGER.warn("Connection test against {} failed: {}", endpoint.hostPort(), RpcException.unwrap(failure).getMessage());
                return false;
            }
            LOGGER.info("Connected to {} running {}", endpoint.hostPort(), info.path("version").asText("an unknown version"));
            return true;
        });
    }

    /**
     * @return future completing with the app, or empty if the server does not know it
     */
    public CompletableFuture<Optional<App>> getByName(String name) {
        requireName(name, "name");
        return call(APP_GET_INSTANCE, List.of(name)).handle((instance, failure) -> {
            if (failure != null) {
                Throwable cause = RpcException.unwrap(failure);
                if (cause instanceof RemoteException) {
                    LOGGER.debug("App {} not found: {}", name, cause.getMessage());
                    return Optional.empty();
                }
                throw new CompletionException(cause);
            }
            if (instance == null || instance.isNull()) {
                return Optional.empty();
            }
            return Optional.of(App.fromJson(instance));
        });
    }

    public CompletableFuture<App> getStatus(String id) {
        requireName(id, "id");
        return call(APP_GET_INSTANCE, List.of(id)).thenApply(App::fromJson);
    }

    public CompletableFuture<JsonNode> create(AppCreateRequest request) {
        Objects.requireNonNull(request, "request");
        return create(request.toJson());
    }

    /**
     * Creates an app. {@code spec} is sent as is.
     */
    public CompletableFuture<JsonNode> create(JsonNode spec) {
        Objects.requireNonNull(spec, "spec");
        return callJob(APP_CREATE, List.of(spec));
    }

    /**
     * Updates an app. {@code spec} is sent as is.
     */
    public CompletableFuture<JsonNode> update(String name, JsonNode spec) {
        requireName(name, "name");
        Objects.requireNonNull(spec, "spec");
        return callJob(APP_UPDATE, List.of(name, spec));
    }

    public CompletableFuture<JsonNode> start(String id) {
        requireName(id, "id");
        return call(APP_START, List.of(id));
    }

    public CompletableFuture<JsonNode> stop(String id) {
        requireName(id, "id");
        return call(APP_STOP, List.of(id));
    }

    public CompletableFuture<JsonNode> pullAndRedeploy(String name) {
        return pullImages(name, true);
    }

    /**
     * Pulls the images of an app, redeploying it afterwards if {@code redeploy} is set.
     */
    public CompletableFuture<JsonNode> pullImages(String name, boolean redeploy) {
        requireName(name, "name");
        return callJob(APP_PULL_IMAGES, List.of(name, Map.of("redeploy", redeploy)));
    }

    // ==================== Lifecycle ====================

    /**
     * Closes the connection. Every call and job wait still in progress fails with a
     * {@link TransportException}; the next call connects again.
     */
    public void disconnect() {
        LOGGER.debug("Disconnecting from {}", endpoint.uri());
        TransportException cause = new TransportException("client disconnected");
        poller.failAll(cause);
        correlator.failAll(cause);
        gate.onTransportClosed(cause);
        transport.close();
    }

    /**
     * Disconnects and releases the client's threads. Calls made afterwards fail.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        disconnect();
        if (ownedGroup != null) {
            ownedGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        LOGGER.info("Client for {} closed", endpoint.hostPort());
    }

    // ==================== Accessors ====================

    public boolean isAuthenticated() {
        return gate.isAuthenticated();
    }

    public ConnectionState connectionState() {
        return transport.state();
    }

    public int pendingRequestCount() {
        return correlator.pendingCount();
    }

    public ClientConfig config() {
        return config;
    }

    private static void requireName(@Nullable String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
    }

    /**
     * Routes what the transport reads to the component waiting for it.
     */
    private final class Dispatcher implements TransportListener {

        @Override
        public void onMessage(DdpMessage message) {
            if (message instanceof DdpMessage.Connected || message instanceof DdpMessage.Failed) {
                gate.onHandshakeReply(message);
            }
            else if (message instanceof DdpMessage.MethodResult || message instanceof DdpMessage.MethodError) {
                correlator.onMessage(message);
            }
            else if (message instanceof DdpMessage.Ping ping) {
                transport.send(new DdpMessage.Pong(ping.id()));
            }
            else {
                LOGGER.debug("Ignoring {} message", message.kind());
            }
        }

        @Override
        public void onClosed(TransportException cause) {
            poller.failAll(cause);
            correlator.failAll(cause);
            gate.onTransportClosed(cause);
        }
    }

    @Override
    public String toString() {
        return "TrueNasClient{" +
                "endpoint=" + endpoint.uri() +
                ", state=" + transport.state() +
                '}';
    }
}
