/*
 * Copyright Arasaka Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.arasaka.truenas.config;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.arasaka.truenas.service.HostPort;
import io.arasaka.truenas.service.ServiceEndpoint;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Where the server is and how to authenticate with it.
 *
 * @param host host name or address, optionally with {@code :port}
 * @param port port; defaults to 443 with TLS and 80 without
 * @param apiKey API key used to log in
 * @param tls connect with {@code wss} rather than {@code ws}
 * @param insecure accept any server certificate (TrueNAS ships self-signed)
 * @param path websocket path
 */
public record ServerConfig(String host, int port, String apiKey, boolean tls, boolean insecure, String path) {

    public ServerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(path, "path");
    }

    @JsonCreator
    public static ServerConfig of(@JsonProperty("host") String host,
                                  @JsonProperty("port") @Nullable Integer port,
                                  @JsonProperty("apiKey") String apiKey,
                                  @JsonProperty("tls") @Nullable Boolean tls,
                                  @JsonProperty("insecure") @Nullable Boolean insecure,
                                  @JsonProperty("path") @Nullable String path) {
        boolean useTls = tls == null || tls;
        int defaultPort = useTls ? 443 : 80;
        HostPort hostPort = HostPort.parse(host, port == null ? defaultPort : port);
        return new ServerConfig(
                hostPort.host(),
                port == null ? hostPort.port() : port,
                apiKey,
                useTls,
                insecure == null || insecure,
                path == null || path.isBlank() ? ServiceEndpoint.DEFAULT_PATH : path);
    }

    public static ServerConfig of(String host, String apiKey) {
        return of(host, null, apiKey, null, null, null);
    }

    public ServiceEndpoint serviceEndpoint() {
        return new ServiceEndpoint(new HostPort(host, port), path, tls, insecure);
    }

    // never print the key
    @Override
    public String toString() {
        return "ServerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", tls=" + tls +
                ", insecure=" + insecure +
                ", path='" + path + '\'' +
                '}';
    }
}
